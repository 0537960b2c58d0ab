package info.isaksson.erland.sfsymbolsgen.mutate;

import info.isaksson.erland.sfsymbolsgen.ir.IrAvailability;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/** Marks names listed in the alias table as deprecated in favour of their current name. */
public final class DeprecationMutator extends AttributeMutator {

    public static final String MESSAGE = "This name has been deprecated. You should use a more modern name "
            + "if your app does not need to support older platforms.";

    private final Map<String, String> nameAliases;

    public DeprecationMutator(Map<String, String> nameAliases) {
        this.nameAliases = Objects.requireNonNull(nameAliases, "nameAliases must not be null");
    }

    @Override
    protected Optional<IrAvailability> attributeFor(String symbolName) {
        String renamed = nameAliases.get(symbolName);
        if (renamed == null) return Optional.empty();
        return Optional.of(IrAvailability.deprecated(MESSAGE, renamed));
    }
}
