package info.isaksson.erland.sfsymbolsgen.mutate;

import info.isaksson.erland.sfsymbolsgen.catalog.SymbolCatalog;
import info.isaksson.erland.sfsymbolsgen.ir.IrDeclaration;

import java.util.List;
import java.util.Objects;

/** Fixed, ordered list of mutators applied to every generated accessor. */
public final class MutatorChain {

    private final List<DeclarationMutator> mutators;

    public MutatorChain(List<DeclarationMutator> mutators) {
        this.mutators = List.copyOf(Objects.requireNonNull(mutators, "mutators must not be null"));
    }

    /**
     * Deprecation, then availability, then restriction. Since each attribute is inserted right under
     * the comment, the platform attribute renders above the deprecation attribute.
     */
    public static MutatorChain standard(SymbolCatalog catalog) {
        return new MutatorChain(List.of(
                new DeprecationMutator(catalog.nameAliases()),
                new AvailabilityMutator(catalog),
                new RestrictionMutator(catalog.restrictions())
        ));
    }

    public IrDeclaration apply(IrDeclaration declaration, String symbolName) {
        IrDeclaration current = declaration;
        for (DeclarationMutator mutator : mutators) {
            current = mutator.mutate(current, symbolName);
        }
        return current;
    }

    public List<DeclarationMutator> mutators() {
        return mutators;
    }
}
