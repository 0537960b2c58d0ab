package info.isaksson.erland.sfsymbolsgen.ir;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * An enum declaration. {@code isFrozen} only takes effect for public and package enums.
 */
@JsonPropertyOrder({"isFrozen","isIndirect","accessModifier","name","conformances","members"})
public final class IrEnum extends IrDeclaration {
    public final boolean isFrozen;
    public final boolean isIndirect;
    public final IrAccessModifier accessModifier;
    public final String name;
    public final List<String> conformances;
    public final List<IrDeclaration> members;

    public IrEnum(
            boolean isFrozen,
            boolean isIndirect,
            IrAccessModifier accessModifier,
            String name,
            List<String> conformances,
            List<IrDeclaration> members
    ) {
        this.isFrozen = isFrozen;
        this.isIndirect = isIndirect;
        this.accessModifier = accessModifier;
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.conformances = conformances == null ? List.of() : List.copyOf(conformances);
        this.members = members == null ? List.of() : List.copyOf(members);
    }

    @Override public IrDeclarationKind kind() {
        return IrDeclarationKind.ENUM;
    }
}
