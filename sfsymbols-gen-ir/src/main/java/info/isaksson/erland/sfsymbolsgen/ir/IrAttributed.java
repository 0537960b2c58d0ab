package info.isaksson.erland.sfsymbolsgen.ir;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** A declaration preceded by an availability attribute line. Wrapping nests: outer attributes render first. */
@JsonPropertyOrder({"attribute","declaration"})
public final class IrAttributed extends IrDeclaration {
    public final IrAvailability attribute;
    public final IrDeclaration declaration;

    public IrAttributed(IrAvailability attribute, IrDeclaration declaration) {
        this.attribute = Objects.requireNonNull(attribute, "attribute must not be null");
        this.declaration = Objects.requireNonNull(declaration, "declaration must not be null");
    }

    @Override public IrDeclarationKind kind() {
        return IrDeclarationKind.ATTRIBUTED;
    }
}
