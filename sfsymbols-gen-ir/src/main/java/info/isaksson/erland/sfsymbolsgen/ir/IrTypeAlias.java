package info.isaksson.erland.sfsymbolsgen.ir;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

@JsonPropertyOrder({"accessModifier","name","existingType"})
public final class IrTypeAlias extends IrDeclaration {
    public final IrAccessModifier accessModifier;
    public final String name;
    public final IrTypeRef existingType;

    public IrTypeAlias(IrAccessModifier accessModifier, String name, IrTypeRef existingType) {
        this.accessModifier = accessModifier;
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.existingType = Objects.requireNonNull(existingType, "existingType must not be null");
    }

    @Override public IrDeclarationKind kind() {
        return IrDeclarationKind.TYPEALIAS;
    }
}
