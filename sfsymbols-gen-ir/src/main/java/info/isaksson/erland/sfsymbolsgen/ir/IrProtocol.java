package info.isaksson.erland.sfsymbolsgen.ir;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

@JsonPropertyOrder({"accessModifier","name","conformances","members"})
public final class IrProtocol extends IrDeclaration {
    public final IrAccessModifier accessModifier;
    public final String name;
    public final List<String> conformances;
    public final List<IrDeclaration> members;

    public IrProtocol(IrAccessModifier accessModifier, String name, List<String> conformances, List<IrDeclaration> members) {
        this.accessModifier = accessModifier;
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.conformances = conformances == null ? List.of() : List.copyOf(conformances);
        this.members = members == null ? List.of() : List.copyOf(members);
    }

    @Override public IrDeclarationKind kind() {
        return IrDeclarationKind.PROTOCOL;
    }
}
