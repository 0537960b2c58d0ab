package info.isaksson.erland.sfsymbolsgen.ir;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * {@code extension OnType: Conformances where Requirements { declarations }}.
 *
 * <p>Where-clause requirements are pre-formatted, e.g. {@code "Element: Hashable"}.</p>
 */
@JsonPropertyOrder({"accessModifier","onType","conformances","whereRequirements","declarations"})
public final class IrExtension extends IrDeclaration {
    public final IrAccessModifier accessModifier;
    public final String onType;
    public final List<String> conformances;
    public final List<String> whereRequirements;
    public final List<IrDeclaration> declarations;

    public IrExtension(
            IrAccessModifier accessModifier,
            String onType,
            List<String> conformances,
            List<String> whereRequirements,
            List<IrDeclaration> declarations
    ) {
        this.accessModifier = accessModifier;
        this.onType = Objects.requireNonNull(onType, "onType must not be null");
        this.conformances = conformances == null ? List.of() : List.copyOf(conformances);
        this.whereRequirements = whereRequirements == null ? List.of() : List.copyOf(whereRequirements);
        this.declarations = declarations == null ? List.of() : List.copyOf(declarations);
    }

    public static IrExtension of(String onType, List<IrDeclaration> declarations) {
        return new IrExtension(null, onType, null, null, declarations);
    }

    @Override public IrDeclarationKind kind() {
        return IrDeclarationKind.EXTENSION;
    }
}
