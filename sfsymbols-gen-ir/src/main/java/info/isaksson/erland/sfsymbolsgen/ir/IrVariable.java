package info.isaksson.erland.sfsymbolsgen.ir;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * A {@code var}/{@code let} declaration, stored or computed.
 *
 * <p>A non-null {@code getter} makes the variable computed. When {@code getterEffects},
 * {@code setter} or {@code modify} are present the getter is rendered as an explicit {@code get} block.</p>
 */
@JsonPropertyOrder({"accessModifier","isStatic","bindingKind","left","type","right","getter","getterEffects","setter","modify"})
public final class IrVariable extends IrDeclaration {
    public final IrAccessModifier accessModifier;
    public final boolean isStatic;
    public final IrBindingKind bindingKind;
    public final IrExpression left;
    public final IrTypeRef type;
    public final IrExpression right;
    public final List<IrCodeBlock> getter;
    public final List<IrFunctionKeyword> getterEffects;
    public final List<IrCodeBlock> setter;
    public final List<IrCodeBlock> modify;

    public IrVariable(
            IrAccessModifier accessModifier,
            boolean isStatic,
            IrBindingKind bindingKind,
            IrExpression left,
            IrTypeRef type,
            IrExpression right,
            List<IrCodeBlock> getter,
            List<IrFunctionKeyword> getterEffects,
            List<IrCodeBlock> setter,
            List<IrCodeBlock> modify
    ) {
        this.accessModifier = accessModifier;
        this.isStatic = isStatic;
        this.bindingKind = bindingKind == null ? IrBindingKind.VAR : bindingKind;
        this.left = Objects.requireNonNull(left, "left must not be null");
        this.type = type;
        this.right = right;
        this.getter = getter == null ? null : List.copyOf(getter);
        this.getterEffects = getterEffects == null ? List.of() : List.copyOf(getterEffects);
        this.setter = setter == null ? null : List.copyOf(setter);
        this.modify = modify == null ? null : List.copyOf(modify);
    }

    /** {@code <access> [static] let name: type} */
    public static IrVariable stored(IrAccessModifier accessModifier, boolean isStatic, IrBindingKind kind, String name, IrTypeRef type) {
        return new IrVariable(accessModifier, isStatic, kind, IrIdentifier.pattern(name), type, null, null, null, null, null);
    }

    /** {@code <access> [static] var name: type { body }} */
    public static IrVariable computed(IrAccessModifier accessModifier, boolean isStatic, String name, IrTypeRef type, List<IrCodeBlock> body) {
        return new IrVariable(accessModifier, isStatic, IrBindingKind.VAR, IrIdentifier.pattern(name), type, null,
                Objects.requireNonNull(body, "body must not be null"), null, null, null);
    }

    @Override public IrDeclarationKind kind() {
        return IrDeclarationKind.VARIABLE;
    }
}
