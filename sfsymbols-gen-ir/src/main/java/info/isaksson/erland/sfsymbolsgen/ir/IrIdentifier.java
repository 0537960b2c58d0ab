package info.isaksson.erland.sfsymbolsgen.ir;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** A bare identifier/pattern, or a reference to a type used in expression position. */
@JsonPropertyOrder({"pattern","type"})
public final class IrIdentifier extends IrExpression {
    public final String pattern;
    public final IrTypeRef type;

    private IrIdentifier(String pattern, IrTypeRef type) {
        this.pattern = pattern;
        this.type = type;
    }

    public static IrIdentifier pattern(String pattern) {
        if (pattern == null || pattern.isEmpty()) throw new IllegalArgumentException("pattern must not be empty");
        return new IrIdentifier(pattern, null);
    }

    public static IrIdentifier type(IrTypeRef type) {
        if (type == null) throw new IllegalArgumentException("type must not be null");
        return new IrIdentifier(null, type);
    }

    @Override public IrExpressionKind kind() {
        return IrExpressionKind.IDENTIFIER;
    }
}
