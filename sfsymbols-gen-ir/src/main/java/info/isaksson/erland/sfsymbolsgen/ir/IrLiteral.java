package info.isaksson.erland.sfsymbolsgen.ir;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * A literal value. Only the fields belonging to {@link #literalKind} are meaningful.
 */
@JsonPropertyOrder({"literalKind","stringValue","intValue","floatValue","precision","boolValue","items"})
public final class IrLiteral extends IrExpression {
    public final IrLiteralKind literalKind;
    public final String stringValue;
    public final long intValue;
    public final double floatValue;

    /** Number of decimal digits for {@link IrLiteralKind#FLOAT}. */
    public final int precision;
    public final boolean boolValue;
    public final List<IrExpression> items;

    private IrLiteral(IrLiteralKind literalKind, String stringValue, long intValue, double floatValue, int precision,
                      boolean boolValue, List<IrExpression> items) {
        this.literalKind = literalKind;
        this.stringValue = stringValue;
        this.intValue = intValue;
        this.floatValue = floatValue;
        this.precision = precision;
        this.boolValue = boolValue;
        this.items = items == null ? List.of() : List.copyOf(items);
    }

    public static IrLiteral string(String value) {
        return new IrLiteral(IrLiteralKind.STRING, Objects.requireNonNull(value, "value must not be null"), 0, 0, 0, false, null);
    }

    public static IrLiteral integer(long value) {
        return new IrLiteral(IrLiteralKind.INT, null, value, 0, 0, false, null);
    }

    public static IrLiteral floating(double value, int precision) {
        if (precision < 0) throw new IllegalArgumentException("precision must be >= 0");
        return new IrLiteral(IrLiteralKind.FLOAT, null, 0, value, precision, false, null);
    }

    public static IrLiteral bool(boolean value) {
        return new IrLiteral(IrLiteralKind.BOOL, null, 0, 0, 0, value, null);
    }

    public static IrLiteral nil() {
        return new IrLiteral(IrLiteralKind.NIL, null, 0, 0, 0, false, null);
    }

    public static IrLiteral array(List<IrExpression> items) {
        return new IrLiteral(IrLiteralKind.ARRAY, null, 0, 0, 0, false, items);
    }

    @Override public IrExpressionKind kind() {
        return IrExpressionKind.LITERAL;
    }
}
