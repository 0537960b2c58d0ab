package info.isaksson.erland.sfsymbolsgen.ir;

import java.util.Objects;

/** {@code &expr} */
public final class IrInOut extends IrExpression {
    public final IrExpression referencedExpression;

    public IrInOut(IrExpression referencedExpression) {
        this.referencedExpression = Objects.requireNonNull(referencedExpression, "referencedExpression must not be null");
    }

    @Override public IrExpressionKind kind() {
        return IrExpressionKind.IN_OUT;
    }
}
