package info.isaksson.erland.sfsymbolsgen.ir;

import java.util.Objects;

/** {@code expr?} */
public final class IrOptionalChaining extends IrExpression {
    public final IrExpression referencedExpression;

    public IrOptionalChaining(IrExpression referencedExpression) {
        this.referencedExpression = Objects.requireNonNull(referencedExpression, "referencedExpression must not be null");
    }

    @Override public IrExpressionKind kind() {
        return IrExpressionKind.OPTIONAL_CHAINING;
    }
}
