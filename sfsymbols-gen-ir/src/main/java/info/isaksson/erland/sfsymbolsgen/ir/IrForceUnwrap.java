package info.isaksson.erland.sfsymbolsgen.ir;

import java.util.Objects;

/** {@code expr!} */
public final class IrForceUnwrap extends IrExpression {
    public final IrExpression referencedExpression;

    public IrForceUnwrap(IrExpression referencedExpression) {
        this.referencedExpression = Objects.requireNonNull(referencedExpression, "referencedExpression must not be null");
    }

    @Override public IrExpressionKind kind() {
        return IrExpressionKind.FORCE_UNWRAP;
    }
}
