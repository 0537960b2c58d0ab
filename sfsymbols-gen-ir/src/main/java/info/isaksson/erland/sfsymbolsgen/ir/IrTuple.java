package info.isaksson.erland.sfsymbolsgen.ir;

import java.util.List;

/** {@code (a, b, c)} */
public final class IrTuple extends IrExpression {
    public final List<IrExpression> members;

    public IrTuple(List<IrExpression> members) {
        this.members = members == null ? List.of() : List.copyOf(members);
    }

    @Override public IrExpressionKind kind() {
        return IrExpressionKind.TUPLE;
    }
}
