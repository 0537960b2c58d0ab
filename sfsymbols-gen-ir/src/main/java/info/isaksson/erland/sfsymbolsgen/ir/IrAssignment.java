package info.isaksson.erland.sfsymbolsgen.ir;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

@JsonPropertyOrder({"left","right"})
public final class IrAssignment extends IrExpression {
    public final IrExpression left;
    public final IrExpression right;

    public IrAssignment(IrExpression left, IrExpression right) {
        this.left = Objects.requireNonNull(left, "left must not be null");
        this.right = Objects.requireNonNull(right, "right must not be null");
    }

    @Override public IrExpressionKind kind() {
        return IrExpressionKind.ASSIGNMENT;
    }
}
