package info.isaksson.erland.sfsymbolsgen.ir;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

@JsonPropertyOrder({"left","operator","right"})
public final class IrBinaryOperation extends IrExpression {
    public final IrExpression left;
    public final IrBinaryOperator operator;
    public final IrExpression right;

    public IrBinaryOperation(IrExpression left, IrBinaryOperator operator, IrExpression right) {
        this.left = Objects.requireNonNull(left, "left must not be null");
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.right = Objects.requireNonNull(right, "right must not be null");
    }

    @Override public IrExpressionKind kind() {
        return IrExpressionKind.BINARY_OPERATION;
    }
}
