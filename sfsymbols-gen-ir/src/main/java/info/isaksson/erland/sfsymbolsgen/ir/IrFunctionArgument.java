package info.isaksson.erland.sfsymbolsgen.ir;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

@JsonPropertyOrder({"label","expression"})
public final class IrFunctionArgument {
    public final String label;
    public final IrExpression expression;

    public IrFunctionArgument(String label, IrExpression expression) {
        this.label = label;
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
    }

    public static IrFunctionArgument of(String label, IrExpression expression) {
        return new IrFunctionArgument(label, expression);
    }
}
