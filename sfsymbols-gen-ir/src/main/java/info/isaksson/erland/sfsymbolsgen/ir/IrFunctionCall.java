package info.isaksson.erland.sfsymbolsgen.ir;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * {@code called(arguments) { trailing closure }}. More than one argument renders one argument per line.
 */
@JsonPropertyOrder({"calledExpression","arguments","trailingClosure"})
public final class IrFunctionCall extends IrExpression {
    public final IrExpression calledExpression;
    public final List<IrFunctionArgument> arguments;
    public final IrClosureInvocation trailingClosure;

    public IrFunctionCall(IrExpression calledExpression, List<IrFunctionArgument> arguments, IrClosureInvocation trailingClosure) {
        this.calledExpression = Objects.requireNonNull(calledExpression, "calledExpression must not be null");
        this.arguments = arguments == null ? List.of() : List.copyOf(arguments);
        this.trailingClosure = trailingClosure;
    }

    public static IrFunctionCall of(IrExpression calledExpression, List<IrFunctionArgument> arguments) {
        return new IrFunctionCall(calledExpression, arguments, null);
    }

    @Override public IrExpressionKind kind() {
        return IrExpressionKind.FUNCTION_CALL;
    }
}
