package info.isaksson.erland.sfsymbolsgen.ir;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

@JsonPropertyOrder({"argumentNames","body"})
public final class IrClosureInvocation extends IrExpression {
    public final List<String> argumentNames;
    public final List<IrCodeBlock> body;

    public IrClosureInvocation(List<String> argumentNames, List<IrCodeBlock> body) {
        this.argumentNames = argumentNames == null ? List.of() : List.copyOf(argumentNames);
        this.body = body == null ? null : List.copyOf(body);
    }

    @Override public IrExpressionKind kind() {
        return IrExpressionKind.CLOSURE_INVOCATION;
    }
}
