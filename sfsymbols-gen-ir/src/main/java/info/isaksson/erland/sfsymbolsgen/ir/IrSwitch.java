package info.isaksson.erland.sfsymbolsgen.ir;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

@JsonPropertyOrder({"switchedExpression","cases"})
public final class IrSwitch extends IrExpression {
    public final IrExpression switchedExpression;
    public final List<IrSwitchCase> cases;

    public IrSwitch(IrExpression switchedExpression, List<IrSwitchCase> cases) {
        this.switchedExpression = Objects.requireNonNull(switchedExpression, "switchedExpression must not be null");
        this.cases = cases == null ? List.of() : List.copyOf(cases);
    }

    @Override public IrExpressionKind kind() {
        return IrExpressionKind.SWITCH;
    }
}
