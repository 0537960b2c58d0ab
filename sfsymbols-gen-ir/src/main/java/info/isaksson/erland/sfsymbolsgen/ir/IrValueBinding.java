package info.isaksson.erland.sfsymbolsgen.ir;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** {@code let value(...)} as used in pattern positions. */
@JsonPropertyOrder({"bindingKind","value"})
public final class IrValueBinding extends IrExpression {
    public final IrBindingKind bindingKind;
    public final IrFunctionCall value;

    public IrValueBinding(IrBindingKind bindingKind, IrFunctionCall value) {
        this.bindingKind = Objects.requireNonNull(bindingKind, "bindingKind must not be null");
        this.value = Objects.requireNonNull(value, "value must not be null");
    }

    @Override public IrExpressionKind kind() {
        return IrExpressionKind.VALUE_BINDING;
    }
}
