package info.isaksson.erland.sfsymbolsgen.ir;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

@JsonPropertyOrder({"condition","body"})
public final class IrIfBranch {
    public final IrExpression condition;
    public final List<IrCodeBlock> body;

    public IrIfBranch(IrExpression condition, List<IrCodeBlock> body) {
        this.condition = Objects.requireNonNull(condition, "condition must not be null");
        this.body = body == null ? List.of() : List.copyOf(body);
    }
}
