package info.isaksson.erland.sfsymbolsgen.ir;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/** {@code if ... { } else if ... { } else { }} */
@JsonPropertyOrder({"ifBranch","elseIfBranches","elseBody"})
public final class IrIf extends IrExpression {
    public final IrIfBranch ifBranch;
    public final List<IrIfBranch> elseIfBranches;
    public final List<IrCodeBlock> elseBody;

    public IrIf(IrIfBranch ifBranch, List<IrIfBranch> elseIfBranches, List<IrCodeBlock> elseBody) {
        this.ifBranch = Objects.requireNonNull(ifBranch, "ifBranch must not be null");
        this.elseIfBranches = elseIfBranches == null ? List.of() : List.copyOf(elseIfBranches);
        this.elseBody = elseBody == null ? null : List.copyOf(elseBody);
    }

    @Override public IrExpressionKind kind() {
        return IrExpressionKind.IF;
    }
}
