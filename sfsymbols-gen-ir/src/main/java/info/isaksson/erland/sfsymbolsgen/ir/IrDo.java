package info.isaksson.erland.sfsymbolsgen.ir;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/** {@code do { } catch { }}; a {@code null} catch body omits the catch clause. */
@JsonPropertyOrder({"doStatement","catchBody"})
public final class IrDo extends IrExpression {
    public final List<IrCodeBlock> doStatement;
    public final List<IrCodeBlock> catchBody;

    public IrDo(List<IrCodeBlock> doStatement, List<IrCodeBlock> catchBody) {
        this.doStatement = doStatement == null ? List.of() : List.copyOf(doStatement);
        this.catchBody = catchBody == null ? null : List.copyOf(catchBody);
    }

    @Override public IrExpressionKind kind() {
        return IrExpressionKind.DO;
    }
}
