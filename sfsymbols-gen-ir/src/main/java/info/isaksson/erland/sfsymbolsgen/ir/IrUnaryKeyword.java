package info.isaksson.erland.sfsymbolsgen.ir;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** {@code return x}, {@code try x}, {@code await x}, ...; the operand is optional. */
@JsonPropertyOrder({"keyword","expression"})
public final class IrUnaryKeyword extends IrExpression {
    public final IrKeywordKind keyword;
    public final IrExpression expression;

    public IrUnaryKeyword(IrKeywordKind keyword, IrExpression expression) {
        this.keyword = Objects.requireNonNull(keyword, "keyword must not be null");
        this.expression = expression;
    }

    @Override public IrExpressionKind kind() {
        return IrExpressionKind.UNARY_KEYWORD;
    }
}
