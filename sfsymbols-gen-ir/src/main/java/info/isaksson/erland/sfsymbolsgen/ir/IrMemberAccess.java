package info.isaksson.erland.sfsymbolsgen.ir;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** {@code left.right}, or the implicit-member form {@code .right} when {@code left} is {@code null}. */
@JsonPropertyOrder({"left","right"})
public final class IrMemberAccess extends IrExpression {
    public final IrExpression left;
    public final String right;

    public IrMemberAccess(IrExpression left, String right) {
        this.left = left;
        this.right = Objects.requireNonNull(right, "right must not be null");
    }

    public static IrMemberAccess dot(String member) {
        return new IrMemberAccess(null, member);
    }

    @Override public IrExpressionKind kind() {
        return IrExpressionKind.MEMBER_ACCESS;
    }
}
