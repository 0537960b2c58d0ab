package info.isaksson.erland.sfsymbolsgen.ir;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

@JsonPropertyOrder({"caseKind","expressions","associatedValueNames","body"})
public final class IrSwitchCase {
    public final IrSwitchCaseKind caseKind;

    /** One expression for CASE, one or more for MULTI_CASE, none for DEFAULT. */
    public final List<IrExpression> expressions;
    public final List<String> associatedValueNames;
    public final List<IrCodeBlock> body;

    private IrSwitchCase(IrSwitchCaseKind caseKind, List<IrExpression> expressions, List<String> associatedValueNames, List<IrCodeBlock> body) {
        this.caseKind = caseKind;
        this.expressions = expressions == null ? List.of() : List.copyOf(expressions);
        this.associatedValueNames = associatedValueNames == null ? List.of() : List.copyOf(associatedValueNames);
        this.body = body == null ? List.of() : List.copyOf(body);
    }

    public static IrSwitchCase single(IrExpression expression, List<String> associatedValueNames, List<IrCodeBlock> body) {
        return new IrSwitchCase(IrSwitchCaseKind.CASE, List.of(expression), associatedValueNames, body);
    }

    public static IrSwitchCase multi(List<IrExpression> expressions, List<IrCodeBlock> body) {
        if (expressions == null || expressions.isEmpty()) throw new IllegalArgumentException("multi case needs expressions");
        return new IrSwitchCase(IrSwitchCaseKind.MULTI_CASE, expressions, null, body);
    }

    public static IrSwitchCase defaultCase(List<IrCodeBlock> body) {
        return new IrSwitchCase(IrSwitchCaseKind.DEFAULT, null, null, body);
    }
}
