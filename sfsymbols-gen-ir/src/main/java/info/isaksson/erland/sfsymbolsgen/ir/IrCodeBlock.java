package info.isaksson.erland.sfsymbolsgen.ir;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One statement-level item of a body or file: either a declaration or an expression,
 * optionally preceded by a comment.
 */
@JsonPropertyOrder({"comment","declaration","expression"})
public final class IrCodeBlock {
    public final IrComment comment;
    public final IrDeclaration declaration;
    public final IrExpression expression;

    private IrCodeBlock(IrComment comment, IrDeclaration declaration, IrExpression expression) {
        if ((declaration == null) == (expression == null)) {
            throw new IllegalArgumentException("code block needs exactly one of declaration or expression");
        }
        this.comment = comment;
        this.declaration = declaration;
        this.expression = expression;
    }

    public static IrCodeBlock declaration(IrDeclaration declaration) {
        return new IrCodeBlock(null, declaration, null);
    }

    public static IrCodeBlock declaration(IrComment comment, IrDeclaration declaration) {
        return new IrCodeBlock(comment, declaration, null);
    }

    public static IrCodeBlock expression(IrExpression expression) {
        return new IrCodeBlock(null, null, expression);
    }

    public static IrCodeBlock expression(IrComment comment, IrExpression expression) {
        return new IrCodeBlock(comment, null, expression);
    }
}
