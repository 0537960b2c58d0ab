package info.isaksson.erland.sfsymbolsgen.ir;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** A declaration preceded by a comment. A {@code null} comment renders nothing. */
@JsonPropertyOrder({"comment","declaration"})
public final class IrCommentable extends IrDeclaration {
    public final IrComment comment;
    public final IrDeclaration declaration;

    public IrCommentable(IrComment comment, IrDeclaration declaration) {
        this.comment = comment;
        this.declaration = Objects.requireNonNull(declaration, "declaration must not be null");
    }

    @Override public IrDeclarationKind kind() {
        return IrDeclarationKind.COMMENTABLE;
    }
}
