package info.isaksson.erland.sfsymbolsgen.ir;

import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Base type of all declaration nodes.
 *
 * <p>Declarations form a tree: each node owns its children exclusively. Renderers dispatch on
 * {@link #kind()} and cast to the concrete node type.</p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "node")
public abstract class IrDeclaration {

    IrDeclaration() {}

    public abstract IrDeclarationKind kind();

    /** Wraps this declaration with a leading comment. */
    public IrDeclaration withComment(IrComment comment) {
        return new IrCommentable(comment, this);
    }

    /** Wraps this declaration with an attribute rendered on the line above it. */
    public IrDeclaration withAttribute(IrAvailability attribute) {
        return new IrAttributed(attribute, this);
    }
}
