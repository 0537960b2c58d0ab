package info.isaksson.erland.sfsymbolsgen.mutate;

import info.isaksson.erland.sfsymbolsgen.ir.IrAttributed;
import info.isaksson.erland.sfsymbolsgen.ir.IrAvailability;
import info.isaksson.erland.sfsymbolsgen.ir.IrCommentable;
import info.isaksson.erland.sfsymbolsgen.ir.IrDeclaration;
import info.isaksson.erland.sfsymbolsgen.ir.IrDeclarationKind;

import java.util.Optional;

/**
 * Base for mutators that add an {@code @available} attribute.
 *
 * <p>The attribute always goes directly beneath a leading comment, so the comment stays the first
 * thing rendered no matter how many attributes are stacked or in which order mutators run.</p>
 */
abstract class AttributeMutator implements DeclarationMutator {

    /** The attribute for {@code symbolName}, or empty to leave the declaration alone. */
    protected abstract Optional<IrAvailability> attributeFor(String symbolName);

    @Override
    public final IrDeclaration mutate(IrDeclaration declaration, String symbolName) {
        Optional<IrAvailability> attribute = attributeFor(symbolName);
        if (attribute.isEmpty()) return declaration;
        return insertBelowComment(declaration, attribute.get());
    }

    static IrDeclaration insertBelowComment(IrDeclaration declaration, IrAvailability attribute) {
        if (declaration.kind() == IrDeclarationKind.COMMENTABLE) {
            IrCommentable commentable = (IrCommentable) declaration;
            return new IrCommentable(commentable.comment, new IrAttributed(attribute, commentable.declaration));
        }
        return new IrAttributed(attribute, declaration);
    }
}
