package info.isaksson.erland.sfsymbolsgen.mutate;

import info.isaksson.erland.sfsymbolsgen.ir.IrComment;
import info.isaksson.erland.sfsymbolsgen.ir.IrCommentKind;
import info.isaksson.erland.sfsymbolsgen.ir.IrCommentable;
import info.isaksson.erland.sfsymbolsgen.ir.IrDeclaration;
import info.isaksson.erland.sfsymbolsgen.ir.IrDeclarationKind;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Appends an {@code - Important:} callout with the symbol's usage restriction to its doc comment.
 *
 * <p>Trailing blank lines of the existing doc body are dropped first so that exactly one blank line
 * separates the body from the callout. A declaration without a doc comment gets one holding only
 * the callout.</p>
 */
public final class RestrictionMutator implements DeclarationMutator {

    private final Map<String, String> restrictions;

    public RestrictionMutator(Map<String, String> restrictions) {
        this.restrictions = Objects.requireNonNull(restrictions, "restrictions must not be null");
    }

    @Override
    public IrDeclaration mutate(IrDeclaration declaration, String symbolName) {
        String restriction = restrictions.get(symbolName);
        if (restriction == null) return declaration;

        String callout = "- Important: " + restriction;
        if (declaration.kind() == IrDeclarationKind.COMMENTABLE) {
            IrCommentable commentable = (IrCommentable) declaration;
            if (commentable.comment != null && commentable.comment.kind == IrCommentKind.DOC) {
                String body = withoutTrailingBlankLines(commentable.comment.text);
                String text = body.isEmpty() ? callout : body + "\n\n" + callout;
                return new IrCommentable(IrComment.doc(text), commentable.declaration);
            }
        }
        return new IrCommentable(IrComment.doc(callout), declaration);
    }

    static String withoutTrailingBlankLines(String text) {
        List<String> lines = Arrays.asList(text.split("\\R", -1));
        int end = lines.size();
        while (end > 0 && lines.get(end - 1).isBlank()) end--;
        return String.join("\n", lines.subList(0, end));
    }
}
