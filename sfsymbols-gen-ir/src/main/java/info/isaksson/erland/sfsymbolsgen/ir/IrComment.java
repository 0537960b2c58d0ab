package info.isaksson.erland.sfsymbolsgen.ir;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * A comment attached to a declaration or code block.
 *
 * <p>The text may span multiple lines; the renderer prefixes each line independently.</p>
 */
@JsonPropertyOrder({"kind","text","sectionBreak"})
public final class IrComment {
    public final IrCommentKind kind;
    public final String text;

    /** Only meaningful for {@link IrCommentKind#MARK}. */
    public final boolean sectionBreak;

    public IrComment(IrCommentKind kind, String text, boolean sectionBreak) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.text = text == null ? "" : text;
        this.sectionBreak = sectionBreak;
    }

    public static IrComment inline(String text) {
        return new IrComment(IrCommentKind.INLINE, text, false);
    }

    public static IrComment doc(String text) {
        return new IrComment(IrCommentKind.DOC, text, false);
    }

    public static IrComment mark(String text, boolean sectionBreak) {
        return new IrComment(IrCommentKind.MARK, text, sectionBreak);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrComment)) return false;
        IrComment that = (IrComment) o;
        return kind == that.kind && sectionBreak == that.sectionBreak && Objects.equals(text, that.text);
    }

    @Override public int hashCode() {
        return Objects.hash(kind, text, sectionBreak);
    }

    @Override public String toString() {
        return kind + "(" + text + ")";
    }
}
