package info.isaksson.erland.sfsymbolsgen.ir;

public enum IrCommentKind {
    /** {@code // text} */
    INLINE,
    /** {@code /// text} */
    DOC,
    /** {@code // MARK: text} or {@code // MARK: - text} */
    MARK
}
