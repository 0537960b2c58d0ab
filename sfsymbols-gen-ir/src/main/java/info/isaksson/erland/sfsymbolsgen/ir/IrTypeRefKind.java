package info.isaksson.erland.sfsymbolsgen.ir;

public enum IrTypeRefKind {
    /** Dotted member path, e.g. {@code UIKit.UIImage}. */
    MEMBER,
    /** {@code any P} */
    ANY,
    /** {@code Wrapper<Wrapped>} */
    GENERIC,
    /** {@code T?} */
    OPTIONAL,
    /** {@code [T]} */
    ARRAY,
    /** {@code [String: T]} */
    DICTIONARY_VALUE
}
