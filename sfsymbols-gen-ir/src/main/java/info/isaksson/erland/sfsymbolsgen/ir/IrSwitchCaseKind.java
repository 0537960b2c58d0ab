package info.isaksson.erland.sfsymbolsgen.ir;

public enum IrSwitchCaseKind {
    /** {@code case [let ]expr(names...)} */
    CASE,
    /** {@code case a, b, c} */
    MULTI_CASE,
    DEFAULT
}
