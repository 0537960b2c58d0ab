package info.isaksson.erland.sfsymbolsgen.ir;

public enum IrPreconcurrency {
    ALWAYS,
    NEVER,
    /** Only on the operating systems listed by the import. */
    ON_OS
}
