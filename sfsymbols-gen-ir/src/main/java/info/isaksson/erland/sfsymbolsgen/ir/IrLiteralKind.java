package info.isaksson.erland.sfsymbolsgen.ir;

public enum IrLiteralKind {
    STRING,
    INT,
    FLOAT,
    BOOL,
    NIL,
    ARRAY
}
