package info.isaksson.erland.sfsymbolsgen.ir;

public enum IrDeclarationKind {
    COMMENTABLE,
    ATTRIBUTED,
    VARIABLE,
    EXTENSION,
    STRUCT,
    PROTOCOL,
    ENUM,
    TYPEALIAS,
    FUNCTION,
    ENUM_CASE,
    CONDITIONAL_COMPILATION
}
