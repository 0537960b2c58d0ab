package info.isaksson.erland.sfsymbolsgen.ir;

public enum IrExpressionKind {
    LITERAL,
    IDENTIFIER,
    MEMBER_ACCESS,
    FUNCTION_CALL,
    ASSIGNMENT,
    SWITCH,
    IF,
    DO,
    VALUE_BINDING,
    UNARY_KEYWORD,
    CLOSURE_INVOCATION,
    BINARY_OPERATION,
    IN_OUT,
    OPTIONAL_CHAINING,
    FORCE_UNWRAP,
    TUPLE
}
