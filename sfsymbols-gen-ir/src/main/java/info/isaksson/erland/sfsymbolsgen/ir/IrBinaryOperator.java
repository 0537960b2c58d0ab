package info.isaksson.erland.sfsymbolsgen.ir;

public enum IrBinaryOperator {
    AND("&&"),
    OR("||"),
    EQUALS("=="),
    NOT_EQUALS("!="),
    PLUS("+"),
    MINUS("-"),
    PLUS_ASSIGN("+="),
    NIL_COALESCING("??"),
    CLOSED_RANGE("..."),
    HALF_OPEN_RANGE("..<");

    public final String symbol;

    IrBinaryOperator(String symbol) {
        this.symbol = symbol;
    }
}
