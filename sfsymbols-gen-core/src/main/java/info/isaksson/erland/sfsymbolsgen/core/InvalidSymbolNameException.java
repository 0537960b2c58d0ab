package info.isaksson.erland.sfsymbolsgen.core;

/** A catalog name from which no Swift identifier can be derived. */
public final class InvalidSymbolNameException extends GenerationException {

    public final String symbolName;

    public InvalidSymbolNameException(String symbolName, Throwable cause) {
        super("Cannot derive an identifier for symbol \"" + symbolName + "\": " + cause.getMessage(), cause);
        this.symbolName = symbolName;
    }
}
