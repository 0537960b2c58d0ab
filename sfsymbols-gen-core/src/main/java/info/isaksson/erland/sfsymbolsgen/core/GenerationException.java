package info.isaksson.erland.sfsymbolsgen.core;

/** The catalog data cannot be turned into a valid source file. */
public class GenerationException extends RuntimeException {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
