package info.isaksson.erland.sfsymbolsgen.core;

/** A symbol's availability key has no release record. */
public final class MissingAvailabilityException extends GenerationException {

    public final String symbolName;
    public final String availabilityKey;

    public MissingAvailabilityException(String symbolName, String availabilityKey) {
        super("No release record for availability key \"" + availabilityKey + "\" of symbol \"" + symbolName + "\"");
        this.symbolName = symbolName;
        this.availabilityKey = availabilityKey;
    }
}
