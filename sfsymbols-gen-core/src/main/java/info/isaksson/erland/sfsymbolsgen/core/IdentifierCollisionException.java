package info.isaksson.erland.sfsymbolsgen.core;

/** Two different names derive the same Swift identifier. */
public final class IdentifierCollisionException extends GenerationException {

    public final String identifier;
    public final String firstName;
    public final String secondName;

    public IdentifierCollisionException(String identifier, String firstName, String secondName) {
        super("Symbols \"" + firstName + "\" and \"" + secondName + "\" both derive identifier " + identifier);
        this.identifier = identifier;
        this.firstName = firstName;
        this.secondName = secondName;
    }
}
