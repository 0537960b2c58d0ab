package info.isaksson.erland.sfsymbolsgen.core;

/** What to do with a symbol whose availability key has no release record. */
public enum MissingAvailabilityPolicy {
    /** Abort generation with {@link MissingAvailabilityException}. */
    FAIL("fail"),
    /** Leave the symbol out and record a warning. */
    SKIP("skip");

    public final String cliValue;

    MissingAvailabilityPolicy(String cliValue) {
        this.cliValue = cliValue;
    }

    public static MissingAvailabilityPolicy parseCli(String v) {
        if (v == null) return FAIL;
        String s = v.trim().toLowerCase();
        for (MissingAvailabilityPolicy p : values()) {
            if (p.cliValue.equals(s)) return p;
        }
        throw new IllegalArgumentException("Invalid value for --missing-availability: " + v + " (expected one of: fail|skip)");
    }
}
