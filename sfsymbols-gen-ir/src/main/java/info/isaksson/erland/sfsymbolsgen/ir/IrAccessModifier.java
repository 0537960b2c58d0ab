package info.isaksson.erland.sfsymbolsgen.ir;

/**
 * Access modifiers of the generated language, in decreasing visibility.
 */
public enum IrAccessModifier {
    PUBLIC("public"),
    PACKAGE("package"),
    INTERNAL("internal"),
    FILEPRIVATE("fileprivate"),
    PRIVATE("private");

    /** Source keyword, also accepted on the command line. */
    public final String keyword;

    IrAccessModifier(String keyword) {
        this.keyword = keyword;
    }

    public static IrAccessModifier parseCli(String v) {
        if (v == null) return INTERNAL;
        String s = v.trim().toLowerCase();
        for (IrAccessModifier m : values()) {
            if (m.keyword.equals(s)) return m;
        }
        throw new IllegalArgumentException("Invalid value for --access-modifier: " + v
                + " (expected one of: public|package|internal|fileprivate|private)");
    }
}
