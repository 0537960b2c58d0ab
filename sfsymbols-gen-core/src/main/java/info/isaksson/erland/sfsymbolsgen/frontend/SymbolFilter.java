package info.isaksson.erland.sfsymbolsgen.frontend;

import info.isaksson.erland.sfsymbolsgen.core.LocalizationOption;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/** Drops localized symbol variants unless the matching localization option is set. */
public final class SymbolFilter {

    public static final String RIGHT_TO_LEFT_SUFFIX = ".rtl";

    private static final Set<String> ISO_LANGUAGE_CODES = Set.of(Locale.getISOLanguages());

    private final boolean keepLanguageCodes;
    private final boolean keepRightToLeft;

    public SymbolFilter(EnumSet<LocalizationOption> options) {
        this.keepLanguageCodes = options != null && options.contains(LocalizationOption.LANGUAGE_CODE);
        this.keepRightToLeft = options != null && options.contains(LocalizationOption.RIGHT_TO_LEFT);
    }

    public boolean includes(String symbolName) {
        if (!keepLanguageCodes && hasLanguageCode(symbolName)) return false;
        if (!keepRightToLeft && hasRightToLeftSpecifier(symbolName)) return false;
        return true;
    }

    /** Last non-empty dot segment is an ISO 639 language code. */
    static boolean hasLanguageCode(String symbolName) {
        String[] segments = symbolName.split("\\.");
        for (int i = segments.length - 1; i >= 0; i--) {
            if (!segments[i].isEmpty()) return ISO_LANGUAGE_CODES.contains(segments[i]);
        }
        return false;
    }

    static boolean hasRightToLeftSpecifier(String symbolName) {
        return symbolName.endsWith(RIGHT_TO_LEFT_SUFFIX);
    }
}
