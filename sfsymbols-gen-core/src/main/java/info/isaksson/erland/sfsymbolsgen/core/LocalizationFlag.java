package info.isaksson.erland.sfsymbolsgen.core;

import java.util.EnumSet;

/** Command-line localization switch and the option set it stands for. */
public enum LocalizationFlag {
    ALL(EnumSet.of(LocalizationOption.LANGUAGE_CODE, LocalizationOption.RIGHT_TO_LEFT)),
    LANGUAGE_CODE(EnumSet.of(LocalizationOption.LANGUAGE_CODE)),
    RIGHT_TO_LEFT(EnumSet.of(LocalizationOption.RIGHT_TO_LEFT));

    private final EnumSet<LocalizationOption> options;

    LocalizationFlag(EnumSet<LocalizationOption> options) {
        this.options = options;
    }

    /** A fresh copy; callers may modify it. */
    public EnumSet<LocalizationOption> options() {
        return EnumSet.copyOf(options);
    }

    /** No flag means no localized variants. */
    public static EnumSet<LocalizationOption> optionsFor(LocalizationFlag flag) {
        return flag == null ? EnumSet.noneOf(LocalizationOption.class) : flag.options();
    }
}
