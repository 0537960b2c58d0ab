package info.isaksson.erland.sfsymbolsgen.core;

/** Localized symbol variants that are kept instead of filtered out. */
public enum LocalizationOption {
    /** Names whose last segment is an ISO language code, e.g. {@code character.book.closed.ja}. */
    LANGUAGE_CODE,
    /** Names ending in {@code .rtl}. */
    RIGHT_TO_LEFT
}
