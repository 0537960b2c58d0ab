package info.isaksson.erland.sfsymbolsgen.naming;

import java.text.BreakIterator;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns a dotted symbol name into a camel-cased Swift identifier.
 *
 * <p>The name is cut at every run of characters that are neither letters nor digits, and each
 * piece is then segmented with a locale-aware word {@link BreakIterator}. The first word is
 * lower-cased, later words get an upper-case initial and a lower-case remainder, and purely numeric
 * words are prefixed with {@code _}, as is a leading word that starts with a digit ("4k"). A result
 * that is a Swift keyword is wrapped in backticks.</p>
 *
 * <p>Distinct names may derive the same identifier ("a.b" and "a-b"); callers that need
 * uniqueness must check for it.</p>
 */
public final class IdentifierDeriver {

    private static final Pattern SEPARATORS = Pattern.compile("[^\\p{L}\\p{N}]+");

    private IdentifierDeriver() {}

    public static String derive(String rawName) {
        if (rawName == null) throw new IllegalArgumentException("rawName must not be null");
        List<String> words = words(rawName);
        if (words.isEmpty()) {
            throw new IllegalArgumentException("Symbol name has no letters or digits: \"" + rawName + "\"");
        }

        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < words.size(); i++) {
            String word = words.get(i);
            if (isNumeric(word)) {
                sb.append('_').append(word);
            } else if (i == 0) {
                if (Character.isDigit(word.codePointAt(0))) sb.append('_');
                sb.append(word.toLowerCase(Locale.ROOT));
            } else {
                sb.append(capitalized(word));
            }
        }

        String identifier = sb.toString();
        return SwiftKeywords.isKeyword(identifier) ? "`" + identifier + "`" : identifier;
    }

    /** Word tokens of {@code rawName}, in order, separators dropped. */
    static List<String> words(String rawName) {
        List<String> out = new ArrayList<>();
        BreakIterator it = BreakIterator.getWordInstance(Locale.ROOT);
        for (String piece : SEPARATORS.split(rawName)) {
            if (piece.isEmpty()) continue;
            it.setText(piece);
            int start = it.first();
            for (int end = it.next(); end != BreakIterator.DONE; start = end, end = it.next()) {
                String word = piece.substring(start, end);
                if (hasLetterOrDigit(word)) out.add(word);
            }
        }
        return out;
    }

    private static boolean hasLetterOrDigit(String s) {
        return s.codePoints().anyMatch(Character::isLetterOrDigit);
    }

    private static boolean isNumeric(String s) {
        return !s.isEmpty() && s.codePoints().allMatch(Character::isDigit);
    }

    private static String capitalized(String word) {
        int first = word.codePointAt(0);
        int firstLength = Character.charCount(first);
        return new StringBuilder()
                .appendCodePoint(Character.toUpperCase(first))
                .append(word.substring(firstLength).toLowerCase(Locale.ROOT))
                .toString();
    }
}
