package info.isaksson.erland.sfsymbolsgen.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects warnings during generation.
 *
 * <p>Final output is sorted by (code, message, contextString).</p>
 */
public final class GenerationWarnings {

    private final List<GenerationWarning> warnings = new ArrayList<>();

    public void warn(String code, String message, String k1, String v1, String k2, String v2) {
        Map<String, String> ctx = new LinkedHashMap<>();
        ctx.put(k1, v1);
        ctx.put(k2, v2);
        warnings.add(new GenerationWarning(code, message, ctx));
    }

    public List<GenerationWarning> toDeterministicList() {
        List<GenerationWarning> out = new ArrayList<>(warnings);
        out.sort(Comparator
                .comparing((GenerationWarning w) -> w.code)
                .thenComparing(w -> w.message)
                .thenComparing(w -> contextString(w.context)));
        return Collections.unmodifiableList(out);
    }

    private static String contextString(Map<String, String> ctx) {
        if (ctx == null || ctx.isEmpty()) return "";
        List<String> keys = new ArrayList<>(ctx.keySet());
        keys.sort(String::compareTo);
        StringBuilder sb = new StringBuilder();
        for (String k : keys) {
            sb.append(k).append('=').append(ctx.get(k)).append(';');
        }
        return sb.toString();
    }
}
