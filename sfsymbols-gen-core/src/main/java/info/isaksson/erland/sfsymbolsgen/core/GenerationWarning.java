package info.isaksson.erland.sfsymbolsgen.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** A non-fatal deterministic warning produced during generation. */
public final class GenerationWarning {

    public static final String MISSING_AVAILABILITY = "MISSING_AVAILABILITY";
    public static final String SEMANTIC_ALIAS_TARGET_MISSING = "SEMANTIC_ALIAS_TARGET_MISSING";

    /** Warning code stable across versions. */
    public final String code;

    public final String message;

    /** Structured context with stable keys. */
    public final Map<String, String> context;

    public GenerationWarning(String code, String message, Map<String, String> context) {
        this.code = Objects.requireNonNull(code, "code must not be null");
        this.message = Objects.requireNonNull(message, "message must not be null");
        if (context == null || context.isEmpty()) {
            this.context = Collections.emptyMap();
        } else {
            this.context = Collections.unmodifiableMap(new LinkedHashMap<>(context));
        }
    }

    @Override public String toString() {
        return "Warning [" + code + "]: " + message;
    }
}
