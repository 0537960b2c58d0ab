package info.isaksson.erland.sfsymbolsgen.frontend;

import java.util.Objects;

/** One accessor to generate: what it is called, what it loads and how it is annotated. */
public final class AccessorSpec {
    /** Name the accessor is derived from; used in collision reports. */
    public final String sourceName;
    /** Swift identifier, possibly backtick-escaped. */
    public final String identifier;
    /** System name passed to the resource. */
    public final String systemName;
    public final String docText;
    /** Key for the mutator chain. */
    public final String mutatorKey;

    public AccessorSpec(String sourceName, String identifier, String systemName, String docText, String mutatorKey) {
        this.sourceName = Objects.requireNonNull(sourceName, "sourceName must not be null");
        this.identifier = Objects.requireNonNull(identifier, "identifier must not be null");
        this.systemName = Objects.requireNonNull(systemName, "systemName must not be null");
        this.docText = Objects.requireNonNull(docText, "docText must not be null");
        this.mutatorKey = Objects.requireNonNull(mutatorKey, "mutatorKey must not be null");
    }

    /** Accessor for a catalog symbol. */
    public static AccessorSpec symbol(String name, String identifier) {
        return new AccessorSpec(name, identifier, name, "The \"" + name + "\" SF Symbol.\n", name);
    }

    /** Accessor named after a semantic alias that loads its descriptive symbol. */
    public static AccessorSpec semanticAlias(String semanticName, String identifier, String descriptiveName) {
        return new AccessorSpec(semanticName, identifier, descriptiveName,
                "The \"" + semanticName + "\" semantic SF Symbol, an alias of \"" + descriptiveName + "\".\n",
                descriptiveName);
    }
}
