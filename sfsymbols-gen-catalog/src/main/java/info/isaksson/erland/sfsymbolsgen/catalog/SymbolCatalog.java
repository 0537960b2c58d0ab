package info.isaksson.erland.sfsymbolsgen.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable, fully loaded symbol catalog.
 *
 * <p>All tables are sorted by key so that iteration order never depends on hashing.</p>
 */
public final class SymbolCatalog {

    private final Map<String, SymbolEntry> entriesByName;
    private final List<SymbolEntry> entries;
    private final AvailabilityTable availabilityTable;
    private final Map<String, String> nameAliases;
    private final Map<String, String> nofillToFill;
    private final Map<String, String> semanticToDescriptive;
    private final Map<String, String> restrictions;

    public SymbolCatalog(
            Map<String, String> symbols,
            AvailabilityTable availabilityTable,
            Map<String, String> nameAliases,
            Map<String, String> nofillToFill,
            Map<String, String> semanticToDescriptive,
            Map<String, String> restrictions
    ) {
        Objects.requireNonNull(symbols, "symbols must not be null");
        this.availabilityTable = Objects.requireNonNull(availabilityTable, "availabilityTable must not be null");

        TreeMap<String, SymbolEntry> byName = new TreeMap<>();
        for (Map.Entry<String, String> e : symbols.entrySet()) {
            byName.put(e.getKey(), new SymbolEntry(e.getKey(), e.getValue()));
        }
        this.entriesByName = Collections.unmodifiableMap(byName);
        this.entries = Collections.unmodifiableList(new ArrayList<>(byName.values()));

        this.nameAliases = sorted(nameAliases);
        this.nofillToFill = sorted(nofillToFill);
        this.semanticToDescriptive = sorted(semanticToDescriptive);
        this.restrictions = sorted(restrictions);
    }

    private static Map<String, String> sorted(Map<String, String> in) {
        return in == null ? Collections.emptyMap() : Collections.unmodifiableMap(new TreeMap<>(in));
    }

    /** All symbols, sorted by name. */
    public List<SymbolEntry> entries() {
        return entries;
    }

    public Optional<SymbolEntry> entry(String symbolName) {
        return Optional.ofNullable(entriesByName.get(symbolName));
    }

    public boolean containsSymbol(String symbolName) {
        return entriesByName.containsKey(symbolName);
    }

    public AvailabilityTable availabilityTable() {
        return availabilityTable;
    }

    /** Deprecated name to its current name. */
    public Map<String, String> nameAliases() {
        return nameAliases;
    }

    /** Outline variant to fill variant. Loaded for completeness; generation does not read it. */
    public Map<String, String> nofillToFill() {
        return nofillToFill;
    }

    /** Semantic name to the descriptive symbol name it stands for. */
    public Map<String, String> semanticToDescriptive() {
        return semanticToDescriptive;
    }

    /** Symbol name to usage-restriction prose. */
    public Map<String, String> restrictions() {
        return restrictions;
    }
}
