package info.isaksson.erland.sfsymbolsgen.catalog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Reads a catalog directory into a {@link SymbolCatalog}.
 *
 * <p>All five files are required. Any missing file or decode error aborts the load.</p>
 */
public final class CatalogLoader {

    public static final String NAME_AVAILABILITY = "name_availability.json";
    public static final String NAME_ALIASES = "name_aliases.json";
    public static final String NOFILL_TO_FILL = "nofill_to_fill.json";
    public static final String SEMANTIC_TO_DESCRIPTIVE = "semantic_to_descriptive_name.json";
    public static final String SYMBOL_RESTRICTIONS = "symbol_restrictions.json";

    private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {};

    private static final ObjectMapper MAPPER = createMapper();

    private CatalogLoader() {}

    /** Layout of {@code name_availability.json}. */
    static final class NameAvailability {
        final Map<String, String> symbols;
        final Map<String, PlatformReleases> yearToRelease;

        @JsonCreator
        NameAvailability(
                @JsonProperty("symbols") Map<String, String> symbols,
                @JsonProperty("year_to_release") Map<String, PlatformReleases> yearToRelease
        ) {
            this.symbols = symbols;
            this.yearToRelease = yearToRelease;
        }
    }

    public static SymbolCatalog load(Path dir) throws IOException {
        if (dir == null) throw new IllegalArgumentException("dir must not be null");
        if (!Files.isDirectory(dir)) {
            throw new CatalogFormatException(dir, "catalog directory does not exist");
        }

        Path availabilityFile = dir.resolve(NAME_AVAILABILITY);
        NameAvailability availability = read(availabilityFile, new TypeReference<NameAvailability>() {});
        if (availability.symbols == null) {
            throw new CatalogFormatException(availabilityFile, "missing \"symbols\" object");
        }
        if (availability.yearToRelease == null) {
            throw new CatalogFormatException(availabilityFile, "missing \"year_to_release\" object");
        }
        requireValues(availabilityFile, "symbols", availability.symbols);
        requireValues(availabilityFile, "year_to_release", availability.yearToRelease);

        return new SymbolCatalog(
                availability.symbols,
                new AvailabilityTable(availability.yearToRelease),
                readTable(dir.resolve(NAME_ALIASES)),
                readTable(dir.resolve(NOFILL_TO_FILL)),
                readTable(dir.resolve(SEMANTIC_TO_DESCRIPTIVE)),
                readTable(dir.resolve(SYMBOL_RESTRICTIONS))
        );
    }

    private static Map<String, String> readTable(Path file) throws IOException {
        Map<String, String> table = read(file, STRING_MAP);
        requireValues(file, "top-level object", table);
        return table;
    }

    /** JSON {@code null} decodes fine but has no meaning in any catalog table. */
    private static void requireValues(Path file, String table, Map<String, ?> entries) throws CatalogFormatException {
        for (Map.Entry<String, ?> e : entries.entrySet()) {
            if (e.getKey() == null) {
                throw new CatalogFormatException(file, "null key in " + table);
            }
            if (e.getValue() == null) {
                throw new CatalogFormatException(file, "null value for \"" + e.getKey() + "\" in " + table);
            }
        }
    }

    private static <T> T read(Path file, TypeReference<T> type) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new CatalogFormatException(file, "catalog file is missing");
        }
        T value;
        try (InputStream in = Files.newInputStream(file)) {
            value = MAPPER.readValue(in, type);
        } catch (JsonProcessingException e) {
            throw new CatalogFormatException(file, "malformed JSON: " + e.getOriginalMessage(), e);
        }
        if (value == null) {
            throw new CatalogFormatException(file, "expected a JSON object");
        }
        return value;
    }

    private static ObjectMapper createMapper() {
        ObjectMapper om = new ObjectMapper();
        om.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return om;
    }
}
