package info.isaksson.erland.sfsymbolsgen.catalog;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class CatalogLoaderTest {

    static Path fixtureCatalog() throws URISyntaxException {
        return Paths.get(CatalogLoaderTest.class.getResource("/catalog/name_availability.json").toURI()).getParent();
    }

    private static Path copyFixture(Path target) throws Exception {
        try (Stream<Path> files = Files.list(fixtureCatalog())) {
            for (Path f : files.collect(Collectors.toList())) {
                Files.copy(f, target.resolve(f.getFileName()));
            }
        }
        return target;
    }

    @Test
    void loadsAllTablesSorted() throws Exception {
        SymbolCatalog catalog = CatalogLoader.load(fixtureCatalog());

        List<String> names = catalog.entries().stream().map(e -> e.name).collect(Collectors.toList());
        assertEquals(11, names.size());
        assertEquals("0.circle", names.get(0));
        assertEquals("shareplay", names.get(names.size() - 1));
        List<String> sorted = names.stream().sorted().collect(Collectors.toList());
        assertEquals(sorted, names);

        SymbolEntry message = catalog.entry("message.circle").orElseThrow();
        assertEquals("2019", message.availabilityKey);
        PlatformReleases release = catalog.availabilityTable().releaseFor(message).orElseThrow();
        assertEquals(new PlatformReleases("13.0", "10.15", "13.0", "6.0", "1.0"), release);

        assertEquals("person.crop.circle.badge.xmark", catalog.nameAliases().get("person.crop.circle.fill.badge.xmark"));
        assertEquals("c.square.fill", catalog.nofillToFill().get("c.square"));
        assertEquals("checkmark.seal", catalog.semanticToDescriptive().get("verified"));
        assertTrue(catalog.restrictions().get("shareplay").startsWith("May only be used"));
        assertTrue(catalog.containsSymbol("class"));
        assertFalse(catalog.containsSymbol("bubble"));
    }

    @Test
    void unknownAvailabilityKeyIsAnEmptyLookup() {
        AvailabilityTable table = new AvailabilityTable(java.util.Map.of());
        assertTrue(table.releaseFor(new SymbolEntry("x", "1999")).isEmpty());
    }

    @Test
    void tablesAreUnmodifiable() throws Exception {
        SymbolCatalog catalog = CatalogLoader.load(fixtureCatalog());
        assertThrows(UnsupportedOperationException.class, () -> catalog.restrictions().put("a", "b"));
        assertThrows(UnsupportedOperationException.class, () -> catalog.entries().clear());
    }

    @Test
    void missingFileIsReportedWithItsName(@TempDir Path dir) throws Exception {
        copyFixture(dir);
        Files.delete(dir.resolve(CatalogLoader.SYMBOL_RESTRICTIONS));

        CatalogFormatException e = assertThrows(CatalogFormatException.class, () -> CatalogLoader.load(dir));
        assertEquals(dir.resolve(CatalogLoader.SYMBOL_RESTRICTIONS), e.file());
        assertTrue(e.getMessage().contains(CatalogLoader.SYMBOL_RESTRICTIONS));
    }

    @Test
    void malformedJsonIsReportedWithItsName(@TempDir Path dir) throws Exception {
        copyFixture(dir);
        Files.writeString(dir.resolve(CatalogLoader.NAME_ALIASES), "{ \"a\": ", StandardCharsets.UTF_8);

        IOException e = assertThrows(IOException.class, () -> CatalogLoader.load(dir));
        assertTrue(e.getMessage().contains(CatalogLoader.NAME_ALIASES), e.getMessage());
    }

    @Test
    void incompleteReleaseRecordIsRejected(@TempDir Path dir) throws Exception {
        copyFixture(dir);
        Files.writeString(dir.resolve(CatalogLoader.NAME_AVAILABILITY),
                "{\"symbols\":{\"a\":\"1\"},\"year_to_release\":{\"1\":{\"iOS\":\"13.0\"}}}", StandardCharsets.UTF_8);

        assertThrows(CatalogFormatException.class, () -> CatalogLoader.load(dir));
    }

    @Test
    void nullSymbolAvailabilityIsReportedWithItsName(@TempDir Path dir) throws Exception {
        copyFixture(dir);
        Files.writeString(dir.resolve(CatalogLoader.NAME_AVAILABILITY),
                "{\"symbols\":{\"a.b\":null},\"year_to_release\":{}}", StandardCharsets.UTF_8);

        CatalogFormatException e = assertThrows(CatalogFormatException.class, () -> CatalogLoader.load(dir));
        assertEquals(dir.resolve(CatalogLoader.NAME_AVAILABILITY), e.file());
        assertTrue(e.getMessage().contains("\"a.b\""), e.getMessage());
    }

    @Test
    void nullReleaseRecordIsRejected(@TempDir Path dir) throws Exception {
        copyFixture(dir);
        Files.writeString(dir.resolve(CatalogLoader.NAME_AVAILABILITY),
                "{\"symbols\":{\"a\":\"1\"},\"year_to_release\":{\"1\":null}}", StandardCharsets.UTF_8);

        assertThrows(CatalogFormatException.class, () -> CatalogLoader.load(dir));
    }

    @Test
    void nullValueInNameTableIsReportedWithItsName(@TempDir Path dir) throws Exception {
        copyFixture(dir);
        Files.writeString(dir.resolve(CatalogLoader.SEMANTIC_TO_DESCRIPTIVE), "{\"bubble\":null}", StandardCharsets.UTF_8);

        CatalogFormatException e = assertThrows(CatalogFormatException.class, () -> CatalogLoader.load(dir));
        assertEquals(dir.resolve(CatalogLoader.SEMANTIC_TO_DESCRIPTIVE), e.file());
    }

    @Test
    void missingDirectoryIsRejected(@TempDir Path dir) {
        assertThrows(CatalogFormatException.class, () -> CatalogLoader.load(dir.resolve("absent")));
    }
}
