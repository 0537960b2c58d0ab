package info.isaksson.erland.sfsymbolsgen;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class MainSmokeTest {

    @TempDir
    Path tmpDir;

    @Test
    void helpExitsZero() {
        assertEquals(0, Main.run(new String[] {"--help"}));
        assertEquals(0, Main.run(new String[] {"-h", "--catalog", "ignored"}));
    }

    @Test
    void versionPrintsUnknownOutsideAJar() {
        PrintStream original = System.out;
        ByteArrayOutputStream captured = new ByteArrayOutputStream();
        System.setOut(new PrintStream(captured, true, StandardCharsets.UTF_8));
        int code;
        try {
            code = Main.run(new String[] {"--version"});
        } finally {
            System.setOut(original);
        }
        assertEquals(0, code);
        assertEquals("sfsymbols-gen " + Main.version(), captured.toString(StandardCharsets.UTF_8).trim());
    }

    @Test
    void usageErrorsExitOne() {
        assertEquals(1, Main.run(new String[] {"--bogus"}));
        assertEquals(1, Main.run(new String[] {}));
        assertEquals(1, Main.run(new String[] {"--catalog", tmpDir.resolve("missing").toString()}));
    }

    @Test
    void incompleteCatalogExitsTwo() throws IOException {
        Path empty = Files.createDirectories(tmpDir.resolve("empty-catalog"));
        assertEquals(2, Main.run(new String[] {"--catalog", empty.toString()}));
    }

    @Test
    void nullCatalogEntryExitsTwo() throws IOException {
        Path catalog = copyFixture(tmpDir.resolve("null-entry"));
        Files.writeString(catalog.resolve("name_availability.json"),
                "{\"symbols\":{\"a.b\":null},\"year_to_release\":{}}", StandardCharsets.UTF_8);

        assertEquals(2, Main.run(new String[] {"--catalog", catalog.toString()}));
    }

    @Test
    void unnameableSymbolExitsTwo() throws IOException {
        Path catalog = copyFixture(tmpDir.resolve("bad-name"));
        Files.writeString(catalog.resolve("name_availability.json"),
                "{\"symbols\":{\"...\":\"2019\"},\"year_to_release\":{\"2019\":"
                        + "{\"iOS\":\"13.0\",\"macOS\":\"10.15\",\"tvOS\":\"13.0\",\"watchOS\":\"6.0\",\"visionOS\":\"1.0\"}}}",
                StandardCharsets.UTF_8);

        assertEquals(2, Main.run(new String[] {"--catalog", catalog.toString(), "--output", tmpDir.resolve("x.swift").toString()}));
    }

    private static Path copyFixture(Path target) throws IOException {
        Files.createDirectories(target);
        try (Stream<Path> files = Files.list(TestCatalogs.fixture())) {
            for (Path f : files.collect(Collectors.toList())) {
                Files.copy(f, target.resolve(f.getFileName()));
            }
        }
        return target;
    }

    @Test
    void writesSourceFile() throws IOException {
        Path out = tmpDir.resolve("Sources").resolve("SFSymbols.swift");

        int code = Main.run(new String[] {
                "--catalog", TestCatalogs.fixture().toString(),
                "--output", out.toString(),
                "--access-modifier", "public",
                "--enabled-extensions", "SwiftUI"
        });

        assertEquals(0, code);
        assertTrue(Files.exists(out), "source file must be written: " + out);
        String s = Files.readString(out, StandardCharsets.UTF_8);
        assertTrue(s.startsWith("// Generated by sfsymbols-gen. Do not edit.\n"));
        assertTrue(s.contains("public static var messageCircle: SFSymbolResource {"));
        assertTrue(s.contains("extension SwiftUI.Image {"));
        assertFalse(s.contains("UIKit"));
    }

    @Test
    void outputIsStableAcrossRuns() throws IOException {
        Path first = tmpDir.resolve("first.swift");
        Path second = tmpDir.resolve("second.swift");
        String catalog = TestCatalogs.fixture().toString();

        assertEquals(0, Main.run(new String[] {"--catalog", catalog, "--output", first.toString(), "-a"}));
        assertEquals(0, Main.run(new String[] {"--catalog", catalog, "--output", second.toString(), "-a"}));

        assertEquals(Files.readString(first, StandardCharsets.UTF_8), Files.readString(second, StandardCharsets.UTF_8));
        assertTrue(Files.readString(first, StandardCharsets.UTF_8).contains("arrowLeftRtl"));
    }
}
