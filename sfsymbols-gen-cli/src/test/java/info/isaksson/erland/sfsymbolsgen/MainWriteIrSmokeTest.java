package info.isaksson.erland.sfsymbolsgen;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class MainWriteIrSmokeTest {

    @Test
    void writesIrWhenRequested() throws IOException {
        Path tmpDir = Files.createTempDirectory("sfsg-write-ir-");
        Path sourceOut = tmpDir.resolve("SFSymbols.swift");
        Path irOut = tmpDir.resolve("ir").resolve("SFSymbols.ir.json");

        int code = Main.run(new String[] {
                "--catalog", TestCatalogs.fixture().toString(),
                "--output", sourceOut.toString(),
                "--write-ir", irOut.toString(),
                "--enabled-extensions", "none"
        });
        assertEquals(0, code);
        assertTrue(Files.exists(irOut), "IR file must be written: " + irOut);
        String s = Files.readString(irOut);
        assertTrue(s.contains("\"codeBlocks\""), "IR JSON must have codeBlocks");
        assertTrue(s.contains("SFSymbols.swift"));
        assertTrue(s.contains("message.circle"));
    }
}
