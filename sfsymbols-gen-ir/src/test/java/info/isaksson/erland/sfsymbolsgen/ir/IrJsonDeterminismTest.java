package info.isaksson.erland.sfsymbolsgen.ir;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class IrJsonDeterminismTest {

    private static IrFile sample() {
        IrDeclaration accessor = IrVariable.computed(IrAccessModifier.INTERNAL, true, "circle", IrTypeRef.member("SFSymbolResource"),
                List.of(IrCodeBlock.expression(IrFunctionCall.of(IrIdentifier.type(IrTypeRef.member("SFSymbolResource")),
                        List.of(IrFunctionArgument.of("systemName", IrLiteral.string("circle")))))))
                .withAttribute(IrAvailability.platforms(List.of(IrPlatformVersion.of("iOS", "13.0"))))
                .withComment(IrComment.doc("The \"circle\" SF Symbol."));
        return new IrFile("SFSymbols.swift", IrComment.inline("header"), List.of(IrImport.guarded("SwiftUI")),
                List.of(IrCodeBlock.declaration(IrExtension.of("SFSymbolResource", List.of(accessor)))));
    }

    @Test
    void serializationIsStableAndTagged() throws Exception {
        String a = IrJson.toJsonString(sample());
        String b = IrJson.toJsonString(sample());
        assertEquals(a, b);
        assertTrue(a.contains("\"node\" : \"IrCommentable\""), a);
        assertTrue(a.contains("\"node\" : \"IrAttributed\""), a);
        assertTrue(a.indexOf("\"name\"") < a.indexOf("\"topComment\""));
        assertFalse(a.contains("null"));
    }

    @Test
    void writeCreatesParentAndEndsWithNewline() throws Exception {
        Path out = Files.createTempDirectory("sfsymbols-gen-ir").resolve("debug/ir.json");
        IrJson.write(sample(), out);
        String written = Files.readString(out, StandardCharsets.UTF_8);
        assertTrue(written.endsWith("}\n"));
        assertEquals(IrJson.toJsonString(sample()), written);
    }

    @Test
    void factoriesRejectInvalidShapes() {
        assertThrows(IllegalArgumentException.class, () -> IrAvailability.platforms(List.of()));
        assertThrows(IllegalArgumentException.class, () -> IrIdentifier.pattern(""));
        assertThrows(IllegalArgumentException.class, () -> IrLiteral.floating(1.0, -1));
        assertEquals(IrAccessModifier.PUBLIC, IrAccessModifier.parseCli(" Public "));
        assertThrows(IllegalArgumentException.class, () -> IrAccessModifier.parseCli("open"));
    }
}
