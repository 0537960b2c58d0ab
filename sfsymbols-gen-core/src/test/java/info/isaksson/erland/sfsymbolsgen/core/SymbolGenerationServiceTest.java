package info.isaksson.erland.sfsymbolsgen.core;

import info.isaksson.erland.sfsymbolsgen.catalog.AvailabilityTable;
import info.isaksson.erland.sfsymbolsgen.catalog.CatalogLoader;
import info.isaksson.erland.sfsymbolsgen.catalog.PlatformReleases;
import info.isaksson.erland.sfsymbolsgen.catalog.SymbolCatalog;
import info.isaksson.erland.sfsymbolsgen.ir.IrAccessModifier;
import info.isaksson.erland.sfsymbolsgen.ir.IrJson;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class SymbolGenerationServiceTest {

    private static final SymbolGenerationService SERVICE = new SymbolGenerationService();

    static Path fixtureCatalog() throws Exception {
        return Paths.get(SymbolGenerationServiceTest.class.getResource("/catalog/name_availability.json").toURI()).getParent();
    }

    private static SymbolCatalog catalog() throws Exception {
        return CatalogLoader.load(fixtureCatalog());
    }

    private static String lines(String... lines) {
        return String.join("\n", lines);
    }

    @Test
    void messageCircleGetsCamelCasedAccessorWithFullAvailability() throws Exception {
        String source = SERVICE.generate(catalog(), new GenerationOptions()).source;

        assertTrue(source.contains(lines(
                "    /// The \"message.circle\" SF Symbol.",
                "    ///",
                "    @available(iOS 13.0, macOS 10.15, macCatalyst 13.0, tvOS 13.0, visionOS 1.0, watchOS 6.0, *)",
                "    internal static var messageCircle: SFSymbolResource {",
                "        SFSymbolResource(systemName: \"message.circle\")",
                "    }")), source);
    }

    @Test
    void unrestrictedSymbolHasOneBlankTrailerLineAndNoCallout() throws Exception {
        String source = SERVICE.generate(catalog(), new GenerationOptions()).source;

        assertTrue(source.contains(lines(
                "    /// The \"c.square\" SF Symbol.",
                "    ///",
                "    @available(")), source);
        assertFalse(source.contains("\"c.square\" SF Symbol.\n    ///\n    ///"));
        int start = source.indexOf("/// The \"c.square\"");
        int end = source.indexOf("static var cSquare");
        assertFalse(source.substring(start, end).contains("Important"));
    }

    @Test
    void restrictedSymbolEndsDocWithImportantCallout() throws Exception {
        String source = SERVICE.generate(catalog(), new GenerationOptions()).source;

        assertTrue(source.contains(lines(
                "    /// The \"shareplay\" SF Symbol.",
                "    ///",
                "    /// - Important: May only be used to refer to Apple's SharePlay feature.",
                "    @available(iOS 15.0, macOS 12.0, macCatalyst 15.0, tvOS 15.0, visionOS 1.0, watchOS 8.0, *)",
                "    internal static var shareplay: SFSymbolResource {")), source);
    }

    @Test
    void deprecatedNameRendersPlatformsThenDeprecation() throws Exception {
        String source = SERVICE.generate(catalog(), new GenerationOptions()).source;

        assertTrue(source.contains(lines(
                "    /// The \"person.crop.circle.fill.badge.xmark\" SF Symbol.",
                "    ///",
                "    @available(iOS 13.0, macOS 10.15, macCatalyst 13.0, tvOS 13.0, visionOS 1.0, watchOS 6.0, *)",
                "    @available(*, deprecated, message: \"This name has been deprecated. You should use a more modern name "
                        + "if your app does not need to support older platforms.\", renamed: \"person.crop.circle.badge.xmark\")",
                "    internal static var personCropCircleFillBadgeXmark: SFSymbolResource {")), source);
    }

    @Test
    void localizedVariantsAreFilteredUnlessEnabled() throws Exception {
        GenerationResult defaults = SERVICE.generate(catalog(), new GenerationOptions());
        assertFalse(defaults.symbolNames.contains("record.circle.fill.ja"));
        assertFalse(defaults.symbolNames.contains("arrow.left.rtl"));
        assertFalse(defaults.source.contains("recordCircleFillJa"));
        assertFalse(defaults.source.contains("arrowLeftRtl"));

        GenerationOptions all = new GenerationOptions();
        all.localizationOptions = LocalizationFlag.ALL.options();
        GenerationResult localized = SERVICE.generate(catalog(), all);
        assertTrue(localized.symbolNames.contains("record.circle.fill.ja"));
        assertTrue(localized.symbolNames.contains("arrow.left.rtl"));
        assertTrue(localized.source.contains("static var recordCircleFillJa: SFSymbolResource"));
        assertTrue(localized.source.contains("static var arrowLeftRtl: SFSymbolResource"));
    }

    @Test
    void reservedAndNumericNamesAreEscaped() throws Exception {
        String source = SERVICE.generate(catalog(), new GenerationOptions()).source;
        assertTrue(source.contains("internal static var `class`: SFSymbolResource {"), source);
        assertTrue(source.contains("internal static var _0Circle: SFSymbolResource {"), source);
        assertTrue(source.contains("SwiftUI.Image(systemSymbolResource: .`class`)"), source);
    }

    @Test
    void generationIsByteIdenticalAcrossRuns() throws Exception {
        GenerationOptions options = new GenerationOptions();
        GenerationResult first = SERVICE.generate(fixtureCatalog(), options);
        GenerationResult second = SERVICE.generate(fixtureCatalog(), options);
        assertEquals(first.source, second.source);
        assertEquals(IrJson.toJsonString(first.file), IrJson.toJsonString(second.file));
        assertTrue(first.source.endsWith("#endif\n"));
    }

    @Test
    void fileLayoutStartsWithHeaderImportsAndSupportStruct() throws Exception {
        GenerationOptions options = new GenerationOptions();
        options.accessModifier = IrAccessModifier.PUBLIC;
        options.enabledExtensions = EnumSet.of(EnabledExtension.UI_KIT);
        String source = SERVICE.generate(catalog(), options).source;

        assertTrue(source.startsWith(lines(
                "// Generated by sfsymbols-gen. Do not edit.",
                "import Foundation",
                "#if canImport(UIKit)",
                "import UIKit",
                "#endif",
                "/// A SF Symbol resource.",
                "public struct SFSymbolResource: Hashable, Sendable {",
                "    /// The SF Symbol system name.",
                "    public let systemName: String",
                "    /// Creates a resource with the given SF Symbol system name.",
                "    public init(systemName: String) {",
                "        self.systemName = systemName",
                "    }",
                "}",
                "",
                "extension SFSymbolResource {")), source);
        assertFalse(source.contains("SwiftUI"));
        assertFalse(source.contains("AppKit"));
        assertTrue(source.contains(lines(
                "#if canImport(UIKit) && !os(watchOS)",
                "@available(iOS 13.0, macCatalyst 13.0, tvOS 13.0, *)",
                "extension UIKit.UIImage {",
                "    /// Creates an image from a SF Symbol resource.",
                "    public convenience init(systemSymbolResource resource: SFSymbolResource) {",
                "        self.init(systemName: resource.systemName)!",
                "    }")), source);
    }

    @Test
    void appKitExtensionUsesAccessibilityDescriptionInitializer() throws Exception {
        GenerationOptions options = new GenerationOptions();
        options.enabledExtensions = EnumSet.of(EnabledExtension.APP_KIT);
        String source = SERVICE.generate(catalog(), options).source;

        assertTrue(source.contains(lines(
                "#if canImport(AppKit) && !targetEnvironment(macCatalyst)",
                "@available(macOS 11.0, *)",
                "extension AppKit.NSImage {")), source);
        assertTrue(source.contains(lines(
                "        self.init(",
                "            systemSymbolName: resource.systemName,",
                "            accessibilityDescription: nil",
                "        )!")), source);
        assertTrue(source.contains(lines(
                "    internal static var messageCircle: AppKit.NSImage {",
                "        AppKit.NSImage(systemSymbolResource: .messageCircle)",
                "    }")), source);
    }

    @Test
    void semanticAliasesFollowSymbolsAndWarnOnMissingTarget() throws Exception {
        GenerationResult result = SERVICE.generate(catalog(), new GenerationOptions());

        assertEquals(2, result.aliasCount);
        assertTrue(result.source.contains(lines(
                "    /// The \"bubble\" semantic SF Symbol, an alias of \"message.circle\".",
                "    ///",
                "    @available(iOS 13.0, macOS 10.15, macCatalyst 13.0, tvOS 13.0, visionOS 1.0, watchOS 6.0, *)",
                "    internal static var bubble: SFSymbolResource {",
                "        SFSymbolResource(systemName: \"message.circle\")",
                "    }")), result.source);
        assertTrue(result.source.indexOf("var bubble") > result.source.indexOf("var shareplay"));

        assertEquals(1, result.warnings.size());
        GenerationWarning w = result.warnings.get(0);
        assertEquals(GenerationWarning.SEMANTIC_ALIAS_TARGET_MISSING, w.code);
        assertEquals("ghost", w.context.get("alias"));
        assertEquals("missing.symbol", w.context.get("target"));

        GenerationOptions noAliases = new GenerationOptions();
        noAliases.exportSemanticSymbols = false;
        GenerationResult plain = SERVICE.generate(catalog(), noAliases);
        assertEquals(0, plain.aliasCount);
        assertTrue(plain.warnings.isEmpty());
        assertFalse(plain.source.contains("var bubble"));
    }

    private static SymbolCatalog catalogWith(Map<String, String> symbols) {
        return new SymbolCatalog(symbols,
                new AvailabilityTable(Map.of("2019", new PlatformReleases("13.0", "10.15", "13.0", "6.0", "1.0"))),
                Map.of(), Map.of(), Map.of(), Map.of());
    }

    @Test
    void missingAvailabilityFailsByDefault() {
        SymbolCatalog catalog = catalogWith(Map.of("a.b", "2019", "c.d", "1999"));

        MissingAvailabilityException e = assertThrows(MissingAvailabilityException.class,
                () -> SERVICE.generate(catalog, new GenerationOptions()));
        assertEquals("c.d", e.symbolName);
        assertEquals("1999", e.availabilityKey);
    }

    @Test
    void missingAvailabilitySkipsWithWarningUnderSkipPolicy() {
        SymbolCatalog catalog = catalogWith(Map.of("a.b", "2019", "c.d", "1999"));
        GenerationOptions options = new GenerationOptions();
        options.missingAvailabilityPolicy = MissingAvailabilityPolicy.SKIP;

        GenerationResult result = SERVICE.generate(catalog, options);

        assertEquals(List.of("a.b"), result.symbolNames);
        assertFalse(result.source.contains("cD"));
        assertEquals(1, result.warnings.size());
        assertEquals(GenerationWarning.MISSING_AVAILABILITY, result.warnings.get(0).code);
        assertEquals("c.d", result.warnings.get(0).context.get("symbol"));
    }

    @Test
    void identifierCollisionsFail() {
        SymbolCatalog catalog = catalogWith(Map.of("a.b", "2019", "a-b", "2019"));

        IdentifierCollisionException e = assertThrows(IdentifierCollisionException.class,
                () -> SERVICE.generate(catalog, new GenerationOptions()));
        assertEquals("aB", e.identifier);
        assertEquals("a-b", e.firstName);
        assertEquals("a.b", e.secondName);
    }

    @Test
    void namesWithoutLettersOrDigitsFailNamingTheSymbol() {
        SymbolCatalog catalog = catalogWith(Map.of("a.b", "2019", "...", "2019"));

        InvalidSymbolNameException e = assertThrows(InvalidSymbolNameException.class,
                () -> SERVICE.generate(catalog, new GenerationOptions()));
        assertEquals("...", e.symbolName);
        assertTrue(e.getMessage().contains("\"...\""), e.getMessage());
        assertInstanceOf(GenerationException.class, e);
    }

    @Test
    void digitLeadingNamesProduceValidIdentifiers() {
        SymbolCatalog catalog = catalogWith(Map.of("4k.tv", "2019"));

        String source = SERVICE.generate(catalog, new GenerationOptions()).source;
        assertTrue(source.contains("internal static var _4kTv: SFSymbolResource {"), source);
        assertTrue(source.contains("SwiftUI.Image(systemSymbolResource: ._4kTv)"), source);
    }
}
