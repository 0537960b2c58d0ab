package info.isaksson.erland.sfsymbolsgen.core;

import info.isaksson.erland.sfsymbolsgen.catalog.CatalogLoader;
import info.isaksson.erland.sfsymbolsgen.catalog.SymbolCatalog;
import info.isaksson.erland.sfsymbolsgen.catalog.SymbolEntry;
import info.isaksson.erland.sfsymbolsgen.emitter.SwiftEmitter;
import info.isaksson.erland.sfsymbolsgen.frontend.AccessorSpec;
import info.isaksson.erland.sfsymbolsgen.frontend.ResourceFileBuilder;
import info.isaksson.erland.sfsymbolsgen.frontend.SymbolFilter;
import info.isaksson.erland.sfsymbolsgen.ir.IrAccessModifier;
import info.isaksson.erland.sfsymbolsgen.ir.IrFile;
import info.isaksson.erland.sfsymbolsgen.mutate.MutatorChain;
import info.isaksson.erland.sfsymbolsgen.naming.IdentifierDeriver;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Core API for generating the SF Symbols source file.
 *
 * <p>CLI and other wrappers should use this class instead of re-implementing the pipeline.</p>
 */
public final class SymbolGenerationService {

    private final SwiftEmitter emitter = new SwiftEmitter();

    /** Load the catalog directory, then generate. */
    public GenerationResult generate(Path catalogDir, GenerationOptions options) throws IOException {
        return generate(CatalogLoader.load(catalogDir), options);
    }

    public GenerationResult generate(SymbolCatalog catalog, GenerationOptions options) {
        if (catalog == null) throw new IllegalArgumentException("catalog must not be null");
        if (options == null) options = new GenerationOptions();

        GenerationWarnings warnings = new GenerationWarnings();
        SymbolFilter filter = new SymbolFilter(options.localizationOptions);

        List<AccessorSpec> accessors = new ArrayList<>();
        Set<String> exported = new HashSet<>();
        for (SymbolEntry entry : catalog.entries()) {
            if (!filter.includes(entry.name)) continue;
            if (catalog.availabilityTable().releaseFor(entry).isEmpty()) {
                if (options.missingAvailabilityPolicy == MissingAvailabilityPolicy.FAIL) {
                    throw new MissingAvailabilityException(entry.name, entry.availabilityKey);
                }
                warnings.warn(GenerationWarning.MISSING_AVAILABILITY,
                        "Skipped \"" + entry.name + "\": no release record for availability key \"" + entry.availabilityKey + "\"",
                        "symbol", entry.name, "availabilityKey", entry.availabilityKey);
                continue;
            }
            accessors.add(AccessorSpec.symbol(entry.name, identifierFor(entry.name)));
            exported.add(entry.name);
        }
        List<String> symbolNames = new ArrayList<>();
        for (AccessorSpec spec : accessors) symbolNames.add(spec.sourceName);

        int aliasCount = 0;
        if (options.exportSemanticSymbols) {
            for (Map.Entry<String, String> alias : catalog.semanticToDescriptive().entrySet()) {
                String semantic = alias.getKey();
                String descriptive = alias.getValue();
                if (!filter.includes(semantic) || catalog.containsSymbol(semantic)) continue;
                if (!exported.contains(descriptive)) {
                    warnings.warn(GenerationWarning.SEMANTIC_ALIAS_TARGET_MISSING,
                            "Skipped semantic alias \"" + semantic + "\": \"" + descriptive + "\" is not exported",
                            "alias", semantic, "target", descriptive);
                    continue;
                }
                accessors.add(AccessorSpec.semanticAlias(semantic, identifierFor(semantic), descriptive));
                aliasCount++;
            }
        }

        checkCollisions(accessors);

        ResourceFileBuilder builder = new ResourceFileBuilder(
                options.accessModifier == null ? IrAccessModifier.INTERNAL : options.accessModifier,
                MutatorChain.standard(catalog));
        IrFile file = builder.build(accessors,
                options.enabledExtensions == null ? EnumSet.noneOf(EnabledExtension.class) : options.enabledExtensions);
        String source = emitter.render(file).contents;

        return new GenerationResult(source, file, symbolNames, aliasCount, warnings.toDeterministicList());
    }

    private static String identifierFor(String name) {
        try {
            return IdentifierDeriver.derive(name);
        } catch (IllegalArgumentException e) {
            throw new InvalidSymbolNameException(name, e);
        }
    }

    private static void checkCollisions(List<AccessorSpec> accessors) {
        Map<String, String> seen = new HashMap<>();
        for (AccessorSpec spec : accessors) {
            String previous = seen.putIfAbsent(spec.identifier, spec.sourceName);
            if (previous != null) {
                throw new IdentifierCollisionException(spec.identifier, previous, spec.sourceName);
            }
        }
    }
}
