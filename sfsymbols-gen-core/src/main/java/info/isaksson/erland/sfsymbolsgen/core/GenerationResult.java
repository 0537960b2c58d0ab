package info.isaksson.erland.sfsymbolsgen.core;

import info.isaksson.erland.sfsymbolsgen.ir.IrFile;

import java.util.List;

/** Generation result container for programmatic usage. */
public final class GenerationResult {
    /** Rendered Swift source. */
    public final String source;

    /** The assembled IR the source was rendered from. */
    public final IrFile file;

    /** Raw names of the exported symbols, in output order. */
    public final List<String> symbolNames;

    /** Number of semantic-alias accessors. */
    public final int aliasCount;

    public final List<GenerationWarning> warnings;

    GenerationResult(String source, IrFile file, List<String> symbolNames, int aliasCount, List<GenerationWarning> warnings) {
        this.source = source;
        this.file = file;
        this.symbolNames = List.copyOf(symbolNames);
        this.aliasCount = aliasCount;
        this.warnings = warnings == null ? List.of() : warnings;
    }
}
