package info.isaksson.erland.sfsymbolsgen.ir;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Root of the IR: one generated source file.
 */
@JsonPropertyOrder({"name","topComment","imports","codeBlocks"})
public final class IrFile {
    /** Base name of the file, informational only. */
    public final String name;
    public final IrComment topComment;
    public final List<IrImport> imports;
    public final List<IrCodeBlock> codeBlocks;

    public IrFile(String name, IrComment topComment, List<IrImport> imports, List<IrCodeBlock> codeBlocks) {
        this.name = name;
        this.topComment = topComment;
        this.imports = imports == null ? List.of() : List.copyOf(imports);
        this.codeBlocks = codeBlocks == null ? List.of() : List.copyOf(codeBlocks);
    }
}
