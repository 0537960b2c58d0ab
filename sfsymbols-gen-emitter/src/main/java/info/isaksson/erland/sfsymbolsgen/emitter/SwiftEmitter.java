package info.isaksson.erland.sfsymbolsgen.emitter;

import info.isaksson.erland.sfsymbolsgen.ir.IrCodeBlock;
import info.isaksson.erland.sfsymbolsgen.ir.IrComment;
import info.isaksson.erland.sfsymbolsgen.ir.IrFile;
import info.isaksson.erland.sfsymbolsgen.ir.IrImport;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Public API: render an {@link IrFile} into Swift source text.
 *
 * <p>Output is a pure function of the input tree. Each render uses a fresh writer, so an instance
 * can be reused and shared between threads.</p>
 */
public final class SwiftEmitter {

    /** Rendered contents of one file. */
    public static final class RenderedFile {
        public final String name;
        public final String contents;

        RenderedFile(String name, String contents) {
            this.name = name;
            this.contents = contents;
        }
    }

    public RenderedFile render(IrFile file) {
        if (file == null) throw new IllegalArgumentException("file must not be null");
        TextRenderer renderer = new TextRenderer(new CodeWriter());
        renderer.renderFile(file);
        checkBalanced(renderer);
        return new RenderedFile(file.name, renderer.renderedContents());
    }

    /** Convenience overload for callers that assemble a file from parts. */
    public RenderedFile render(String name, IrComment topComment, List<IrImport> imports, List<IrCodeBlock> codeBlocks) {
        return render(new IrFile(name, topComment, imports, codeBlocks));
    }

    /** Render and write the file as UTF-8, creating parent directories when needed. */
    public RenderedFile write(IrFile file, Path out) throws IOException {
        if (out == null) throw new IllegalArgumentException("out must not be null");
        RenderedFile rendered = render(file);
        Path parent = out.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.writeString(out, rendered.contents, StandardCharsets.UTF_8);
        return rendered;
    }

    private static void checkBalanced(TextRenderer renderer) {
        if (renderer.currentLevel() != 0) {
            throw new IllegalStateException("Unbalanced indentation after render: level " + renderer.currentLevel());
        }
    }
}
