package info.isaksson.erland.sfsymbolsgen.ir;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON snapshot of an assembled {@link IrFile}, for inspecting what the generator fed to the renderer.
 *
 * <p>Writing is deterministic: properties follow the declared order, nulls are omitted and every node
 * carries a {@code "node"} discriminator.</p>
 */
public final class IrJson {

    private static final ObjectMapper MAPPER = createMapper();
    private static final DefaultPrettyPrinter PRETTY = createPrettyPrinter();

    private IrJson() {}

    public static void write(IrFile file, Path path) throws IOException {
        if (file == null) throw new IllegalArgumentException("file is null");
        if (path == null) throw new IllegalArgumentException("path is null");
        Path parent = path.toAbsolutePath().normalize().getParent();
        if (parent != null) Files.createDirectories(parent);
        try (var out = Files.newOutputStream(path)) {
            MAPPER.writer(PRETTY).writeValue(out, file);
            // Ensure trailing newline for diff-friendliness.
            out.write('\n');
        }
    }

    public static String toJsonString(IrFile file) throws IOException {
        if (file == null) throw new IllegalArgumentException("file is null");
        return MAPPER.writer(PRETTY).writeValueAsString(file) + "\n";
    }

    private static ObjectMapper createMapper() {
        ObjectMapper om = new ObjectMapper();
        om.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        om.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
        om.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        // Prevent Jackson from closing the provided OutputStream/Writer.
        om.getFactory().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        return om;
    }

    private static DefaultPrettyPrinter createPrettyPrinter() {
        DefaultPrettyPrinter pp = new DefaultPrettyPrinter();
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        pp.indentObjectsWith(indenter);
        pp.indentArraysWith(indenter);
        return pp;
    }
}
