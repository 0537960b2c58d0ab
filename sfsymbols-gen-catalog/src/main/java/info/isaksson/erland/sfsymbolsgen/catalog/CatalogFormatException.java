package info.isaksson.erland.sfsymbolsgen.catalog;

import java.io.IOException;
import java.nio.file.Path;

/** A catalog file is missing or cannot be decoded. */
public class CatalogFormatException extends IOException {

    private final Path file;

    public CatalogFormatException(Path file, String message) {
        super(file + ": " + message);
        this.file = file;
    }

    public CatalogFormatException(Path file, String message, Throwable cause) {
        super(file + ": " + message, cause);
        this.file = file;
    }

    public Path file() {
        return file;
    }
}
