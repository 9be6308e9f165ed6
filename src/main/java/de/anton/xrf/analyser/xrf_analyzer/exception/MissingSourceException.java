package de.anton.xrf.analyser.xrf_analyzer.exception;

import java.io.FileNotFoundException;
import java.nio.file.Path;

/**
 * The spectrum file expected for a scan point does not exist.
 * Recoverable: the grid assembler records the point as missing and leaves its cells at zero.
 */
public class MissingSourceException extends FileNotFoundException {

    private final transient Path path;

    public MissingSourceException(Path path) {
        super("Spectrum source not found: " + path);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
