package de.anton.xrf.analyser.xrf_analyzer.exception;

import java.io.IOException;

/**
 * Signals that a spectrum record could not be parsed: a malformed line in strict mode
 * or a record without a {@code <<DATA>>} section.
 */
public class SpectrumParseException extends IOException {

    private final String source;
    private final int lineNumber; // 1-based, 0 if not tied to a line

    public SpectrumParseException(String source, int lineNumber, String message) {
        super(formatMessage(source, lineNumber, message));
        this.source = source;
        this.lineNumber = lineNumber;
    }

    public SpectrumParseException(String source, int lineNumber, String message, Throwable cause) {
        super(formatMessage(source, lineNumber, message), cause);
        this.source = source;
        this.lineNumber = lineNumber;
    }

    public String getSource() {
        return source;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    private static String formatMessage(String source, int lineNumber, String message) {
        if (lineNumber > 0) {
            return String.format("%s (line %d): %s", source, lineNumber, message);
        }
        return source + ": " + message;
    }
}
