package de.anton.xrf.analyser.xrf_analyzer.model;

/**
 * Handling of malformed numeric lines inside the DATA and CALIBRATION sections.
 */
public enum ParseMode {
    STRICT("Strict"),   // Malformed line fails the whole record
    LENIENT("Lenient"); // Malformed line is skipped and logged

    private final String displayName;

    ParseMode(String displayName) {
        this.displayName = displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
