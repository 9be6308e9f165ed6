package de.anton.xrf.analyser.xrf_analyzer.model;

/**
 * Where the channel-to-energy calibration of a spectrum comes from.
 */
public enum CalibrationSource {
    /** One model fitted once from the dataset-level calibration points. */
    SHARED("Shared"),
    /** Model fitted from the CALIBRATION section of each file, falling back to the shared one. */
    PER_FILE("Per file");

    private final String displayName;

    CalibrationSource(String displayName) {
        this.displayName = displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
