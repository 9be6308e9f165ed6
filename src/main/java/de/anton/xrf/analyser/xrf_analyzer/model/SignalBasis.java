package de.anton.xrf.analyser.xrf_analyzer.model;

/**
 * Signal used by the adaptive window integration for boundary search and area.
 */
public enum SignalBasis {
    RAW_COUNTS("Counts"),
    COUNTS_PER_SECOND("CPS"); // Counts divided by REAL_TIME

    private final String displayName;

    SignalBasis(String displayName) {
        this.displayName = displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
