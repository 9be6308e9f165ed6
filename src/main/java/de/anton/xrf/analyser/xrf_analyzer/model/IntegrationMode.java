package de.anton.xrf.analyser.xrf_analyzer.model;

/**
 * Enumeration defining how the characteristic-line signal of an element is integrated.
 * Includes a display name for log output and command line parsing.
 */
public enum IntegrationMode {
    FIXED("Fixed window"),       // Sum of counts over centre ± half-width channels
    ADAPTIVE("Adaptive window"); // Trapezoid area between the detected peak boundaries

    private final String displayName;

    IntegrationMode(String displayName) {
        this.displayName = displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }

    /**
     * Finds an IntegrationMode by constant name or display name (case-insensitive).
     *
     * @param name The name to search for.
     * @return The corresponding mode, or null if no match is found.
     */
    public static IntegrationMode fromName(String name) {
        if (name == null) {
            return null;
        }
        String trimmed = name.trim();
        for (IntegrationMode mode : values()) {
            if (mode.name().equalsIgnoreCase(trimmed) || mode.displayName.equalsIgnoreCase(trimmed)) {
                return mode;
            }
        }
        return null;
    }
}
