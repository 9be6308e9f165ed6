package de.anton.xrf.analyser.xrf_analyzer.model;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Describes one characteristic line to be mapped: element symbol, line label, tabulated
 * energy and the half-width of the fixed integration window.
 * This class is intended to be immutable.
 */
public final class ElementDefinition {

    private final String id;          // Short key, also used in cache file names (e.g. "Pb_La")
    private final String name;        // Full element name
    private final String lineLabel;   // XRF line, e.g. "Kα", "Lβ"
    private final double energyKeV;   // Tabulated line energy
    private final int halfWidth;      // Fixed window half-width in channels
    private final Integer pinnedChannel; // Exact centre channel, overrides the calibration lookup

    public ElementDefinition(String id, String name, String lineLabel, double energyKeV, int halfWidth) {
        this(id, name, lineLabel, energyKeV, halfWidth, null);
    }

    /**
     * @param pinnedChannel Centre channel to use instead of inverting the calibration, or null.
     *                      Used for lines that are themselves calibration points.
     */
    public ElementDefinition(String id, String name, String lineLabel, double energyKeV, int halfWidth, Integer pinnedChannel) {
        this.id = Objects.requireNonNull(id, "Element id cannot be null.");
        if (id.trim().isEmpty()) {
            throw new IllegalArgumentException("Element id cannot be empty.");
        }
        this.name = Objects.requireNonNull(name, "Element name cannot be null for '" + id + "'.");
        this.lineLabel = Objects.requireNonNull(lineLabel, "Line label cannot be null for '" + id + "'.");
        if (!(energyKeV > 0) || Double.isInfinite(energyKeV)) {
            throw new IllegalArgumentException("Line energy must be positive for element '" + id + "'. Got: " + energyKeV);
        }
        if (halfWidth <= 0) {
            throw new IllegalArgumentException("Integration half-width must be positive for element '" + id + "'. Got: " + halfWidth);
        }
        if (pinnedChannel != null && pinnedChannel < 0) {
            throw new IllegalArgumentException("Pinned channel cannot be negative for element '" + id + "'. Got: " + pinnedChannel);
        }
        this.energyKeV = energyKeV;
        this.halfWidth = halfWidth;
        this.pinnedChannel = pinnedChannel;
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public String getLineLabel() { return lineLabel; }
    public double getEnergyKeV() { return energyKeV; }
    public int getHalfWidth() { return halfWidth; }
    public OptionalInt getPinnedChannel() { return pinnedChannel == null ? OptionalInt.empty() : OptionalInt.of(pinnedChannel); }

    /** Centre channel of the fixed integration window under the given calibration. */
    public int centerChannel(CalibrationModel calibration) {
        if (pinnedChannel != null) {
            return pinnedChannel;
        }
        return Objects.requireNonNull(calibration, "Calibration cannot be null.").toChannel(energyKeV);
    }

    /**
     * Checks that the line falls inside the detector range under the given calibration.
     *
     * @throws IllegalArgumentException if the centre channel is outside [0, maxChannel).
     */
    public void validateAgainst(CalibrationModel calibration, int maxChannel) {
        int center = centerChannel(calibration);
        if (center < 0 || center >= maxChannel) {
            throw new IllegalArgumentException(String.format(
                    "Element '%s' (%.3f keV) maps to channel %d, outside [0, %d)", id, energyKeV, center, maxChannel));
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ElementDefinition that = (ElementDefinition) o;
        return Double.compare(that.energyKeV, energyKeV) == 0 &&
               halfWidth == that.halfWidth &&
               id.equals(that.id) &&
               name.equals(that.name) &&
               lineLabel.equals(that.lineLabel) &&
               Objects.equals(pinnedChannel, that.pinnedChannel);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, lineLabel, energyKeV, halfWidth, pinnedChannel);
    }

    @Override
    public String toString() {
        return String.format("%s %s (%.3f keV, ±%d ch)", name, lineLabel, energyKeV, halfWidth);
    }
}
