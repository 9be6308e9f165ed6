package de.anton.xrf.analyser.xrf_analyzer.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One parsed multichannel spectrum: counts per channel, metadata and the optional
 * calibration points embedded in the record. Immutable.
 */
public final class Spectrum {

    private static final Logger logger = LoggerFactory.getLogger(Spectrum.class);

    public static final String REAL_TIME_KEY = "REAL_TIME";
    public static final double DEFAULT_REAL_TIME = 1.0;

    private final String source;
    private final int[] counts;
    private final Map<String, String> metadata;
    private final List<CalibrationPoint> calibrationPoints;

    public Spectrum(String source, int[] counts, Map<String, String> metadata, List<CalibrationPoint> calibrationPoints) {
        this.source = source != null ? source : "<unknown>";
        this.counts = Objects.requireNonNull(counts, "Counts cannot be null.").clone();
        this.metadata = metadata == null || metadata.isEmpty()
                        ? Collections.emptyMap()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.calibrationPoints = calibrationPoints == null ? List.of() : List.copyOf(calibrationPoints);
    }

    public String getSource() { return source; }
    public int getChannelCount() { return counts.length; }
    public int countAt(int channel) { return counts[channel]; }

    /** @return A copy of the counts array. */
    public int[] getCounts() { return counts.clone(); }

    public Map<String, String> getMetadata() { return metadata; }
    public List<CalibrationPoint> getCalibrationPoints() { return calibrationPoints; }
    public boolean hasCalibration() { return !calibrationPoints.isEmpty(); }

    public long totalCounts() {
        long total = 0;
        for (int c : counts) {
            total += c;
        }
        return total;
    }

    /**
     * Acquisition real time in seconds. Defaults to 1.0 when the key is absent, so that counts
     * and count rate coincide; unparsable or non-positive values also fall back to 1.0.
     */
    public double realTime() {
        String raw = metadata.get(REAL_TIME_KEY);
        if (raw == null) {
            return DEFAULT_REAL_TIME;
        }
        try {
            double value = Double.parseDouble(raw.trim());
            if (value > 0 && Double.isFinite(value)) {
                return value;
            }
            logger.warn("{}: non-positive {} '{}', using {}", source, REAL_TIME_KEY, raw, DEFAULT_REAL_TIME);
        } catch (NumberFormatException e) {
            logger.warn("{}: unparsable {} '{}', using {}", source, REAL_TIME_KEY, raw, DEFAULT_REAL_TIME);
        }
        return DEFAULT_REAL_TIME;
    }

    /** Counts normalised by {@link #realTime()} (CPS). */
    public double[] countsPerSecond() {
        double time = realTime();
        double[] cps = new double[counts.length];
        for (int i = 0; i < counts.length; i++) {
            cps[i] = counts[i] / time;
        }
        return cps;
    }

    /** Counts as doubles, unnormalised. */
    public double[] countsAsDouble() {
        double[] raw = new double[counts.length];
        for (int i = 0; i < counts.length; i++) {
            raw[i] = counts[i];
        }
        return raw;
    }

    @Override
    public String toString() {
        return "Spectrum{" + source + ", " + counts.length + " channels, " + calibrationPoints.size() + " calibration points}";
    }
}
