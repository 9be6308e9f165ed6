package de.anton.xrf.analyser.xrf_analyzer.service;

import de.anton.xrf.analyser.xrf_analyzer.algorithms.AdaptiveWindowIntegrator;
import de.anton.xrf.analyser.xrf_analyzer.model.CalibrationPoint;
import de.anton.xrf.analyser.xrf_analyzer.model.CalibrationSource;
import de.anton.xrf.analyser.xrf_analyzer.model.ElementDefinition;
import de.anton.xrf.analyser.xrf_analyzer.model.IntegrationMode;
import de.anton.xrf.analyser.xrf_analyzer.model.ParseMode;
import de.anton.xrf.analyser.xrf_analyzer.model.ScanGrid;
import de.anton.xrf.analyser.xrf_analyzer.model.SignalBasis;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable configuration object holding all parameters for one mapping run.
 * Validated on construction, so a bad configuration fails before any file is touched.
 */
public record MappingConfiguration(
    ScanGrid grid,
    List<CalibrationPoint> calibrationPoints, // Shared calibration, also the per-file fallback
    List<ElementDefinition> elements,
    IntegrationMode integrationMode,
    CalibrationSource calibrationSource,
    ParseMode parseMode,
    SignalBasis signalBasis,  // Used for ADAPTIVE mode
    double minRSquared,
    double maxSpanKeV,        // Used for ADAPTIVE mode
    int maxChannel,
    String fileNamePattern,   // String.format pattern taking the 1-based point index
    int progressInterval,
    boolean parallel
) {

    public MappingConfiguration {
        Objects.requireNonNull(grid, "Scan grid cannot be null.");
        Objects.requireNonNull(integrationMode, "Integration mode cannot be null.");
        Objects.requireNonNull(calibrationSource, "Calibration source cannot be null.");
        Objects.requireNonNull(parseMode, "Parse mode cannot be null.");
        Objects.requireNonNull(signalBasis, "Signal basis cannot be null.");
        Objects.requireNonNull(fileNamePattern, "File name pattern cannot be null.");
        calibrationPoints = List.copyOf(Objects.requireNonNull(calibrationPoints, "Calibration points cannot be null."));
        elements = List.copyOf(Objects.requireNonNull(elements, "Element definitions cannot be null."));
        if (elements.isEmpty()) {
            throw new IllegalArgumentException("At least one element definition is required.");
        }
        Set<String> ids = new HashSet<>();
        for (ElementDefinition element : elements) {
            if (!ids.add(element.getId())) {
                throw new IllegalArgumentException("Duplicate element id: " + element.getId());
            }
        }
        if (!(minRSquared >= 0 && minRSquared <= 1)) {
            throw new IllegalArgumentException("Minimum R² must be within [0, 1]. Got: " + minRSquared);
        }
        if (!(maxSpanKeV > 0) || Double.isInfinite(maxSpanKeV)) {
            throw new IllegalArgumentException("Maximum adaptive span must be positive. Got: " + maxSpanKeV);
        }
        if (maxChannel <= 0) {
            throw new IllegalArgumentException("Maximum channel must be positive. Got: " + maxChannel);
        }
        if (!fileNamePattern.contains("%d")) {
            throw new IllegalArgumentException("File name pattern must contain %d: " + fileNamePattern);
        }
        if (progressInterval <= 0) {
            throw new IllegalArgumentException("Progress interval must be positive. Got: " + progressInterval);
        }
    }

    /** File name of the spectrum recorded at the given 1-based point index. */
    public String fileNameFor(int pointIndex) {
        return String.format(fileNamePattern, pointIndex);
    }

    /**
     * Directory name identifying the settings that change map values, e.g. {@code fixed-strict-shared}
     * or {@code adaptive-counts_per_second-span1.0-strict-per_file}.
     * Maps cached under one variant are never served to a run with another.
     */
    public String cacheVariant() {
        StringBuilder key = new StringBuilder(lower(integrationMode.name()));
        if (integrationMode == IntegrationMode.ADAPTIVE) {
            key.append('-').append(lower(signalBasis.name())).append("-span").append(maxSpanKeV);
        }
        key.append('-').append(lower(parseMode.name()));
        key.append('-').append(lower(calibrationSource.name()));
        return key.toString();
    }

    private static String lower(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder starting from the reference dataset values. */
    public static final class Builder {
        private ScanGrid grid = DatasetDefaults.grid();
        private List<CalibrationPoint> calibrationPoints = DatasetDefaults.CALIBRATION_POINTS;
        private List<ElementDefinition> elements = DatasetDefaults.ELEMENTS;
        private IntegrationMode integrationMode = IntegrationMode.FIXED;
        private CalibrationSource calibrationSource = CalibrationSource.SHARED;
        private ParseMode parseMode = ParseMode.STRICT;
        private SignalBasis signalBasis = SignalBasis.COUNTS_PER_SECOND;
        private double minRSquared = 0.999;
        private double maxSpanKeV = AdaptiveWindowIntegrator.DEFAULT_MAX_SPAN_KEV;
        private int maxChannel = DatasetDefaults.MAX_CHANNEL;
        private String fileNamePattern = DatasetDefaults.FILE_NAME_PATTERN;
        private int progressInterval = 1000;
        private boolean parallel = true;

        private Builder() {}

        public Builder grid(ScanGrid grid) { this.grid = grid; return this; }
        public Builder calibrationPoints(List<CalibrationPoint> points) { this.calibrationPoints = points; return this; }
        public Builder elements(List<ElementDefinition> elements) { this.elements = elements; return this; }
        public Builder integrationMode(IntegrationMode mode) { this.integrationMode = mode; return this; }
        public Builder calibrationSource(CalibrationSource source) { this.calibrationSource = source; return this; }
        public Builder parseMode(ParseMode parseMode) { this.parseMode = parseMode; return this; }
        public Builder signalBasis(SignalBasis signalBasis) { this.signalBasis = signalBasis; return this; }
        public Builder minRSquared(double minRSquared) { this.minRSquared = minRSquared; return this; }
        public Builder maxSpanKeV(double maxSpanKeV) { this.maxSpanKeV = maxSpanKeV; return this; }
        public Builder maxChannel(int maxChannel) { this.maxChannel = maxChannel; return this; }
        public Builder fileNamePattern(String pattern) { this.fileNamePattern = pattern; return this; }
        public Builder progressInterval(int interval) { this.progressInterval = interval; return this; }
        public Builder parallel(boolean parallel) { this.parallel = parallel; return this; }

        public MappingConfiguration build() {
            return new MappingConfiguration(grid, calibrationPoints, elements, integrationMode, calibrationSource,
                    parseMode, signalBasis, minRSquared, maxSpanKeV, maxChannel, fileNamePattern, progressInterval, parallel);
        }
    }
}
