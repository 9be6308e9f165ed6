package de.anton.xrf.analyser.xrf_analyzer.algorithms;

import de.anton.xrf.analyser.xrf_analyzer.model.ElementMap;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;

/**
 * Utility class for rescaling element maps to [0, 1].
 * Provides percentile normalisation (robust to hot pixels), excess normalisation
 * (signal above an estimated substrate level) and plain min-max scaling.
 * Inputs are never modified; every method returns a new sealed map.
 */
public final class MapNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(MapNormalizer.class);

    /** Guards the division on constant maps. */
    public static final double EPSILON = 1e-10;
    public static final double DEFAULT_LOW_PERCENTILE = 1.0;
    public static final double DEFAULT_HIGH_PERCENTILE = 99.0;
    public static final double DEFAULT_BACKGROUND_PERCENTILE = 8.0;
    public static final double DEFAULT_PEAK_PERCENTILE = 99.0;

    private MapNormalizer() {
        throw new IllegalStateException("Utility class should not be instantiated.");
    }

    /** Percentile normalisation with the 1st/99th percentile bounds. */
    public static ElementMap percentile(ElementMap map) {
        return percentile(map, DEFAULT_LOW_PERCENTILE, DEFAULT_HIGH_PERCENTILE);
    }

    /**
     * Computes {@code clip((map - v_lo) / (v_hi - v_lo + EPSILON), 0, 1)} where v_lo and v_hi are
     * the given percentiles of the map values.
     *
     * @param map  The map to normalise.
     * @param low  Lower percentile in [0, 100).
     * @param high Upper percentile in (low, 100].
     * @return A new sealed map with values in [0, 1].
     */
    public static ElementMap percentile(ElementMap map, double low, double high) {
        Objects.requireNonNull(map, "Map cannot be null.");
        checkBounds(low, high);
        double[] flat = map.flatten();
        double vLo = percentileOf(flat, low);
        double vHi = percentileOf(flat, high);
        logger.trace("Percentile normalisation of '{}': p{}={}, p{}={}", map.getElementId(), low, vLo, high, vHi);
        return rescale(map.getElementId(), flat, vLo, vHi, map.getRows(), map.getColumns());
    }

    /** Excess normalisation with background at the 8th and peak at the 99th percentile. */
    public static ElementMap excess(ElementMap map) {
        return excess(map, DEFAULT_BACKGROUND_PERCENTILE, DEFAULT_PEAK_PERCENTILE);
    }

    /**
     * Isolates signal above the substrate: the background percentile is taken as the diffuse
     * substrate level and the peak percentile as full pigment signal.
     */
    public static ElementMap excess(ElementMap map, double backgroundPercentile, double peakPercentile) {
        Objects.requireNonNull(map, "Map cannot be null.");
        checkBounds(backgroundPercentile, peakPercentile);
        double[] flat = map.flatten();
        double background = percentileOf(flat, backgroundPercentile);
        double peak = percentileOf(flat, peakPercentile);
        logger.trace("Excess normalisation of '{}': background={}, peak={}", map.getElementId(), background, peak);
        return rescale(map.getElementId(), flat, background, peak, map.getRows(), map.getColumns());
    }

    /**
     * Min-max scaling to [0, 1]. Constant maps are scaled to 0.5.
     */
    public static ElementMap minMax(ElementMap map) {
        Objects.requireNonNull(map, "Map cannot be null.");
        double[] flat = map.flatten();
        double min = Arrays.stream(flat).min().orElse(0.0);
        double max = Arrays.stream(flat).max().orElse(0.0);
        double range = max - min;
        double[] scaled = new double[flat.length];
        for (int i = 0; i < flat.length; i++) {
            scaled[i] = Math.abs(range) < EPSILON ? 0.5 : (flat[i] - min) / range;
        }
        return ElementMap.fromFlat(map.getElementId(), scaled, map.getRows(), map.getColumns());
    }

    /**
     * Percentile with linear interpolation between closest ranks (Hyndman-Fan type 7).
     *
     * @param values Values to rank; not modified.
     * @param p      Percentile in [0, 100].
     */
    public static double percentileOf(double[] values, double p) {
        if (values == null || values.length == 0) {
            throw new IllegalArgumentException("Cannot compute a percentile of an empty array.");
        }
        if (Double.isNaN(p) || p < 0 || p > 100) {
            throw new IllegalArgumentException("Percentile must be within [0, 100]. Got: " + p);
        }
        if (p == 0) {
            return Arrays.stream(values).min().getAsDouble();
        }
        return new Percentile().withEstimationType(Percentile.EstimationType.R_7).evaluate(values, p);
    }

    private static ElementMap rescale(String elementId, double[] flat, double lo, double hi, int rows, int cols) {
        double denominator = hi - lo + EPSILON;
        double[] scaled = new double[flat.length];
        for (int i = 0; i < flat.length; i++) {
            scaled[i] = clip((flat[i] - lo) / denominator);
        }
        return ElementMap.fromFlat(elementId, scaled, rows, cols);
    }

    static double clip(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static void checkBounds(double low, double high) {
        if (Double.isNaN(low) || Double.isNaN(high) || low < 0 || high > 100 || low >= high) {
            throw new IllegalArgumentException("Percentile bounds must satisfy 0 <= low < high <= 100. Got: " + low + ", " + high);
        }
    }
}
