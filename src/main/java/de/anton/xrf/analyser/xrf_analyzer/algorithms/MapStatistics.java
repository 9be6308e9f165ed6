package de.anton.xrf.analyser.xrf_analyzer.algorithms;

import de.anton.xrf.analyser.xrf_analyzer.model.ElementMap;
import de.anton.xrf.analyser.xrf_analyzer.model.MapComparison;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.stat.regression.SimpleRegression;

import java.util.Objects;

/**
 * Element-wise algebra and agreement statistics for pairs of maps on the same grid.
 */
public final class MapStatistics {

    private MapStatistics() { throw new IllegalStateException("Utility class"); }

    /** Element-wise {@code a - b}; keeps the element id of {@code a}. */
    public static ElementMap difference(ElementMap a, ElementMap b) {
        double[] fa = flatOf(a, b);
        double[] fb = b.flatten();
        double[] diff = new double[fa.length];
        for (int i = 0; i < fa.length; i++) {
            diff[i] = fa[i] - fb[i];
        }
        return ElementMap.fromFlat(a.getElementId(), diff, a.getRows(), a.getColumns());
    }

    /** Element-wise mean of two maps, e.g. two detectors viewing the same scan. */
    public static ElementMap average(ElementMap a, ElementMap b) {
        double[] fa = flatOf(a, b);
        double[] fb = b.flatten();
        double[] mean = new double[fa.length];
        for (int i = 0; i < fa.length; i++) {
            mean[i] = (fa[i] + fb[i]) / 2.0;
        }
        return ElementMap.fromFlat(a.getElementId(), mean, a.getRows(), a.getColumns());
    }

    /**
     * Pearson correlation of the flattened maps. NaN if either map is constant.
     */
    public static double pearson(ElementMap a, ElementMap b) {
        double[] fa = flatOf(a, b);
        if (fa.length < 2) {
            return Double.NaN;
        }
        return new PearsonsCorrelation().correlation(fa, b.flatten());
    }

    /** Root mean square of all map values. */
    public static double rms(ElementMap map) {
        Objects.requireNonNull(map, "Map cannot be null.");
        double[] flat = map.flatten();
        double sumSq = 0.0;
        for (double v : flat) {
            sumSq += v * v;
        }
        return Math.sqrt(sumSq / flat.length);
    }

    /**
     * Least-squares line of {@code b} on {@code a} over all cells.
     *
     * @return {slope, intercept}; NaN entries if {@code a} is constant.
     */
    public static double[] regression(ElementMap a, ElementMap b) {
        double[] fa = flatOf(a, b);
        double[] fb = b.flatten();
        SimpleRegression regression = new SimpleRegression(true);
        for (int i = 0; i < fa.length; i++) {
            regression.addData(fa[i], fb[i]);
        }
        return new double[] {regression.getSlope(), regression.getIntercept()};
    }

    /**
     * Full comparison of two raw maps of one element: percentile-normalised correlation and
     * RMS difference, raw correlation and the raw regression line.
     */
    public static MapComparison compare(ElementMap rawA, ElementMap rawB) {
        flatOf(rawA, rawB);
        ElementMap normA = MapNormalizer.percentile(rawA);
        ElementMap normB = MapNormalizer.percentile(rawB);
        double[] line = regression(rawA, rawB);
        return new MapComparison(
                rawA.getElementId(),
                pearson(normA, normB),
                pearson(rawA, rawB),
                rms(difference(normA, normB)),
                line[0],
                line[1]);
    }

    private static double[] flatOf(ElementMap a, ElementMap b) {
        Objects.requireNonNull(a, "Map A cannot be null.");
        Objects.requireNonNull(b, "Map B cannot be null.");
        if (!a.hasSameShape(b)) {
            throw new IllegalArgumentException(String.format("Maps differ in shape: %dx%d vs %dx%d",
                    a.getRows(), a.getColumns(), b.getRows(), b.getColumns()));
        }
        return a.flatten();
    }
}
