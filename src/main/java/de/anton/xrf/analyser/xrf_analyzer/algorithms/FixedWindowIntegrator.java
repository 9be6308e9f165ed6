package de.anton.xrf.analyser.xrf_analyzer.algorithms;

import de.anton.xrf.analyser.xrf_analyzer.model.CalibrationModel;
import de.anton.xrf.analyser.xrf_analyzer.model.ElementDefinition;
import de.anton.xrf.analyser.xrf_analyzer.model.IntegrationMode;
import de.anton.xrf.analyser.xrf_analyzer.model.Spectrum;

/**
 * Rectangular window integration: the plain sum of counts over
 * {@code [center - halfWidth, center + halfWidth]}, clipped to the spectrum.
 * No rate normalisation is applied.
 */
public class FixedWindowIntegrator implements PeakIntegrator {

    @Override
    public double integrate(Spectrum spectrum, ElementDefinition element, CalibrationModel calibration) {
        int center = element.centerChannel(calibration);
        return windowSum(spectrum.getCounts(), center, element.getHalfWidth());
    }

    @Override
    public IntegrationMode getMode() {
        return IntegrationMode.FIXED;
    }

    /**
     * Sums counts over the inclusive channel range {@code [max(0, c-h), min(len-1, c+h)]}.
     * Returns 0 for an empty array or a window lying completely outside it.
     */
    public static long windowSum(int[] counts, int center, int halfWidth) {
        if (counts == null || counts.length == 0 || halfWidth < 0) {
            return 0L;
        }
        long lo = Math.max(0L, (long) center - halfWidth);
        long hi = Math.min(counts.length - 1L, (long) center + halfWidth);
        long sum = 0L;
        for (long i = lo; i <= hi; i++) {
            sum += counts[(int) i];
        }
        return sum;
    }
}
