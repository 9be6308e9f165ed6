package de.anton.xrf.analyser.xrf_analyzer.algorithms;

import de.anton.xrf.analyser.xrf_analyzer.model.CalibrationModel;
import de.anton.xrf.analyser.xrf_analyzer.model.ElementDefinition;
import de.anton.xrf.analyser.xrf_analyzer.model.IntegrationMode;
import de.anton.xrf.analyser.xrf_analyzer.model.SignalBasis;
import de.anton.xrf.analyser.xrf_analyzer.model.Spectrum;

import java.util.Objects;

/**
 * Peak integration with boundaries adapted to the spectral shape.
 *
 * <p>Starting from the sample nearest the line energy, the window grows to each side while
 * the signal strictly decreases, and stops once it has moved more than {@code maxSpanKeV}
 * away from the start. The window is integrated with the trapezoid rule over the energy axis.
 * Deterministic; terminates on flat or monotonic input.
 */
public class AdaptiveWindowIntegrator implements PeakIntegrator {

    public static final double DEFAULT_MAX_SPAN_KEV = 1.0;

    private final SignalBasis signalBasis;
    private final double maxSpanKeV;

    public AdaptiveWindowIntegrator(SignalBasis signalBasis, double maxSpanKeV) {
        this.signalBasis = Objects.requireNonNull(signalBasis, "Signal basis cannot be null.");
        if (!(maxSpanKeV > 0) || Double.isInfinite(maxSpanKeV)) {
            throw new IllegalArgumentException("Maximum span must be a positive finite energy. Got: " + maxSpanKeV);
        }
        this.maxSpanKeV = maxSpanKeV;
    }

    public SignalBasis getSignalBasis() { return signalBasis; }
    public double getMaxSpanKeV() { return maxSpanKeV; }

    @Override
    public double integrate(Spectrum spectrum, ElementDefinition element, CalibrationModel calibration) {
        if (spectrum.getChannelCount() == 0) {
            return 0.0;
        }
        double[] signal = signalBasis == SignalBasis.COUNTS_PER_SECOND
                          ? spectrum.countsPerSecond()
                          : spectrum.countsAsDouble();
        double[] energyAxis = calibration.energyAxis(signal.length);
        return integrate(energyAxis, signal, element.getEnergyKeV(), maxSpanKeV);
    }

    @Override
    public IntegrationMode getMode() {
        return IntegrationMode.ADAPTIVE;
    }

    /**
     * @param energyAxis Energy of each sample, same length as {@code signal}.
     * @param signal     Counts or count rate per sample.
     * @param targetKeV  Nominal line energy.
     * @param maxSpanKeV Maximum distance the boundary search may travel from the start sample.
     * @return Trapezoid area of the detected window, 0 for empty input.
     */
    public static double integrate(double[] energyAxis, double[] signal, double targetKeV, double maxSpanKeV) {
        if (energyAxis == null || signal == null || signal.length == 0) {
            return 0.0;
        }
        if (energyAxis.length != signal.length) {
            throw new IllegalArgumentException("Energy axis and signal lengths differ: " + energyAxis.length + " vs " + signal.length);
        }
        int start = nearestIndex(energyAxis, targetKeV);

        int left = start;
        while (left > 0 && signal[left - 1] < signal[left]) {
            left--;
            if (energyAxis[start] - energyAxis[left] > maxSpanKeV) {
                break;
            }
        }

        int right = start;
        while (right < signal.length - 1 && signal[right + 1] < signal[right]) {
            right++;
            if (energyAxis[right] - energyAxis[start] > maxSpanKeV) {
                break;
            }
        }

        return trapezoid(energyAxis, signal, left, right);
    }

    /** Index of the first sample whose energy is closest to the target. */
    static int nearestIndex(double[] energyAxis, double targetKeV) {
        int best = 0;
        double bestDistance = Math.abs(energyAxis[0] - targetKeV);
        for (int i = 1; i < energyAxis.length; i++) {
            double distance = Math.abs(energyAxis[i] - targetKeV);
            if (distance < bestDistance) {
                bestDistance = distance;
                best = i;
            }
        }
        return best;
    }

    /** Trapezoid rule over the inclusive sample range; a single sample has zero area. */
    static double trapezoid(double[] x, double[] y, int from, int to) {
        double area = 0.0;
        for (int i = from; i < to; i++) {
            area += 0.5 * (x[i + 1] - x[i]) * (y[i] + y[i + 1]);
        }
        return area;
    }
}
