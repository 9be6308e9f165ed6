package de.anton.xrf.analyser.xrf_analyzer.model;

import de.anton.xrf.analyser.xrf_analyzer.exception.CalibrationException;

/**
 * Fitted linear channel-to-energy calibration: {@code energy = slope * channel + intercept}.
 * Instances are immutable and safe to share between scan workers.
 */
public final class CalibrationModel {

    private final double slope;          // keV per channel
    private final double intercept;      // keV at channel 0
    private final double rSquared;       // Coefficient of determination of the fit
    private final int pointCount;

    public CalibrationModel(double slope, double intercept, double rSquared, int pointCount) {
        if (!Double.isFinite(slope) || slope == 0) {
            throw new CalibrationException("Calibration slope must be finite and non-zero. Got: " + slope);
        }
        if (!Double.isFinite(intercept)) {
            throw new CalibrationException("Calibration intercept must be finite. Got: " + intercept);
        }
        this.slope = slope;
        this.intercept = intercept;
        this.rSquared = rSquared;
        this.pointCount = pointCount;
    }

    public double getSlope() { return slope; }
    public double getIntercept() { return intercept; }
    public double getRSquared() { return rSquared; }
    public int getPointCount() { return pointCount; }

    /** Energy in keV at the given (possibly fractional) channel. */
    public double toEnergy(double channel) {
        return slope * channel + intercept;
    }

    /**
     * Nearest channel for the given energy, using the inverse of the same linear model.
     *
     * @throws CalibrationException If the channel is not representable as an int.
     */
    public int toChannel(double energyKeV) {
        double channel = Math.floor((energyKeV - intercept) / slope + 0.5); // Math.round semantics
        if (!(channel >= Integer.MIN_VALUE && channel <= Integer.MAX_VALUE)) {
            throw new CalibrationException(String.format(
                    "Energy %.4f keV maps to channel %.4g, outside the channel range", energyKeV, channel));
        }
        return (int) channel;
    }

    /**
     * Builds the energy axis for a spectrum with the given number of channels.
     *
     * @param channelCount Number of channels (non-negative).
     * @return Array where index i holds the energy of channel i.
     */
    public double[] energyAxis(int channelCount) {
        if (channelCount < 0) {
            throw new IllegalArgumentException("Channel count cannot be negative. Got: " + channelCount);
        }
        double[] axis = new double[channelCount];
        for (int i = 0; i < channelCount; i++) {
            axis[i] = toEnergy(i);
        }
        return axis;
    }

    public boolean isTrustworthy(double minRSquared) {
        return !Double.isNaN(rSquared) && rSquared >= minRSquared;
    }

    /**
     * @throws CalibrationException if the fit quality is below {@code minRSquared}.
     */
    public CalibrationModel requireQuality(double minRSquared) {
        if (!isTrustworthy(minRSquared)) {
            throw CalibrationException.poorFit(rSquared, minRSquared);
        }
        return this;
    }

    @Override
    public String toString() {
        return String.format("E = %.5f × channel + %.4f keV (R² = %.6f, n = %d)", slope, intercept, rSquared, pointCount);
    }
}
