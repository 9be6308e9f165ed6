package de.anton.xrf.analyser.xrf_analyzer.exception;

/**
 * Exception indicating that a channel-to-energy calibration cannot be trusted:
 * too few points, degenerate channel values, or insufficient fit quality.
 *
 * <p>Fatal when raised for the shared calibration, since every map depends on it.
 */
public class CalibrationException extends IllegalArgumentException {

    public CalibrationException(String message) {
        super(message);
    }

    public CalibrationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Creates calibration exception for an insufficient number of points.
     */
    public static CalibrationException insufficientPoints(int required, int actual) {
        return new CalibrationException(
                String.format("Insufficient calibration points: need at least %d, but got %d", required, actual));
    }

    /**
     * Creates calibration exception for a fit below the required coefficient of determination.
     */
    public static CalibrationException poorFit(double rSquared, double minRSquared) {
        return new CalibrationException(
                String.format("Calibration fit quality too low: R²=%.6f, required >= %.6f", rSquared, minRSquared));
    }
}
