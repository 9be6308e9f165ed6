package de.anton.xrf.analyser.xrf_analyzer.model;

/**
 * A known (channel, energy) pair used to fit the linear calibration.
 */
public record CalibrationPoint(int channel, double energyKeV) {

    public CalibrationPoint {
        if (channel < 0) {
            throw new IllegalArgumentException("Calibration channel cannot be negative. Got: " + channel);
        }
        if (!(energyKeV > 0) || Double.isInfinite(energyKeV)) {
            throw new IllegalArgumentException("Calibration energy must be a positive finite value. Got: " + energyKeV);
        }
    }
}
