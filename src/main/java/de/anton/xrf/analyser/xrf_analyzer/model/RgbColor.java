package de.anton.xrf.analyser.xrf_analyzer.model;

/**
 * Colour with channel intensities in [0, 1], used as the tint of a composite layer.
 */
public record RgbColor(double red, double green, double blue) {

    public RgbColor {
        checkChannel("red", red);
        checkChannel("green", green);
        checkChannel("blue", blue);
    }

    /** @return channel 0 (red), 1 (green) or 2 (blue). */
    public double channel(int index) {
        switch (index) {
            case 0: return red;
            case 1: return green;
            case 2: return blue;
            default: throw new IndexOutOfBoundsException("Colour channel must be 0..2, got " + index);
        }
    }

    private static void checkChannel(String name, double value) {
        if (Double.isNaN(value) || value < 0 || value > 1) {
            throw new IllegalArgumentException("Colour channel '" + name + "' must be within [0, 1]. Got: " + value);
        }
    }
}
