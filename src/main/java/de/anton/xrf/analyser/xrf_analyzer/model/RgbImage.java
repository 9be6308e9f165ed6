package de.anton.xrf.analyser.xrf_analyzer.model;

/**
 * Composite colour image over the scan grid, channel values in [0, 1].
 */
public final class RgbImage {

    private final double[][][] pixels; // [row][column][channel]
    private final int rows;
    private final int columns;

    public RgbImage(int rows, int columns) {
        if (rows <= 0 || columns <= 0) {
            throw new IllegalArgumentException("Image dimensions must be positive. Got: " + rows + "x" + columns);
        }
        this.rows = rows;
        this.columns = columns;
        this.pixels = new double[rows][columns][3];
    }

    public int getRows() { return rows; }
    public int getColumns() { return columns; }

    public double get(int row, int column, int channel) {
        return pixels[row][column][channel];
    }

    public void set(int row, int column, int channel, double value) {
        pixels[row][column][channel] = value;
    }

    public void add(int row, int column, int channel, double value) {
        pixels[row][column][channel] += value;
    }

    /** @return Copy of one colour channel as a rows × columns array. */
    public double[][] channel(int channel) {
        double[][] plane = new double[rows][columns];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < columns; c++) {
                plane[r][c] = pixels[r][c][channel];
            }
        }
        return plane;
    }

    public double max() {
        double max = Double.NEGATIVE_INFINITY;
        for (double[][] row : pixels) {
            for (double[] px : row) {
                for (double v : px) {
                    max = Math.max(max, v);
                }
            }
        }
        return max;
    }

    /** True if every channel of every pixel is exactly zero. */
    public boolean isBlack() {
        for (double[][] row : pixels) {
            for (double[] px : row) {
                if (px[0] != 0 || px[1] != 0 || px[2] != 0) {
                    return false;
                }
            }
        }
        return true;
    }
}
