package de.anton.xrf.analyser.xrf_analyzer.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Two-dimensional intensity map of one element over the scan grid (rows × columns).
 *
 * <p>A map is filled cell by cell while a scan runs and sealed when it completes; any write
 * after {@link #seal()} fails. Distinct cells may be written from different threads.
 */
public final class ElementMap {

    private final String elementId;
    private final double[][] values;
    private final int rows;
    private final int columns;
    private volatile boolean sealed = false;

    private ElementMap(String elementId, double[][] values) {
        this.elementId = Objects.requireNonNull(elementId, "Element id cannot be null.");
        this.values = values;
        this.rows = values.length;
        this.columns = values[0].length;
    }

    /** Creates a writable map filled with zeros. */
    public static ElementMap zeros(String elementId, ScanGrid grid) {
        Objects.requireNonNull(grid, "Scan grid cannot be null.");
        return new ElementMap(elementId, new double[grid.getRows()][grid.getColumns()]);
    }

    /**
     * Creates a sealed map holding a deep copy of the given rectangular array.
     */
    public static ElementMap of(String elementId, double[][] data) {
        if (data == null || data.length == 0 || data[0] == null || data[0].length == 0) {
            throw new IllegalArgumentException("Map data must have at least one row and one column.");
        }
        int cols = data[0].length;
        double[][] copy = new double[data.length][];
        for (int r = 0; r < data.length; r++) {
            if (data[r] == null || data[r].length != cols) {
                throw new IllegalArgumentException("Map data is not rectangular at row " + r + ".");
            }
            copy[r] = data[r].clone();
        }
        ElementMap map = new ElementMap(elementId, copy);
        map.seal();
        return map;
    }

    /** Creates a sealed map from row-major flat values. */
    public static ElementMap fromFlat(String elementId, double[] flat, int rows, int columns) {
        if (rows <= 0 || columns <= 0 || flat == null || flat.length != rows * columns) {
            throw new IllegalArgumentException("Flat data length does not match " + rows + "x" + columns + ".");
        }
        double[][] data = new double[rows][columns];
        for (int r = 0; r < rows; r++) {
            System.arraycopy(flat, r * columns, data[r], 0, columns);
        }
        ElementMap map = new ElementMap(elementId, data);
        map.seal();
        return map;
    }

    public String getElementId() { return elementId; }
    public int getRows() { return rows; }
    public int getColumns() { return columns; }
    public boolean isSealed() { return sealed; }

    public double get(int row, int column) {
        return values[row][column];
    }

    public void set(int row, int column, double value) {
        if (sealed) {
            throw new IllegalStateException("Element map '" + elementId + "' is sealed.");
        }
        values[row][column] = value;
    }

    /** Makes the map read-only. Idempotent. */
    public ElementMap seal() {
        sealed = true;
        return this;
    }

    /** Copy of the map under a different element id. */
    public ElementMap withElementId(String newElementId) {
        return of(newElementId, values);
    }

    public boolean hasSameShape(ElementMap other) {
        return other != null && rows == other.rows && columns == other.columns;
    }

    /** @return A deep copy of the map values. */
    public double[][] toArray() {
        double[][] copy = new double[rows][];
        for (int r = 0; r < rows; r++) {
            copy[r] = values[r].clone();
        }
        return copy;
    }

    /** @return Row-major copy of all values. */
    public double[] flatten() {
        double[] flat = new double[rows * columns];
        for (int r = 0; r < rows; r++) {
            System.arraycopy(values[r], 0, flat, r * columns, columns);
        }
        return flat;
    }

    public double min() { return Arrays.stream(flatten()).min().orElse(Double.NaN); }
    public double max() { return Arrays.stream(flatten()).max().orElse(Double.NaN); }
    public double mean() { return Arrays.stream(flatten()).average().orElse(Double.NaN); }

    @Override
    public String toString() {
        return "ElementMap{" + elementId + ", " + rows + "x" + columns + (sealed ? ", sealed" : "") + "}";
    }
}
