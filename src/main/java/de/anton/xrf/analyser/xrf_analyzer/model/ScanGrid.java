package de.anton.xrf.analyser.xrf_analyzer.model;

/**
 * Geometry of a raster scan. Point indices are 1-based and run left to right, top to bottom:
 * point n sits at row {@code (n-1) / columns} and column {@code (n-1) % columns}.
 */
public final class ScanGrid {

    private final int rows;
    private final int columns;

    public ScanGrid(int rows, int columns) {
        if (rows <= 0 || columns <= 0) {
            throw new IllegalArgumentException("Scan grid dimensions must be positive. Got: " + rows + "x" + columns);
        }
        if ((long) rows * columns > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Scan grid too large: " + rows + "x" + columns);
        }
        this.rows = rows;
        this.columns = columns;
    }

    public int getRows() { return rows; }
    public int getColumns() { return columns; }
    public int getPointCount() { return rows * columns; }

    public int rowOf(int pointIndex) {
        checkIndex(pointIndex);
        return (pointIndex - 1) / columns;
    }

    public int columnOf(int pointIndex) {
        checkIndex(pointIndex);
        return (pointIndex - 1) % columns;
    }

    /** Inverse of {@link #rowOf}/{@link #columnOf}. */
    public int pointIndexOf(int row, int column) {
        if (row < 0 || row >= rows || column < 0 || column >= columns) {
            throw new IndexOutOfBoundsException("Cell (" + row + ", " + column + ") outside " + this);
        }
        return row * columns + column + 1;
    }

    private void checkIndex(int pointIndex) {
        if (pointIndex < 1 || pointIndex > getPointCount()) {
            throw new IndexOutOfBoundsException("Point index " + pointIndex + " outside 1.." + getPointCount());
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScanGrid)) return false;
        ScanGrid that = (ScanGrid) o;
        return rows == that.rows && columns == that.columns;
    }

    @Override
    public int hashCode() {
        return 31 * rows + columns;
    }

    @Override
    public String toString() {
        return rows + "x" + columns + " grid";
    }
}
