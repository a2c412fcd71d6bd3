package grid;

import error.InvalidGridException;

public record GridSpec(int rows, int columns) {

    public GridSpec {
        if (rows <= 0 || columns <= 0) {
            throw new InvalidGridException(
                    "Invalid number of rows or columns: " + rows + "x" + columns + " (both must be positive)");
        }
    }

    public long cellCount() {
        return (long) rows * columns;
    }

    /** True when every cell of this grid gets at least one pixel on both axes. */
    public boolean fits(int width, int height) {
        return columns <= width && rows <= height;
    }

    @Override
    public String toString() {
        return rows + "x" + columns;
    }
}
