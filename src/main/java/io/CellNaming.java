package io;

public final class CellNaming {
    private CellNaming() {
    }

    public static final String EXTENSION = ".png";

    /** All numbers are 1-based; {@code seq} counts cells in row-major order. */
    public static String fileName(int seq, int row, int column) {
        return String.format("cell_%03d_row%02d_col%02d%s", seq, row, column, EXTENSION);
    }
}
