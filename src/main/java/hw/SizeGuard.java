package hw;

import error.InvalidCellSizeException;
import error.InvalidGridException;
import error.SizeOverflowException;

import java.util.function.Consumer;

/**
 * Checks merged canvas dimensions before anything is allocated.
 */
public final class SizeGuard {

    /** Past this on either axis many decoders and viewers give up; warn, don't fail. */
    public static final int SOFT_DIMENSION_LIMIT = 32767;

    /** A Java raster stores its samples in one array, so the pixel count must fit an int index. */
    public static final long MAX_PIXELS = Integer.MAX_VALUE;

    private final Consumer<String> status;

    public SizeGuard(Consumer<String> status) {
        this.status = status;
    }

    public CanvasSize validateCanvasSize(int cellWidth, int cellHeight, int rows, int columns) {
        if (cellWidth <= 0 || cellHeight <= 0) {
            throw new InvalidCellSizeException("Invalid cell dimensions: " + cellWidth + "x" + cellHeight);
        }
        if (rows <= 0 || columns <= 0) {
            throw new InvalidGridException("Invalid number of rows or columns: " + rows + "x" + columns);
        }

        long totalWidth = (long) cellWidth * columns;
        long totalHeight = (long) cellHeight * rows;
        if (totalWidth > Integer.MAX_VALUE || totalHeight > Integer.MAX_VALUE) {
            throw new SizeOverflowException("Final image size is too large: " + totalWidth + "x" + totalHeight);
        }
        // both factors fit an int here, so the product cannot overflow a long
        if (totalWidth * totalHeight > MAX_PIXELS) {
            throw new SizeOverflowException("Final image size is too large: " + totalWidth + "x" + totalHeight
                    + " (" + totalWidth * totalHeight + " pixels, limit " + MAX_PIXELS + ")");
        }

        boolean oversized = totalWidth > SOFT_DIMENSION_LIMIT || totalHeight > SOFT_DIMENSION_LIMIT;
        if (oversized) {
            status.accept("Warning: Very large image may cause memory issues! ("
                    + totalWidth + "x" + totalHeight + ")");
        }
        return new CanvasSize((int) totalWidth, (int) totalHeight, oversized);
    }
}
