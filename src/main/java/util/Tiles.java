package util;

import error.InvalidCellSizeException;
import error.ResourceExhaustedException;
import grid.CellRect;

import java.awt.image.BufferedImage;

public final class Tiles {
    private Tiles() {
    }

    /**
     * Pixel-exact copy of {@code rect} into a new standalone image. The copy keeps an
     * alpha channel only when the source has one.
     */
    public static BufferedImage extract(BufferedImage src, CellRect rect) {
        if (rect.isEmpty()) {
            throw new InvalidCellSizeException("Cell r" + (rect.row() + 1) + " c" + (rect.column() + 1)
                    + " has no pixels (" + rect.width() + "x" + rect.height() + ")");
        }
        int W = src.getWidth(), H = src.getHeight();
        if (rect.x() < 0 || rect.y() < 0 || rect.x() + rect.width() > W || rect.y() + rect.height() > H) {
            throw new IllegalArgumentException("Cell " + rect + " lies outside the " + W + "x" + H + " source");
        }
        int type = src.getColorModel().hasAlpha() ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
        BufferedImage cell;
        try {
            cell = new BufferedImage(rect.width(), rect.height(), type);
            int w = rect.width();
            int[] row = new int[w];
            for (int yy = 0; yy < rect.height(); yy++) {
                src.getRGB(rect.x(), rect.y() + yy, w, 1, row, 0, w);
                cell.setRGB(0, yy, w, 1, row, 0, w);
            }
        } catch (OutOfMemoryError e) {
            throw new ResourceExhaustedException("Insufficient memory to extract cell r" + (rect.row() + 1)
                    + " c" + (rect.column() + 1) + " (" + rect.width() + "x" + rect.height() + ")", e);
        }
        return cell;
    }

    public static void copy(BufferedImage tile, BufferedImage dst, int dx, int dy) {
        int[] row = new int[tile.getWidth()];
        for (int y = 0; y < tile.getHeight(); y++) {
            tile.getRGB(0, y, row.length, 1, row, 0, row.length);
            dst.setRGB(dx, dy + y, row.length, 1, row, 0, row.length);
        }
    }
}
