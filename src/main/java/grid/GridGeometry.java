package grid;

import error.InvalidCellSizeException;
import error.InvalidGridException;

import java.util.ArrayList;
import java.util.List;

/**
 * Cell boundaries for a rows x columns partition. The last row and the last column
 * absorb the integer-division remainder, so the cells tile the source exactly.
 */
public final class GridGeometry {
    private GridGeometry() {
    }

    public static int baseCellWidth(int sourceWidth, GridSpec grid) {
        return sourceWidth / grid.columns();
    }

    public static int baseCellHeight(int sourceHeight, GridSpec grid) {
        return sourceHeight / grid.rows();
    }

    public static List<CellRect> computeCells(int sourceWidth, int sourceHeight, int rows, int columns) {
        return computeCells(sourceWidth, sourceHeight, new GridSpec(rows, columns));
    }

    /**
     * Row-major cells, rows outer and columns inner. A grid finer than the source yields
     * zero-sized cells instead of failing; callers that need real pixels check
     * {@link GridSpec#fits(int, int)} first.
     */
    public static List<CellRect> computeCells(int sourceWidth, int sourceHeight, GridSpec grid) {
        if (sourceWidth < 0 || sourceHeight < 0) {
            throw new InvalidCellSizeException(
                    "Invalid source dimensions: " + sourceWidth + "x" + sourceHeight);
        }
        if (grid.cellCount() > Integer.MAX_VALUE) {
            throw new InvalidGridException("Grid " + grid + " has " + grid.cellCount()
                    + " cells, more than a list can hold");
        }
        int rows = grid.rows(), columns = grid.columns();
        int baseW = baseCellWidth(sourceWidth, grid);
        int baseH = baseCellHeight(sourceHeight, grid);

        List<CellRect> cells = new ArrayList<>((int) grid.cellCount());
        for (int row = 0; row < rows; row++) {
            int y = row * baseH;
            int h = (row == rows - 1) ? sourceHeight - y : baseH;
            for (int col = 0; col < columns; col++) {
                int x = col * baseW;
                int w = (col == columns - 1) ? sourceWidth - x : baseW;
                cells.add(new CellRect(row, col, x, y, w, h));
            }
        }
        return cells;
    }
}
