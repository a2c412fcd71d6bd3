package grid;

/**
 * One grid cell in source (split) or canvas (merge) pixel coordinates.
 * Row and column are 0-based.
 */
public record CellRect(int row, int column, int x, int y, int width, int height) {

    public boolean isEmpty() {
        return width <= 0 || height <= 0;
    }
}
