package stages;

import java.nio.file.Path;

/** A grid position left at background because its input could not be used. */
public record CellFailure(int index, int row, int column, Path source, String errorCode, String message) {

    public String describe() {
        return "Error processing file " + source + " (row " + (row + 1) + ", col " + (column + 1) + "): " + message;
    }
}
