package error;

/**
 * Cell or source dimensions are zero or negative.
 */
public class InvalidCellSizeException extends GridImageException {

    public InvalidCellSizeException(String message) {
        super("INVALID_CELL_SIZE", message);
    }

    public InvalidCellSizeException(String message, Throwable cause) {
        super("INVALID_CELL_SIZE", message, cause);
    }
}
