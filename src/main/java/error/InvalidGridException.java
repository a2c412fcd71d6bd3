package error;

/**
 * Row or column count is not usable for the image at hand.
 */
public class InvalidGridException extends GridImageException {

    public InvalidGridException(String message) {
        super("INVALID_GRID", message);
    }

    public InvalidGridException(String message, Throwable cause) {
        super("INVALID_GRID", message, cause);
    }
}
