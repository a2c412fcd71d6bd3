package error;

/**
 * Missing file or folder, or access denied.
 */
public class PathException extends GridImageException {

    public PathException(String message) {
        super("PATH", message);
    }

    public PathException(String message, Throwable cause) {
        super("PATH", message, cause);
    }
}
