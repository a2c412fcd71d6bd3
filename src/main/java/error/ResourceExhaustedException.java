package error;

/**
 * Not enough heap for a source, cell or canvas buffer.
 */
public class ResourceExhaustedException extends GridImageException {

    public ResourceExhaustedException(String message) {
        super("RESOURCE_EXHAUSTED", message);
    }

    public ResourceExhaustedException(String message, Throwable cause) {
        super("RESOURCE_EXHAUSTED", message, cause);
    }
}
