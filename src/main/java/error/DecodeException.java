package error;

/**
 * A specific image file could not be decoded.
 */
public class DecodeException extends GridImageException {

    public DecodeException(String message) {
        super("DECODE", message);
    }

    public DecodeException(String message, Throwable cause) {
        super("DECODE", message, cause);
    }
}
