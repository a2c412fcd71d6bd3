package error;

/**
 * Canvas dimensions exceed what a Java raster can address.
 */
public class SizeOverflowException extends GridImageException {

    public SizeOverflowException(String message) {
        super("SIZE_OVERFLOW", message);
    }

    public SizeOverflowException(String message, Throwable cause) {
        super("SIZE_OVERFLOW", message, cause);
    }
}
