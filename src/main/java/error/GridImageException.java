package error;

/**
 * Base of every failure raised while splitting or merging. The error code is a stable
 * tag for callers that need to tell the kinds apart without instanceof chains.
 */
public class GridImageException extends RuntimeException {

    private final String errorCode;

    public GridImageException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public GridImageException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
