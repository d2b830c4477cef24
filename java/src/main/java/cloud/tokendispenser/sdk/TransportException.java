package cloud.tokendispenser.sdk;

/**
 * Raised when the directory service or the invocation transport fails before the backend could answer.
 */
public final class TransportException extends TokenDispenserException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;

    public TransportException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public TransportException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * @return HTTP status of the failed service call, or {@code -1} when the fault happened client side.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
