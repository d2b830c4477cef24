package cloud.tokendispenser.sdk;

/**
 * Exception representing a rejection reported by the token dispenser backend itself. The status and raw body are
 * kept as separate fields so callers can branch on {@link #getStatusCode()} without parsing the message.
 */
public final class BackendException extends TokenDispenserException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;
    private final String body;
    private final String functionError;

    public BackendException(int statusCode, String body) {
        this(statusCode, body, null);
    }

    public BackendException(int statusCode, String body, String functionError) {
        super(describe(statusCode, body, functionError));
        this.statusCode = statusCode;
        this.body = body;
        this.functionError = functionError;
    }

    /**
     * @return status reported by the backend (or by the transport on its behalf).
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return raw response body, possibly {@code null} when the backend sent none.
     */
    public String getBody() {
        return body;
    }

    /**
     * @return function error type reported by the transport (for example {@code Unhandled}), or {@code null}.
     */
    public String getFunctionError() {
        return functionError;
    }

    private static String describe(int status, String body, String functionError) {
        StringBuilder message = new StringBuilder("Token dispenser request failed with status ").append(status);
        if (functionError != null && !functionError.isBlank()) {
            message.append(" (").append(functionError).append(')');
        }
        if (body != null && !body.isBlank()) {
            message.append(": ").append(body);
        }
        return message.toString();
    }
}
