package cloud.tokendispenser.sdk.invoke;

/**
 * Raw answer of a transport call.
 *
 * @param statusCode    status reported by the transport.
 * @param body          response body decoded as UTF-8, possibly empty.
 * @param functionError function error type when the backend failed while handling the call, otherwise {@code null}.
 */
public record InvocationResult(int statusCode, String body, String functionError) {

    public static InvocationResult of(int statusCode, String body) {
        return new InvocationResult(statusCode, body, null);
    }

    public boolean isSuccess() {
        return statusCode < 400 && functionError == null;
    }
}
