package cloud.tokendispenser.sdk.invoke;

import cloud.tokendispenser.sdk.TransportException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * {@link FunctionInvoker} posting the payload to an HTTP(S) function URL. The identifier is the URL itself.
 */
public final class HttpFunctionInvoker implements FunctionInvoker {

    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public HttpFunctionInvoker(HttpClient httpClient, Duration requestTimeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.requestTimeout = requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()
            ? Duration.ofSeconds(30) : requestTimeout;
    }

    @Override
    public InvocationResult call(String identifier, byte[] payload) throws TransportException {
        URI uri = toUri(identifier);
        HttpRequest request = HttpRequest.newBuilder()
            .uri(uri)
            .POST(HttpRequest.BodyPublishers.ofByteArray(payload))
            .header("Content-Type", "application/json")
            .header("Accept", "application/json")
            .timeout(requestTimeout)
            .build();

        try {
            HttpResponse<String> response = httpClient.send(request,
                HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            String functionError = response.headers().firstValue("X-Amz-Function-Error").orElse(null);
            return new InvocationResult(response.statusCode(), response.body(), functionError);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new TransportException("invoke " + identifier + " interrupted", ex);
        } catch (IOException ex) {
            throw new TransportException("invoke " + identifier + ": " + ex.getMessage(), ex);
        }
    }

    private static URI toUri(String identifier) throws TransportException {
        URI uri;
        try {
            uri = URI.create(identifier.trim());
        } catch (IllegalArgumentException ex) {
            throw new TransportException("invalid function URL: " + identifier, ex);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if ((!scheme.equals("http") && !scheme.equals("https")) || uri.getHost() == null) {
            throw new TransportException("function URL must be http(s) with a host: " + identifier, null);
        }
        return uri;
    }
}
