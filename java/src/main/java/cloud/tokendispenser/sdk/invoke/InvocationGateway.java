package cloud.tokendispenser.sdk.invoke;

import cloud.tokendispenser.sdk.BackendException;
import cloud.tokendispenser.sdk.TokenDispenserException;
import cloud.tokendispenser.sdk.TokenRequest;
import cloud.tokendispenser.sdk.TransportException;
import cloud.tokendispenser.sdk.internal.Json;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Invokes the resolved token dispenser backend and maps its answer.
 *
 * <p>
 * The payload is {@code {"client_id": ..., "minimum_alive_secs": ...}}. A successful body is returned exactly as
 * received; the client never looks into token fields.
 * </p>
 */
public final class InvocationGateway {

    private static final Logger LOGGER = Logger.getLogger(InvocationGateway.class.getName());

    private final FunctionInvoker invoker;

    public InvocationGateway(FunctionInvoker invoker) {
        this.invoker = Objects.requireNonNull(invoker, "invoker");
    }

    /**
     * @return the backend response body, unmodified.
     * @throws BackendException   when the backend rejected the request.
     * @throws TransportException when the backend could not be reached.
     */
    public String invoke(String identifier, TokenRequest request) throws TokenDispenserException {
        Objects.requireNonNull(identifier, "identifier");
        Objects.requireNonNull(request, "request");

        byte[] payload = encode(request);
        LOGGER.fine(() -> "[tds-client] invoking " + identifier + " for client " + request.clientId());
        InvocationResult result = invoker.call(identifier, payload);

        if (!result.isSuccess()) {
            BackendException error = BackendErrorDecoder.decode(result);
            LOGGER.warning(() -> "[tds-client] " + error.getMessage());
            throw error;
        }

        String body = result.body() == null ? "" : result.body();
        Optional<BackendException> enveloped = BackendErrorDecoder.fromEnvelope(body);
        if (enveloped.isPresent()) {
            LOGGER.warning(() -> "[tds-client] " + enveloped.get().getMessage());
            throw enveloped.get();
        }
        return body;
    }

    static byte[] encode(TokenRequest request) throws TokenDispenserException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("client_id", request.clientId());
        payload.put("minimum_alive_secs", request.minimumAliveSecs());
        try {
            return Json.mapper().writeValueAsBytes(payload);
        } catch (JsonProcessingException ex) {
            throw new TokenDispenserException("encode token request: " + ex.getOriginalMessage(), ex);
        }
    }
}
