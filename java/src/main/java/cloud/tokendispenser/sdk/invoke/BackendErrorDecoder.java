package cloud.tokendispenser.sdk.invoke;

import cloud.tokendispenser.sdk.BackendException;
import cloud.tokendispenser.sdk.internal.Json;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.Optional;

/**
 * Utility for turning non-success invocation results into {@link BackendException}s.
 */
final class BackendErrorDecoder {

    private static final ObjectMapper MAPPER = Json.mapper();

    // Lambda answers 200 even when the function itself failed.
    static final int FUNCTION_ERROR_STATUS = 500;

    private BackendErrorDecoder() {
    }

    static BackendException decode(InvocationResult result) {
        int status = result.statusCode();
        if (result.functionError() != null && status < 400) {
            status = FUNCTION_ERROR_STATUS;
        }
        return new BackendException(status, result.body(), result.functionError());
    }

    /**
     * Detects the {@code {"statusCode": <int>, "body": <string>}} error envelope the token dispenser uses to report
     * failures inside an otherwise successful response.
     */
    static Optional<BackendException> fromEnvelope(String body) {
        if (body == null) {
            return Optional.empty();
        }
        String trimmed = body.trim();
        if (!trimmed.startsWith("{")) {
            return Optional.empty();
        }
        try {
            JsonNode node = MAPPER.readTree(trimmed);
            if (node == null || !node.isObject() || node.size() != 2) {
                return Optional.empty();
            }
            JsonNode status = node.get("statusCode");
            JsonNode message = node.get("body");
            if (status == null || !status.canConvertToInt() || !status.isIntegralNumber()
                || message == null || !message.isTextual()) {
                return Optional.empty();
            }
            if (status.asInt() < 400) {
                return Optional.empty();
            }
            return Optional.of(new BackendException(status.asInt(), message.asText()));
        } catch (IOException ex) {
            return Optional.empty();
        }
    }
}
