package cloud.tokendispenser.sdk;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Checks caller input before any remote interaction. Validation is all-or-nothing: either a complete
 * {@link TokenRequest} is returned or a {@link ValidationException} listing every problem is thrown.
 */
public final class InputValidator {

    static final Pattern CLIENT_ID_PATTERN = Pattern.compile("^[a-zA-Z0-9]{3,32}$");

    private final int defaultMinimumAliveSecs;
    private final Integer maximumAliveSecs;

    public InputValidator(int defaultMinimumAliveSecs, Integer maximumAliveSecs) {
        if (defaultMinimumAliveSecs < 0) {
            throw new IllegalArgumentException("defaultMinimumAliveSecs cannot be negative");
        }
        this.defaultMinimumAliveSecs = defaultMinimumAliveSecs;
        this.maximumAliveSecs = maximumAliveSecs;
    }

    public static InputValidator from(Config config) {
        return new InputValidator(config.getDefaultMinimumAliveSecs(), config.getMaximumAliveSecs());
    }

    public TokenRequest validate(String clientId, Integer minimumAliveSecs) throws ValidationException {
        return validate(clientId, minimumAliveSecs, null);
    }

    public TokenRequest validate(String clientId, Integer minimumAliveSecs, String discoveryKey)
        throws ValidationException {

        List<String> problems = new ArrayList<>();
        ValidationException.Kind kind = null;

        if (clientId == null || clientId.isBlank()) {
            problems.add("client_id is required");
            kind = ValidationException.Kind.INVALID_CLIENT_ID;
        } else if (!CLIENT_ID_PATTERN.matcher(clientId).matches()) {
            problems.add("client_id must be between length 3-32 with pattern [a-zA-Z0-9]{3,32}");
            kind = ValidationException.Kind.INVALID_CLIENT_ID;
        }

        int ttl = minimumAliveSecs == null ? defaultMinimumAliveSecs : minimumAliveSecs;
        if (ttl < 0) {
            problems.add("minimum_alive_secs cannot be negative, got " + ttl);
        } else if (maximumAliveSecs != null && ttl > maximumAliveSecs) {
            problems.add("minimum_alive_secs must be between 0 and " + maximumAliveSecs + ", got " + ttl);
        }
        if (kind == null && !problems.isEmpty()) {
            kind = ValidationException.Kind.INVALID_TTL;
        }

        if (!problems.isEmpty()) {
            throw new ValidationException(kind, problems);
        }

        String key = discoveryKey == null || discoveryKey.isBlank() ? null : discoveryKey.trim();
        return new TokenRequest(clientId, ttl, key);
    }
}
