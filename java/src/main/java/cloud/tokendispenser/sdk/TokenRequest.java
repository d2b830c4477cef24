package cloud.tokendispenser.sdk;

/**
 * Validated parameters of a single token request. Instances are produced by {@link InputValidator}.
 *
 * @param clientId         caller defined client id matching {@code [a-zA-Z0-9]{3,32}}.
 * @param minimumAliveSecs minimum remaining lifetime the returned token must have.
 * @param discoveryKey     explicit directory key of the backend, or {@code null} to search the default prefix.
 */
public record TokenRequest(String clientId, int minimumAliveSecs, String discoveryKey) {
}
