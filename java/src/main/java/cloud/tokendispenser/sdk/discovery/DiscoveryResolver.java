package cloud.tokendispenser.sdk.discovery;

import cloud.tokendispenser.sdk.DiscoveryException;
import cloud.tokendispenser.sdk.TransportException;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Resolves the identifier of the token dispenser backend.
 *
 * <p>
 * An explicit key is trusted as a full entry name. Without one, the default prefix is searched and exactly one entry
 * must exist below it. Several deployments can share one account, so when more than one entry is found the resolver
 * fails instead of choosing one; the caller has to pass the fully qualified key.
 * </p>
 */
public final class DiscoveryResolver {

    private static final Logger LOGGER = Logger.getLogger(DiscoveryResolver.class.getName());

    // Only 0, 1 or "more than one" matters.
    static final int CANDIDATE_LIMIT = 2;

    private final ParameterDirectory directory;
    private final String defaultPrefix;

    public DiscoveryResolver(ParameterDirectory directory, String defaultPrefix) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.defaultPrefix = Objects.requireNonNull(defaultPrefix, "defaultPrefix");
    }

    public String getDefaultPrefix() {
        return defaultPrefix;
    }

    /**
     * @param discoveryKey explicit entry name, or {@code null} to search the default prefix.
     * @return the backend identifier.
     * @throws DiscoveryException when no entry, or more than one candidate, is found.
     * @throws TransportException when the directory itself cannot be reached.
     */
    public String resolve(String discoveryKey) throws DiscoveryException, TransportException {
        if (discoveryKey != null) {
            return resolveExplicit(discoveryKey);
        }
        return resolveByPrefix();
    }

    private String resolveExplicit(String key) throws DiscoveryException, TransportException {
        Optional<String> value = directory.get(key).filter(v -> !v.isBlank());
        if (value.isEmpty()) {
            throw new DiscoveryException(DiscoveryException.Kind.NOT_FOUND, key,
                "Not able to find tds arn for: " + key);
        }
        LOGGER.fine(() -> "[tds-client] resolved backend from explicit key " + key);
        return value.get();
    }

    private String resolveByPrefix() throws DiscoveryException, TransportException {
        Map<String, String> candidates = directory.listUnder(defaultPrefix, CANDIDATE_LIMIT);
        LOGGER.fine(() -> "[tds-client] found " + candidates.size() + " candidate(s) under " + defaultPrefix);

        if (candidates.size() > 1) {
            throw new DiscoveryException(DiscoveryException.Kind.AMBIGUOUS, defaultPrefix,
                "Found more than one tds arn for: " + defaultPrefix
                    + ". Please provide a specific key which points to the token dispenser, not a path");
        }

        Optional<String> value = candidates.values().stream()
            .filter(Objects::nonNull)
            .filter(v -> !v.isBlank())
            .findFirst();
        if (value.isEmpty()) {
            throw new DiscoveryException(DiscoveryException.Kind.NOT_FOUND, defaultPrefix,
                "Not able to find tds arn for: " + defaultPrefix
                    + ". Please provide a specific key which points to the token dispenser");
        }
        return value.get();
    }
}
