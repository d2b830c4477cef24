package cloud.tokendispenser.sdk;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Optional;

/**
 * Immutable configuration container used to bootstrap {@link TokenDispenserClient} instances.
 */
public final class Config {

    public static final String DEFAULT_DISCOVERY_PREFIX = "/service/token-dispenser";
    public static final int DEFAULT_MINIMUM_ALIVE_SECS = 300;
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

    /**
     * How the resolved backend identifier is invoked.
     */
    public enum InvocationMode {
        /** Synchronous AWS Lambda invocation; the identifier is a function name or ARN. */
        LAMBDA,
        /** HTTP POST; the identifier is an {@code http(s)://} function URL. */
        HTTP
    }

    private final String discoveryPrefix;
    private final Integer defaultMinimumAliveSecs;
    private final Integer maximumAliveSecs;
    private final String region;
    private final InvocationMode invocationMode;
    private final HttpClient httpClient;
    private final Duration requestTimeout;

    private Config(Builder builder) {
        this.discoveryPrefix = builder.discoveryPrefix;
        this.defaultMinimumAliveSecs = builder.defaultMinimumAliveSecs;
        this.maximumAliveSecs = builder.maximumAliveSecs;
        this.region = builder.region;
        this.invocationMode = builder.invocationMode;
        this.httpClient = builder.httpClient;
        this.requestTimeout = builder.requestTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a configuration with every default applied, suitable for most AWS environments.
     */
    public static Config defaults() {
        return builder().build();
    }

    public Config withDefaults() {
        String resolvedPrefix = sanitizePrefix(Optional.ofNullable(discoveryPrefix).orElse(DEFAULT_DISCOVERY_PREFIX));

        int resolvedDefaultTtl = Optional.ofNullable(defaultMinimumAliveSecs).orElse(DEFAULT_MINIMUM_ALIVE_SECS);
        if (resolvedDefaultTtl < 0) {
            throw new IllegalArgumentException("DefaultMinimumAliveSecs cannot be negative");
        }
        if (maximumAliveSecs != null && maximumAliveSecs < resolvedDefaultTtl) {
            throw new IllegalArgumentException(
                "MaximumAliveSecs " + maximumAliveSecs + " is below DefaultMinimumAliveSecs " + resolvedDefaultTtl);
        }

        String resolvedRegion = Optional.ofNullable(region)
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .orElse(null);

        Duration resolvedTimeout = Optional.ofNullable(requestTimeout).orElse(DEFAULT_REQUEST_TIMEOUT);
        if (resolvedTimeout.isNegative() || resolvedTimeout.isZero()) {
            resolvedTimeout = DEFAULT_REQUEST_TIMEOUT;
        }

        InvocationMode resolvedMode = Optional.ofNullable(invocationMode).orElse(InvocationMode.LAMBDA);

        HttpClient resolvedClient = httpClient;
        if (resolvedClient == null && resolvedMode == InvocationMode.HTTP) {
            resolvedClient = HttpClient.newBuilder()
                .connectTimeout(resolvedTimeout)
                .build();
        }

        return new Builder()
            .discoveryPrefix(resolvedPrefix)
            .defaultMinimumAliveSecs(resolvedDefaultTtl)
            .maximumAliveSecs(maximumAliveSecs)
            .region(resolvedRegion)
            .invocationMode(resolvedMode)
            .httpClient(resolvedClient)
            .requestTimeout(resolvedTimeout)
            .buildInternal();
    }

    private static String sanitizePrefix(String prefix) {
        String trimmed = Optional.ofNullable(prefix).map(String::trim).orElse("");
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("DiscoveryPrefix must be non-empty");
        }
        if (!trimmed.startsWith("/")) {
            throw new IllegalArgumentException("DiscoveryPrefix must start with '/': " + trimmed);
        }
        while (trimmed.length() > 1 && trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    public String getDiscoveryPrefix() {
        return discoveryPrefix;
    }

    public int getDefaultMinimumAliveSecs() {
        return defaultMinimumAliveSecs;
    }

    /**
     * @return upper bound for {@code minimum_alive_secs}, or {@code null} when unbounded.
     */
    public Integer getMaximumAliveSecs() {
        return maximumAliveSecs;
    }

    /**
     * @return AWS region for the directory and Lambda clients, or {@code null} to use the SDK's provider chain.
     */
    public String getRegion() {
        return region;
    }

    public InvocationMode getInvocationMode() {
        return invocationMode;
    }

    public HttpClient getHttpClient() {
        return httpClient;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public static final class Builder {
        private String discoveryPrefix;
        private Integer defaultMinimumAliveSecs;
        private Integer maximumAliveSecs;
        private String region;
        private InvocationMode invocationMode;
        private HttpClient httpClient;
        private Duration requestTimeout;

        public Builder discoveryPrefix(String discoveryPrefix) {
            this.discoveryPrefix = discoveryPrefix;
            return this;
        }

        public Builder defaultMinimumAliveSecs(Integer defaultMinimumAliveSecs) {
            this.defaultMinimumAliveSecs = defaultMinimumAliveSecs;
            return this;
        }

        public Builder maximumAliveSecs(Integer maximumAliveSecs) {
            this.maximumAliveSecs = maximumAliveSecs;
            return this;
        }

        public Builder region(String region) {
            this.region = region;
            return this;
        }

        public Builder invocationMode(InvocationMode invocationMode) {
            this.invocationMode = invocationMode;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Config build() {
            return new Config(this).withDefaults();
        }

        private Config buildInternal() {
            return new Config(this);
        }
    }
}
