package cloud.rentdesk.sdk;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Immutable configuration container used to bootstrap {@link SessionCoordinator} instances.
 */
public final class Config {

    public static final Duration DEFAULT_HTTP_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_SESSION_EXPIRY_BUFFER = Duration.ofSeconds(30);
    public static final Duration DEFAULT_REFRESH_BUFFER = Duration.ofMinutes(5);
    public static final Duration DEFAULT_SESSION_CHECK_INTERVAL = Duration.ofSeconds(60);
    public static final Duration DEFAULT_SESSION_FETCH_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_DATA_LOAD_TIMEOUT = Duration.ofSeconds(15);
    public static final int DEFAULT_MAX_RETRY_ATTEMPTS = 3;
    public static final Duration DEFAULT_BASE_RETRY_DELAY = Duration.ofMillis(500);
    public static final Duration DEFAULT_MAX_RETRY_DELAY = Duration.ofSeconds(10);

    private final String authUrl;
    private final String restUrl;
    private final String apiKey;
    private final HttpClient httpClient;
    private final Duration httpTimeout;
    private final Duration sessionExpiryBuffer;
    private final Duration refreshBuffer;
    private final Duration sessionCheckInterval;
    private final Duration sessionFetchTimeout;
    private final Duration dataLoadTimeout;
    private final Integer maxRetryAttempts;
    private final Duration baseRetryDelay;
    private final Duration maxRetryDelay;
    private final boolean autoRefresh;
    private final Path contextStorePath;
    private final Clock clock;

    private Config(Builder builder) {
        this.authUrl = builder.authUrl;
        this.restUrl = builder.restUrl;
        this.apiKey = builder.apiKey;
        this.httpClient = builder.httpClient;
        this.httpTimeout = builder.httpTimeout;
        this.sessionExpiryBuffer = builder.sessionExpiryBuffer;
        this.refreshBuffer = builder.refreshBuffer;
        this.sessionCheckInterval = builder.sessionCheckInterval;
        this.sessionFetchTimeout = builder.sessionFetchTimeout;
        this.dataLoadTimeout = builder.dataLoadTimeout;
        this.maxRetryAttempts = builder.maxRetryAttempts;
        this.baseRetryDelay = builder.baseRetryDelay;
        this.maxRetryDelay = builder.maxRetryDelay;
        this.autoRefresh = builder.autoRefresh;
        this.contextStorePath = builder.contextStorePath;
        this.clock = builder.clock;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Config withDefaults() {
        String resolvedAuthUrl = sanitizeUrl(authUrl, "AuthURL");
        String resolvedRestUrl = sanitizeUrl(restUrl, "RestURL");

        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException("ApiKey is required");
        }

        Duration resolvedTimeout = positiveOrDefault(httpTimeout, DEFAULT_HTTP_TIMEOUT);

        int resolvedAttempts = Optional.ofNullable(maxRetryAttempts).orElse(DEFAULT_MAX_RETRY_ATTEMPTS);
        if (resolvedAttempts < 0) {
            throw new IllegalArgumentException("MaxRetryAttempts cannot be negative");
        }

        Duration resolvedBaseDelay = positiveOrDefault(baseRetryDelay, DEFAULT_BASE_RETRY_DELAY);
        Duration resolvedMaxDelay = positiveOrDefault(maxRetryDelay, DEFAULT_MAX_RETRY_DELAY);
        if (resolvedMaxDelay.compareTo(resolvedBaseDelay) < 0) {
            throw new IllegalArgumentException("MaxRetryDelay must not be shorter than BaseRetryDelay");
        }

        HttpClient resolvedClient = httpClient;
        if (resolvedClient == null) {
            resolvedClient = HttpClient.newBuilder()
                .connectTimeout(resolvedTimeout)
                .build();
        }

        return new Builder()
            .authUrl(resolvedAuthUrl)
            .restUrl(resolvedRestUrl)
            .apiKey(apiKey.trim())
            .httpClient(resolvedClient)
            .httpTimeout(resolvedTimeout)
            .sessionExpiryBuffer(positiveOrDefault(sessionExpiryBuffer, DEFAULT_SESSION_EXPIRY_BUFFER))
            .refreshBuffer(positiveOrDefault(refreshBuffer, DEFAULT_REFRESH_BUFFER))
            .sessionCheckInterval(positiveOrDefault(sessionCheckInterval, DEFAULT_SESSION_CHECK_INTERVAL))
            .sessionFetchTimeout(positiveOrDefault(sessionFetchTimeout, DEFAULT_SESSION_FETCH_TIMEOUT))
            .dataLoadTimeout(positiveOrDefault(dataLoadTimeout, DEFAULT_DATA_LOAD_TIMEOUT))
            .maxRetryAttempts(resolvedAttempts)
            .baseRetryDelay(resolvedBaseDelay)
            .maxRetryDelay(resolvedMaxDelay)
            .autoRefresh(autoRefresh)
            .contextStorePath(contextStorePath)
            .clock(Optional.ofNullable(clock).orElseGet(Clock::systemUTC))
            .buildInternal();
    }

    private static Duration positiveOrDefault(Duration value, Duration fallback) {
        if (value == null || value.isNegative() || value.isZero()) {
            return fallback;
        }
        return value;
    }

    private static String sanitizeUrl(String url, String name) {
        String trimmed = Optional.ofNullable(url).map(String::trim).orElse("");
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException(name + " is required");
        }
        try {
            URI uri = new URI(trimmed);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalArgumentException(name + " must include scheme and host");
            }
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("Invalid " + name + ": " + trimmed, ex);
        }
        if (trimmed.endsWith("/")) {
            return trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    public String getAuthUrl() {
        return authUrl;
    }

    public String getRestUrl() {
        return restUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public HttpClient getHttpClient() {
        return httpClient;
    }

    public Duration getHttpTimeout() {
        return httpTimeout;
    }

    public Duration getSessionExpiryBuffer() {
        return sessionExpiryBuffer;
    }

    public Duration getRefreshBuffer() {
        return refreshBuffer;
    }

    public Duration getSessionCheckInterval() {
        return sessionCheckInterval;
    }

    public Duration getSessionFetchTimeout() {
        return sessionFetchTimeout;
    }

    public Duration getDataLoadTimeout() {
        return dataLoadTimeout;
    }

    public int getMaxRetryAttempts() {
        return maxRetryAttempts == null ? DEFAULT_MAX_RETRY_ATTEMPTS : maxRetryAttempts;
    }

    public Duration getBaseRetryDelay() {
        return baseRetryDelay;
    }

    public Duration getMaxRetryDelay() {
        return maxRetryDelay;
    }

    public boolean isAutoRefresh() {
        return autoRefresh;
    }

    /**
     * @return location of the file remembering the last active context, or {@code null} to keep it in memory.
     */
    public Path getContextStorePath() {
        return contextStorePath;
    }

    public Clock getClock() {
        return clock;
    }

    public static final class Builder {
        private String authUrl;
        private String restUrl;
        private String apiKey;
        private HttpClient httpClient;
        private Duration httpTimeout;
        private Duration sessionExpiryBuffer;
        private Duration refreshBuffer;
        private Duration sessionCheckInterval;
        private Duration sessionFetchTimeout;
        private Duration dataLoadTimeout;
        private Integer maxRetryAttempts;
        private Duration baseRetryDelay;
        private Duration maxRetryDelay;
        private boolean autoRefresh = true;
        private Path contextStorePath;
        private Clock clock;

        public Builder authUrl(String authUrl) {
            this.authUrl = authUrl;
            return this;
        }

        public Builder restUrl(String restUrl) {
            this.restUrl = restUrl;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder httpTimeout(Duration httpTimeout) {
            this.httpTimeout = httpTimeout;
            return this;
        }

        public Builder sessionExpiryBuffer(Duration sessionExpiryBuffer) {
            this.sessionExpiryBuffer = sessionExpiryBuffer;
            return this;
        }

        public Builder refreshBuffer(Duration refreshBuffer) {
            this.refreshBuffer = refreshBuffer;
            return this;
        }

        public Builder sessionCheckInterval(Duration sessionCheckInterval) {
            this.sessionCheckInterval = sessionCheckInterval;
            return this;
        }

        public Builder sessionFetchTimeout(Duration sessionFetchTimeout) {
            this.sessionFetchTimeout = sessionFetchTimeout;
            return this;
        }

        public Builder dataLoadTimeout(Duration dataLoadTimeout) {
            this.dataLoadTimeout = dataLoadTimeout;
            return this;
        }

        public Builder maxRetryAttempts(int maxRetryAttempts) {
            this.maxRetryAttempts = maxRetryAttempts;
            return this;
        }

        public Builder baseRetryDelay(Duration baseRetryDelay) {
            this.baseRetryDelay = baseRetryDelay;
            return this;
        }

        public Builder maxRetryDelay(Duration maxRetryDelay) {
            this.maxRetryDelay = maxRetryDelay;
            return this;
        }

        public Builder autoRefresh(boolean autoRefresh) {
            this.autoRefresh = autoRefresh;
            return this;
        }

        public Builder contextStorePath(Path contextStorePath) {
            this.contextStorePath = contextStorePath;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
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
