package cloud.rentdesk.sdk.auth;

/**
 * Closed set of failure kinds reported by session operations.
 */
public enum SessionErrorCode {
    NO_SESSION("No active session"),
    SESSION_EXPIRED("Session has expired"),
    NETWORK_ERROR("Unable to reach the authentication service"),
    INVALID_TOKEN("Access token is invalid"),
    REFRESH_FAILED("Failed to refresh session"),
    TIMEOUT("Session request timed out"),
    UNKNOWN_ERROR("Unexpected session error");

    private final String defaultMessage;

    SessionErrorCode(String defaultMessage) {
        this.defaultMessage = defaultMessage;
    }

    public String defaultMessage() {
        return defaultMessage;
    }

    /**
     * @return whether a caller may retry the failed call with backoff.
     */
    public boolean isRetryable() {
        return this == NETWORK_ERROR;
    }

    /**
     * @return whether the failure should trigger a refresh before being surfaced.
     */
    public boolean requiresRefresh() {
        return this == INVALID_TOKEN || this == SESSION_EXPIRED;
    }
}
