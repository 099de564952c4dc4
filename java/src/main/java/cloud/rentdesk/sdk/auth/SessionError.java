package cloud.rentdesk.sdk.auth;

import cloud.rentdesk.sdk.RentdeskApiException;
import cloud.rentdesk.sdk.RentdeskException;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.util.Locale;
import java.util.Objects;

/**
 * Typed session failure attached to results and to the published auth state. Never persisted.
 */
public record SessionError(SessionErrorCode code, String message, Throwable cause) {

    public SessionError {
        Objects.requireNonNull(code, "code");
        if (message == null || message.isBlank()) {
            message = code.defaultMessage();
        }
    }

    public static SessionError of(SessionErrorCode code) {
        return new SessionError(code, null, null);
    }

    public static SessionError of(SessionErrorCode code, String message) {
        return new SessionError(code, message, null);
    }

    public static SessionError of(SessionErrorCode code, String message, Throwable cause) {
        return new SessionError(code, message, cause);
    }

    /**
     * Maps a gateway failure onto the taxonomy. Transport failures become {@code TIMEOUT} or
     * {@code NETWORK_ERROR}; 401 responses and token complaints become {@code INVALID_TOKEN} (or
     * {@code SESSION_EXPIRED} when the backend says so); everything else becomes {@code fallback}.
     */
    public static SessionError classify(RentdeskException ex, SessionErrorCode fallback) {
        Throwable cause = ex.getCause();
        if (cause instanceof HttpTimeoutException) {
            return of(SessionErrorCode.TIMEOUT, ex.getMessage(), ex);
        }
        if (cause instanceof IOException) {
            return of(SessionErrorCode.NETWORK_ERROR, ex.getMessage(), ex);
        }
        String message = ex.getMessage() == null ? "" : ex.getMessage().toLowerCase(Locale.ROOT);
        if (message.contains("expired")) {
            return of(SessionErrorCode.SESSION_EXPIRED, ex.getMessage(), ex);
        }
        boolean unauthorized = ex instanceof RentdeskApiException
            && ((RentdeskApiException) ex).getStatusCode() == 401;
        if (unauthorized || message.contains("invalid jwt") || message.contains("invalid token")) {
            return of(SessionErrorCode.INVALID_TOKEN, ex.getMessage(), ex);
        }
        return of(fallback, ex.getMessage(), ex);
    }

    public SessionException toException() {
        return new SessionException(this);
    }
}
