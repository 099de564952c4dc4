package cloud.rentdesk.sdk.auth;

import java.time.Instant;
import java.util.Objects;

/**
 * Bearer session issued by the identity provider.
 */
public final class Session {
    private final String accessToken;
    private final String refreshToken;
    private final Instant expiresAt;
    private final AuthUser user;

    public Session(String accessToken, String refreshToken, Instant expiresAt, AuthUser user) {
        this.accessToken = Objects.requireNonNull(accessToken, "accessToken");
        this.refreshToken = refreshToken;
        this.expiresAt = expiresAt;
        this.user = user;
    }

    public String getAccessToken() {
        return accessToken;
    }

    public String getRefreshToken() {
        return refreshToken;
    }

    /**
     * @return absolute expiry, or {@code null} when the provider did not report one.
     */
    public Instant getExpiresAt() {
        return expiresAt;
    }

    public AuthUser getUser() {
        return user;
    }

    public String getUserId() {
        return user == null ? null : user.id();
    }

    public Session withUser(AuthUser updated) {
        return new Session(accessToken, refreshToken, expiresAt, updated);
    }

    @Override
    public String toString() {
        return "Session{userId=" + getUserId() + ", expiresAt=" + expiresAt + "}";
    }
}
