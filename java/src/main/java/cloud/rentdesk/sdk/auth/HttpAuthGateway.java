package cloud.rentdesk.sdk.auth;

import com.fasterxml.jackson.databind.JsonNode;
import cloud.rentdesk.sdk.RentdeskException;
import cloud.rentdesk.sdk.internal.ApiErrorDecoder;
import cloud.rentdesk.sdk.internal.HttpUtil;
import cloud.rentdesk.sdk.internal.Json;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link AuthGateway} speaking to a GoTrue-style identity endpoint ({@code /token}, {@code /logout},
 * {@code /user}). The gateway remembers the last session it issued so {@link #currentSession()} can hand it back
 * on a cold start; embedders that persist sessions themselves seed it with {@link #restore(Session)}.
 */
public final class HttpAuthGateway implements AuthGateway {

    private static final long DEFAULT_EXPIRES_IN_SECONDS = 3600;

    private final HttpClient httpClient;
    private final String authUrl;
    private final String apiKey;
    private final Duration requestTimeout;
    private final Clock clock;

    private final AtomicReference<Session> established = new AtomicReference<>();

    public HttpAuthGateway(HttpClient httpClient, String authUrl, String apiKey, Duration requestTimeout, Clock clock) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.authUrl = Objects.requireNonNull(authUrl, "authUrl");
        this.apiKey = Objects.requireNonNull(apiKey, "apiKey");
        this.requestTimeout = requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()
            ? Duration.ofSeconds(30) : requestTimeout;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public void restore(Session session) {
        established.set(session);
    }

    @Override
    public Optional<Session> currentSession() {
        return Optional.ofNullable(established.get());
    }

    @Override
    public Session signInWithPassword(String email, String password) throws RentdeskException {
        if (email == null || email.isBlank()) {
            throw new RentdeskException("email is required");
        }
        if (password == null || password.isEmpty()) {
            throw new RentdeskException("password is required");
        }
        Map<String, String> body = new HashMap<>();
        body.put("email", email.trim());
        body.put("password", password);

        Session session = requestSession("/token?grant_type=password", body, "sign in");
        established.set(session);
        return session;
    }

    @Override
    public Session refresh(String refreshToken) throws RentdeskException {
        if (refreshToken == null || refreshToken.isBlank()) {
            throw new RentdeskException("refresh token is required");
        }
        Session session = requestSession("/token?grant_type=refresh_token", Map.of("refresh_token", refreshToken), "refresh session");
        established.set(session);
        return session;
    }

    @Override
    public void signOut(String accessToken) throws RentdeskException {
        try {
            HttpResponse<InputStream> response = send("POST", "/logout", null, accessToken, "sign out");
            try (InputStream bodyStream = response.body()) {
                // 401/404 mean the session is already gone on the provider side.
                if (response.statusCode() >= 400 && response.statusCode() != 401 && response.statusCode() != 404) {
                    throw ApiErrorDecoder.decode(response.statusCode(), bodyStream);
                }
            } catch (IOException ex) {
                throw new RentdeskException("decode sign out response: " + ex.getMessage(), ex);
            }
        } finally {
            established.set(null);
        }
    }

    @Override
    public AuthUser fetchUser(String accessToken) throws RentdeskException {
        HttpResponse<InputStream> response = send("GET", "/user", null, accessToken, "fetch user");
        try (InputStream bodyStream = response.body()) {
            if (response.statusCode() >= 400) {
                throw ApiErrorDecoder.decode(response.statusCode(), bodyStream);
            }
            JsonNode node = Json.mapper().readTree(bodyStream);
            AuthUser user = readUser(node);
            if (user == null) {
                throw new RentdeskException("user response missing id");
            }
            return user;
        } catch (IOException ex) {
            throw new RentdeskException("decode user response: " + ex.getMessage(), ex);
        }
    }

    private Session requestSession(String path, Object body, String operation) throws RentdeskException {
        HttpResponse<InputStream> response = send("POST", path, body, null, operation);

        try (InputStream bodyStream = response.body()) {
            if (response.statusCode() >= 400) {
                throw ApiErrorDecoder.decode(response.statusCode(), bodyStream);
            }

            JsonNode node = Json.mapper().readTree(bodyStream);
            String accessToken = node.path("access_token").asText();
            if (accessToken == null || accessToken.isBlank()) {
                throw new RentdeskException("token response missing access_token");
            }
            String refreshToken = node.path("refresh_token").asText(null);

            DecodedClaims claims = DecodedClaims.decode(accessToken);
            Instant expiresAt = resolveExpiry(node, claims);

            AuthUser user = readUser(node.path("user"));
            if (user == null) {
                user = claims.toUser();
            }
            return new Session(accessToken, refreshToken, expiresAt, user);
        } catch (IOException ex) {
            throw new RentdeskException("decode " + operation + " response: " + ex.getMessage(), ex);
        }
    }

    private Instant resolveExpiry(JsonNode node, DecodedClaims claims) {
        if (node.path("expires_at").isNumber() && node.path("expires_at").asLong() > 0) {
            return Instant.ofEpochSecond(node.path("expires_at").asLong());
        }
        if (node.path("expires_in").isNumber() && node.path("expires_in").asLong() > 0) {
            return clock.instant().plusSeconds(node.path("expires_in").asLong());
        }
        if (claims.expiresAtUnix() > 0) {
            return Instant.ofEpochSecond(claims.expiresAtUnix());
        }
        return clock.instant().plusSeconds(DEFAULT_EXPIRES_IN_SECONDS);
    }

    private static AuthUser readUser(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        String id = node.path("id").asText("");
        if (id.isBlank()) {
            return null;
        }
        String email = node.path("email").asText(null);
        String name = node.path("user_metadata").path("name").asText(null);
        return new AuthUser(id, email, name);
    }

    private HttpResponse<InputStream> send(String method, String path, Object body, String bearer, String operation)
        throws RentdeskException {
        try {
            return HttpUtil.sendJson(httpClient, method, authUrl + path, body, apiKey, bearer, requestTimeout);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new RentdeskException(operation + " interrupted", ex);
        } catch (IOException ex) {
            throw new RentdeskException(operation + " request: " + ex.getMessage(), ex);
        }
    }
}
