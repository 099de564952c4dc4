package cloud.rentdesk.sdk.auth;

import cloud.rentdesk.sdk.RentdeskApiException;
import cloud.rentdesk.sdk.RentdeskException;
import cloud.rentdesk.sdk.context.ContextIdStore;
import cloud.rentdesk.sdk.internal.SingleFlight;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns the authenticated session: reads it, refreshes it before it lapses and clears it on sign-out.
 *
 * <p>
 * None of the session operations throw; failures come back as a {@link SessionError} inside the result so that
 * callers can branch on {@link SessionErrorCode} without exception plumbing. {@link #requireSession()} is the
 * exception-based variant for code paths that cannot proceed without a session.
 * </p>
 *
 * <p>
 * Concurrent {@link #refresh()} calls share one exchange with the identity provider; every caller observes the
 * same result.
 * </p>
 */
public final class SessionStore {

    private static final Logger LOGGER = Logger.getLogger(SessionStore.class.getName());

    public static final Duration DEFAULT_EXPIRY_BUFFER = Duration.ofSeconds(30);

    private final AuthGateway gateway;
    private final AuthEventBus events;
    private final ContextIdStore contextIdStore;
    private final Duration expiryBuffer;
    private final Clock clock;

    private final SingleFlight<SessionResult> refreshFlight = new SingleFlight<>();
    private volatile Session cached;

    public SessionStore(AuthGateway gateway, AuthEventBus events, ContextIdStore contextIdStore, Duration expiryBuffer, Clock clock) {
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.events = Objects.requireNonNull(events, "events");
        this.contextIdStore = Objects.requireNonNull(contextIdStore, "contextIdStore");
        this.expiryBuffer = expiryBuffer == null || expiryBuffer.isNegative() ? DEFAULT_EXPIRY_BUFFER : expiryBuffer;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    /**
     * Returns a usable session. A session inside the expiry buffer is refreshed transparently, so callers see
     * {@code SESSION_EXPIRED} only if the refresh itself reports it.
     */
    public SessionResult get() {
        Session current = cached;
        if (current == null) {
            try {
                Optional<Session> fetched = gateway.currentSession();
                if (fetched.isEmpty()) {
                    return SessionResult.failure(SessionErrorCode.NO_SESSION, "No active session");
                }
                current = fetched.get();
                cached = current;
            } catch (RentdeskException ex) {
                SessionError error = SessionError.classify(ex, SessionErrorCode.NO_SESSION);
                if (error.code() == SessionErrorCode.INVALID_TOKEN || error.code() == SessionErrorCode.SESSION_EXPIRED) {
                    error = SessionError.of(SessionErrorCode.NO_SESSION, ex.getMessage(), ex);
                }
                SessionError logged = error;
                LOGGER.warning(() -> "[rentdesk-sdk] get session failed: " + logged.code() + " " + logged.message());
                return SessionResult.failure(error);
            }
        }

        if (isExpired(current)) {
            LOGGER.info(() -> "[rentdesk-sdk] session inside expiry buffer; refreshing");
            return refresh();
        }
        return SessionResult.ok(current);
    }

    /**
     * Exchanges the refresh token for a new session. Callers arriving while an exchange is in flight wait for it
     * and receive its result instead of starting another.
     */
    public SessionResult refresh() {
        AtomicBoolean leader = new AtomicBoolean();
        CompletableFuture<SessionResult> flight = refreshFlight.run(() -> {
            leader.set(true);
            return CompletableFuture.completedFuture(doRefresh());
        });
        SessionResult result = flight.join();
        // Only the caller that performed the exchange announces it, after the flight slot is released.
        if (leader.get() && result.isOk()) {
            events.publish(SessionEvent.of(SessionEventType.TOKEN_REFRESHED, result.session(), clock.instant()));
        }
        return result;
    }

    private SessionResult doRefresh() {
        Session current = cached;
        if (current == null) {
            try {
                current = gateway.currentSession().orElse(null);
            } catch (RentdeskException ex) {
                return SessionResult.failure(SessionError.classify(ex, SessionErrorCode.REFRESH_FAILED));
            }
        }
        if (current == null || current.getRefreshToken() == null || current.getRefreshToken().isBlank()) {
            return SessionResult.failure(SessionErrorCode.NO_SESSION, "No session to refresh");
        }

        try {
            Session fresh = gateway.refresh(current.getRefreshToken());
            if (fresh.getUser() == null && current.getUser() != null) {
                fresh = fresh.withUser(current.getUser());
            }
            cached = fresh;
            Session published = fresh;
            LOGGER.info(() -> "[rentdesk-sdk] session refreshed; expires at " + published.getExpiresAt());
            return SessionResult.ok(fresh);
        } catch (RentdeskException ex) {
            SessionError error = classifyRefreshFailure(ex);
            LOGGER.warning(() -> "[rentdesk-sdk] refresh failed: " + error.code() + " " + error.message());
            if (error.code() == SessionErrorCode.REFRESH_FAILED && hasLapsed(current) && cached == current) {
                // the refresh token is dead and the access token has run out; nothing left to reuse
                cached = null;
                LOGGER.info(() -> "[rentdesk-sdk] dropped lapsed session after irrecoverable refresh failure");
            }
            return SessionResult.failure(error);
        }
    }

    private boolean hasLapsed(Session session) {
        Instant expiresAt = session.getExpiresAt();
        return expiresAt != null && !clock.instant().isBefore(expiresAt);
    }

    private static SessionError classifyRefreshFailure(RentdeskException ex) {
        SessionError classified = SessionError.classify(ex, SessionErrorCode.REFRESH_FAILED);
        if (classified.code() == SessionErrorCode.NETWORK_ERROR || classified.code() == SessionErrorCode.TIMEOUT) {
            return classified;
        }
        if (ex instanceof RentdeskApiException || classified.code().requiresRefresh()) {
            return SessionError.of(SessionErrorCode.REFRESH_FAILED, ex.getMessage(), ex);
        }
        return classified;
    }

    /**
     * Signs in with email and password and caches the resulting session.
     */
    public SessionResult signInWithPassword(String email, String password) {
        try {
            Session session = gateway.signInWithPassword(email, password);
            cached = session;
            LOGGER.info(() -> "[rentdesk-sdk] signed in user " + session.getUserId());
            events.publish(SessionEvent.of(SessionEventType.SIGNED_IN, session, clock.instant()));
            return SessionResult.ok(session);
        } catch (RentdeskException ex) {
            SessionError error = SessionError.classify(ex, SessionErrorCode.UNKNOWN_ERROR);
            if (error.code() == SessionErrorCode.INVALID_TOKEN) {
                error = SessionError.of(SessionErrorCode.UNKNOWN_ERROR, ex.getMessage(), ex);
            }
            return SessionResult.failure(error);
        }
    }

    /**
     * Validates the access token with the identity provider. A rejected or expired token triggers one refresh,
     * after which the lookup is retried with the new token.
     */
    public SessionResult getUser() {
        SessionResult sessionResult = get();
        if (!sessionResult.isOk()) {
            return sessionResult;
        }
        Session session = sessionResult.session();
        try {
            AuthUser user = gateway.fetchUser(session.getAccessToken());
            return new SessionResult(user, session, null);
        } catch (RentdeskException ex) {
            SessionError error = SessionError.classify(ex, SessionErrorCode.UNKNOWN_ERROR);
            if (!error.code().requiresRefresh()) {
                return SessionResult.failure(error);
            }
            LOGGER.info(() -> "[rentdesk-sdk] access token rejected (" + error.code() + "); refreshing");
        }

        SessionResult refreshed = refresh();
        if (!refreshed.isOk()) {
            return refreshed;
        }
        try {
            AuthUser user = gateway.fetchUser(refreshed.session().getAccessToken());
            return new SessionResult(user, refreshed.session(), null);
        } catch (RentdeskException ex) {
            return SessionResult.failure(SessionError.classify(ex, SessionErrorCode.UNKNOWN_ERROR));
        }
    }

    /**
     * Signs out remotely, then always clears the cached session and the remembered context id.
     */
    public SignOutResult signOut() {
        Session current = cached;
        SessionError remoteError = null;
        try {
            if (current == null) {
                current = gateway.currentSession().orElse(null);
            }
            if (current != null) {
                gateway.signOut(current.getAccessToken());
            }
        } catch (RentdeskException ex) {
            remoteError = SessionError.classify(ex, SessionErrorCode.UNKNOWN_ERROR);
            LOGGER.log(Level.WARNING, ex, () -> "[rentdesk-sdk] remote sign out failed; clearing local state anyway");
        } finally {
            cached = null;
            refreshFlight.reset();
            contextIdStore.clear();
        }

        events.publish(SessionEvent.of(SessionEventType.SIGNED_OUT, null, clock.instant()));
        if (remoteError != null) {
            return SignOutResult.failure(remoteError);
        }
        LOGGER.info(() -> "[rentdesk-sdk] signed out");
        return SignOutResult.ok();
    }

    public boolean isSessionValid() {
        return get().isOk();
    }

    public Session requireSession() throws SessionException {
        SessionResult result = get();
        if (!result.isOk()) {
            SessionError error = result.error() == null
                ? SessionError.of(SessionErrorCode.NO_SESSION, "Authentication required")
                : result.error();
            throw error.toException();
        }
        return result.session();
    }

    /**
     * @return the cached session without contacting the provider, or {@code null}.
     */
    public Session peek() {
        return cached;
    }

    /**
     * A missing session counts as expired; a session without an expiry never expires; otherwise the session is
     * expired once the clock is within the expiry buffer of its expiry.
     */
    public boolean isExpired(Session session) {
        if (session == null) {
            return true;
        }
        Instant expiresAt = session.getExpiresAt();
        if (expiresAt == null) {
            return false;
        }
        return !clock.instant().isBefore(expiresAt.minus(expiryBuffer));
    }

    public Instant expiryTime(Session session) {
        return session == null ? null : session.getExpiresAt();
    }

    /**
     * @return time left before expiry (never negative), or {@code null} when unknown.
     */
    public Duration timeUntilExpiry(Session session) {
        Instant expiresAt = expiryTime(session);
        if (expiresAt == null) {
            return null;
        }
        Duration remaining = Duration.between(clock.instant(), expiresAt);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public Duration getExpiryBuffer() {
        return expiryBuffer;
    }
}
