package cloud.rentdesk.sdk;

import cloud.rentdesk.sdk.auth.AuthUser;
import cloud.rentdesk.sdk.auth.Session;
import cloud.rentdesk.sdk.auth.SessionError;
import cloud.rentdesk.sdk.context.ContextAnomaly;
import cloud.rentdesk.sdk.context.ContextType;
import cloud.rentdesk.sdk.context.UserContext;
import cloud.rentdesk.sdk.context.UserProfile;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Immutable snapshot of everything the coordinator knows about the signed-in user.
 */
public record AuthState(
    CoordinatorStatus status,
    AuthUser user,
    Session session,
    UserProfile profile,
    List<UserContext> contexts,
    UserContext currentContext,
    boolean platformAdmin,
    SessionError error,
    boolean sessionExpired,
    List<ContextAnomaly> anomalies
) {

    public AuthState {
        Objects.requireNonNull(status, "status");
        contexts = contexts == null ? List.of() : List.copyOf(contexts);
        anomalies = anomalies == null ? List.of() : List.copyOf(anomalies);
    }

    public static AuthState initial() {
        return new AuthState(CoordinatorStatus.UNINITIALIZED, null, null, null, List.of(), null, false, null, false,
            List.of());
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public boolean isAuthenticated() {
        return user != null && session != null;
    }

    public boolean isLoading() {
        return status == CoordinatorStatus.INITIALIZING;
    }

    public boolean hasMultipleContexts() {
        return contexts.size() > 1;
    }

    /**
     * @return time left on the session (never negative), or {@code null} without a session expiry.
     */
    public Duration timeUntilExpiry(Clock clock) {
        if (session == null || session.getExpiresAt() == null) {
            return null;
        }
        Duration remaining = Duration.between(clock.instant(), session.getExpiresAt());
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public boolean willExpireSoon(Clock clock, Duration buffer) {
        Duration remaining = timeUntilExpiry(clock);
        return remaining != null && remaining.compareTo(buffer) <= 0;
    }

    public boolean isOwner() {
        return currentType() == ContextType.OWNER;
    }

    public boolean isStaff() {
        return currentType() == ContextType.STAFF;
    }

    public boolean isTenant() {
        return currentType() == ContextType.TENANT;
    }

    public String workspaceName() {
        return currentContext == null ? null : currentContext.workspaceName();
    }

    public String roleName() {
        return currentContext == null ? null : currentContext.displayRole();
    }

    private ContextType currentType() {
        return currentContext == null ? null : currentContext.contextType();
    }

    public static final class Builder {
        private CoordinatorStatus status;
        private AuthUser user;
        private Session session;
        private UserProfile profile;
        private List<UserContext> contexts;
        private UserContext currentContext;
        private boolean platformAdmin;
        private SessionError error;
        private boolean sessionExpired;
        private List<ContextAnomaly> anomalies;

        private Builder(AuthState state) {
            this.status = state.status;
            this.user = state.user;
            this.session = state.session;
            this.profile = state.profile;
            this.contexts = state.contexts;
            this.currentContext = state.currentContext;
            this.platformAdmin = state.platformAdmin;
            this.error = state.error;
            this.sessionExpired = state.sessionExpired;
            this.anomalies = state.anomalies;
        }

        public Builder status(CoordinatorStatus status) {
            this.status = status;
            return this;
        }

        public Builder user(AuthUser user) {
            this.user = user;
            return this;
        }

        public Builder session(Session session) {
            this.session = session;
            return this;
        }

        public Builder profile(UserProfile profile) {
            this.profile = profile;
            return this;
        }

        public Builder contexts(List<UserContext> contexts) {
            this.contexts = contexts;
            return this;
        }

        public Builder currentContext(UserContext currentContext) {
            this.currentContext = currentContext;
            return this;
        }

        public Builder platformAdmin(boolean platformAdmin) {
            this.platformAdmin = platformAdmin;
            return this;
        }

        public Builder error(SessionError error) {
            this.error = error;
            return this;
        }

        public Builder sessionExpired(boolean sessionExpired) {
            this.sessionExpired = sessionExpired;
            return this;
        }

        public Builder anomalies(List<ContextAnomaly> anomalies) {
            this.anomalies = anomalies;
            return this;
        }

        public AuthState build() {
            return new AuthState(status, user, session, profile, contexts, currentContext, platformAdmin, error,
                sessionExpired, anomalies);
        }
    }
}
