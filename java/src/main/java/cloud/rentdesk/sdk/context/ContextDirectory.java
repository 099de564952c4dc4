package cloud.rentdesk.sdk.context;

import cloud.rentdesk.sdk.RentdeskException;
import cloud.rentdesk.sdk.auth.SessionStore;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Read side of the identity directory (profile, contexts, platform-admin flag) plus the two context writes.
 *
 * <p>
 * Reads are best effort: a failed lookup is logged and degrades to {@code null}, an empty list or {@code false}.
 * Writes propagate {@link RentdeskException} because callers must not commit local state they could not persist.
 * </p>
 */
public final class ContextDirectory {

    private static final Logger LOGGER = Logger.getLogger(ContextDirectory.class.getName());

    private final DirectoryGateway gateway;
    private final SessionStore sessionStore;

    public ContextDirectory(DirectoryGateway gateway, SessionStore sessionStore) {
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.sessionStore = Objects.requireNonNull(sessionStore, "sessionStore");
    }

    public UserProfile fetchProfile(String userId, String bearerToken) {
        if (userId == null || userId.isBlank()) {
            return null;
        }
        try {
            return gateway.getUserProfile(userId, bearerToken).orElse(null);
        } catch (RentdeskException ex) {
            LOGGER.log(Level.WARNING, ex, () -> "[rentdesk-sdk] profile lookup failed for user " + userId);
            return null;
        }
    }

    public List<UserContext> fetchContexts(String userId, String bearerToken) {
        if (userId == null || userId.isBlank()) {
            return List.of();
        }
        try {
            List<UserContext> contexts = gateway.getUserContexts(userId, bearerToken);
            LOGGER.info(() -> String.format(Locale.ROOT,
                "[rentdesk-sdk] loaded %d contexts for user %s", contexts.size(), userId));
            return List.copyOf(contexts);
        } catch (RentdeskException ex) {
            LOGGER.log(Level.WARNING, ex, () -> "[rentdesk-sdk] context lookup failed for user " + userId);
            return List.of();
        }
    }

    /**
     * Context lookup with a valid session token, refreshing the session first when it is about to lapse. Unlike
     * {@link #fetchContexts(String, String)} failures propagate, so callers can tell an outage from an empty list.
     */
    public List<UserContext> loadContexts(String userId) throws RentdeskException {
        if (userId == null || userId.isBlank()) {
            return List.of();
        }
        List<UserContext> contexts = gateway.getUserContexts(userId, bearerToken());
        LOGGER.info(() -> String.format(Locale.ROOT,
            "[rentdesk-sdk] reloaded %d contexts for user %s", contexts.size(), userId));
        return List.copyOf(contexts);
    }

    /**
     * Any failure, including an authorization failure, means the user is not a platform admin.
     */
    public boolean checkPlatformAdmin(String userId, String bearerToken) {
        if (userId == null || userId.isBlank()) {
            return false;
        }
        try {
            return gateway.checkPlatformAdmin(userId, bearerToken);
        } catch (RentdeskException ex) {
            LOGGER.fine(() -> "[rentdesk-sdk] platform admin check failed: " + ex.getMessage());
            return false;
        }
    }

    public void switchContext(String userId, String fromContextId, String toContextId) throws RentdeskException {
        gateway.switchContext(userId, fromContextId, toContextId, bearerToken());
    }

    public void setDefaultContext(String userId, String contextId) throws RentdeskException {
        gateway.setDefaultContext(userId, contextId, bearerToken());
    }

    /**
     * Records an audit event. Best effort: failures are logged and dropped.
     */
    public void emitAuditEvent(AuditEvent event, String bearerToken) {
        if (event == null) {
            return;
        }
        try {
            gateway.emitAuditEvent(event, bearerToken);
        } catch (RentdeskException ex) {
            LOGGER.log(Level.WARNING, ex, () -> String.format(Locale.ROOT,
                "[rentdesk-sdk] audit event %s/%s not recorded", event.entityType(), event.action()));
        }
    }

    private String bearerToken() throws RentdeskException {
        return sessionStore.requireSession().getAccessToken();
    }
}
