package cloud.rentdesk.sdk.auth;

import java.time.Instant;

/**
 * Notification emitted on session changes. {@code session} is null for sign-out and expiry events.
 */
public record SessionEvent(SessionEventType type, AuthUser user, Session session, Instant timestamp) {

    public static SessionEvent of(SessionEventType type, Session session, Instant timestamp) {
        return new SessionEvent(type, session == null ? null : session.getUser(), session, timestamp);
    }
}
