package cloud.rentdesk.sdk.auth;

/**
 * Outcome of a session operation: either a user and session, or a typed error.
 */
public record SessionResult(AuthUser user, Session session, SessionError error) {

    public static SessionResult ok(Session session) {
        return new SessionResult(session.getUser(), session, null);
    }

    public static SessionResult failure(SessionError error) {
        return new SessionResult(null, null, error);
    }

    public static SessionResult failure(SessionErrorCode code, String message) {
        return failure(SessionError.of(code, message));
    }

    public boolean isOk() {
        return error == null && session != null;
    }

    public SessionErrorCode errorCode() {
        return error == null ? null : error.code();
    }
}
