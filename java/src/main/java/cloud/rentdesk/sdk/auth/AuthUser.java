package cloud.rentdesk.sdk.auth;

/**
 * Identity bound to a session.
 */
public record AuthUser(String id, String email, String name) {
}
