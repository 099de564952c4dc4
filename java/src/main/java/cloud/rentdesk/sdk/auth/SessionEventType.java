package cloud.rentdesk.sdk.auth;

public enum SessionEventType {
    SIGNED_IN,
    SIGNED_OUT,
    TOKEN_REFRESHED,
    USER_UPDATED,
    SESSION_EXPIRED
}
