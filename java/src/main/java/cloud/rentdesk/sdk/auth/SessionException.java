package cloud.rentdesk.sdk.auth;

import cloud.rentdesk.sdk.RentdeskException;

/**
 * Thrown by the few session operations that fail by exception rather than by result.
 */
public final class SessionException extends RentdeskException {

    private static final long serialVersionUID = 1L;

    private final transient SessionError error;

    public SessionException(SessionError error) {
        super(error.message(), error.cause());
        this.error = error;
    }

    public SessionError getError() {
        return error;
    }

    public SessionErrorCode getCode() {
        return error.code();
    }
}
