package cloud.rentdesk.sdk.auth;

/**
 * Outcome of a sign-out. Local state is cleared even when {@code success} is false.
 */
public record SignOutResult(boolean success, SessionError error) {

    public static SignOutResult ok() {
        return new SignOutResult(true, null);
    }

    public static SignOutResult failure(SessionError error) {
        return new SignOutResult(false, error);
    }
}
