package cloud.rentdesk.sdk;

import cloud.rentdesk.sdk.auth.SessionError;

/**
 * Receives {@link SessionCoordinator} notifications. Callbacks run on coordinator threads and must not block on
 * coordinator futures.
 */
public interface SessionListener {

    default void onStateChanged(AuthState state) {
    }

    default void onError(SessionError error) {
    }

    /**
     * The session passed its expiry and could not be refreshed; the user has to sign in again.
     */
    default void onSessionExpired() {
    }
}
