package cloud.rentdesk.sdk.auth;

import cloud.rentdesk.sdk.RentdeskException;

import java.util.Optional;

/**
 * Contract for the remote identity provider.
 */
public interface AuthGateway {

    /**
     * @return the session currently established with the provider, if any.
     */
    Optional<Session> currentSession() throws RentdeskException;

    Session signInWithPassword(String email, String password) throws RentdeskException;

    Session refresh(String refreshToken) throws RentdeskException;

    void signOut(String accessToken) throws RentdeskException;

    AuthUser fetchUser(String accessToken) throws RentdeskException;
}
