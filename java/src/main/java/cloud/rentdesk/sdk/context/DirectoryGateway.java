package cloud.rentdesk.sdk.context;

import cloud.rentdesk.sdk.RentdeskException;

import java.util.List;
import java.util.Optional;

/**
 * Remote data operations backing the context directory. Every call carries the caller's own bearer token; the
 * datastore's row-level rules stay the final authority.
 */
public interface DirectoryGateway {

    List<UserContext> getUserContexts(String userId, String bearerToken) throws RentdeskException;

    Optional<UserProfile> getUserProfile(String userId, String bearerToken) throws RentdeskException;

    boolean checkPlatformAdmin(String userId, String bearerToken) throws RentdeskException;

    void switchContext(String userId, String fromContextId, String toContextId, String bearerToken) throws RentdeskException;

    void setDefaultContext(String userId, String contextId, String bearerToken) throws RentdeskException;

    void emitAuditEvent(AuditEvent event, String bearerToken) throws RentdeskException;
}
