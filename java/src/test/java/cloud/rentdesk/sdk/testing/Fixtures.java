package cloud.rentdesk.sdk.testing;

import cloud.rentdesk.sdk.auth.AuthUser;
import cloud.rentdesk.sdk.auth.Session;
import cloud.rentdesk.sdk.context.ContextType;
import cloud.rentdesk.sdk.context.UserContext;

import java.time.Instant;
import java.util.Set;

public final class Fixtures {

    private Fixtures() {
    }

    public static Session session(String userId, String accessToken, Instant expiresAt) {
        return new Session(accessToken, "refresh-" + accessToken, expiresAt,
            new AuthUser(userId, userId + "@example.com", "User " + userId));
    }

    public static UserContext owner(String id, String userId, String workspaceId, boolean isDefault) {
        return context(id, userId, workspaceId, ContextType.OWNER, null, Set.of(), isDefault);
    }

    public static UserContext staff(String id, String userId, String workspaceId, String roleName,
                                    Set<String> permissions, boolean isDefault) {
        return context(id, userId, workspaceId, ContextType.STAFF, roleName, permissions, isDefault);
    }

    public static UserContext tenant(String id, String userId, String workspaceId, boolean isDefault) {
        return context(id, userId, workspaceId, ContextType.TENANT, null, Set.of(), isDefault);
    }

    public static UserContext context(String id, String userId, String workspaceId, ContextType type, String roleName,
                                      Set<String> permissions, boolean isDefault) {
        return new UserContext(id, userId, workspaceId, workspaceId == null ? null : "Workspace " + workspaceId,
            null, type, roleName == null ? null : "role-" + roleName, roleName, null, permissions, Boolean.TRUE,
            isDefault, null, 0);
    }
}
