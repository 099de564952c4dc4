package cloud.rentdesk.sdk.context;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * One role binding of the signed-in identity to a workspace, with the workspace and role data joined in at fetch
 * time so that permission checks never need I/O.
 */
public record UserContext(
    @JsonProperty("context_id") @JsonAlias("id") String contextId,
    @JsonProperty("user_id") String userId,
    @JsonProperty("workspace_id") String workspaceId,
    @JsonProperty("workspace_name") String workspaceName,
    @JsonProperty("workspace_logo") String workspaceLogo,
    @JsonProperty("context_type") ContextType contextType,
    @JsonProperty("role_id") String roleId,
    @JsonProperty("role_name") String roleName,
    @JsonProperty("entity_id") String entityId,
    @JsonProperty("permissions") Set<String> permissions,
    @JsonProperty("is_active") Boolean activeFlag,
    @JsonProperty("is_default") boolean defaultContext,
    @JsonProperty("last_accessed_at") Instant lastAccessedAt,
    @JsonProperty("access_count") int accessCount
) {

    public UserContext {
        permissions = permissions == null
            ? Set.of()
            : permissions.stream().filter(Objects::nonNull).collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Contexts returned by the directory are active unless the row says otherwise.
     */
    public boolean isActive() {
        return activeFlag == null || activeFlag;
    }

    public boolean isDefault() {
        return defaultContext;
    }

    public boolean hasPermission(String permission) {
        return permission != null && permissions.contains(permission);
    }

    /**
     * @return role name for staff contexts, otherwise the context type label.
     */
    public String displayRole() {
        if (roleName != null && !roleName.isBlank()) {
            return roleName;
        }
        return contextType == null ? "" : contextType.label();
    }
}
