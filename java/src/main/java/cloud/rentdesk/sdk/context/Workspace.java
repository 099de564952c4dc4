package cloud.rentdesk.sdk.context;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Tenant-isolated business unit, for example one property management account. {@code type} is one of
 * {@code pg_manager}, {@code shop_manager}, {@code rent_manager} or {@code society_manager}.
 */
public record Workspace(
    String id,
    String name,
    String slug,
    @JsonProperty("logo_url") String logoUrl,
    String type,
    @JsonProperty("owner_user_id") String ownerUserId,
    WorkspaceSettings settings,
    @JsonProperty("is_active") boolean active,
    @JsonProperty("created_at") Instant createdAt
) {
}
