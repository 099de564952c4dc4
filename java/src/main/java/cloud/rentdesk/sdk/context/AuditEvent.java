package cloud.rentdesk.sdk.context;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Audit record handed to the audit sink. Emission is fire-and-forget.
 */
public record AuditEvent(
    String entityType,
    String entityId,
    String action,
    String actorId,
    String actorType,
    String workspaceId,
    Map<String, Object> metadata,
    Instant createdAt
) {

    public AuditEvent {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
