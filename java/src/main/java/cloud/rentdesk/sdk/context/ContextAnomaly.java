package cloud.rentdesk.sdk.context;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Suspicious but permitted shape in a user's context list.
 */
public record ContextAnomaly(Type type, Severity severity, String message, Map<String, Object> details, Instant detectedAt) {

    public enum Type {
        STAFF_AND_TENANT_SAME_WORKSPACE,
        DUPLICATE_ROLE_SAME_WORKSPACE,
        RAPID_CONTEXT_SWITCHING
    }

    public enum Severity {
        LOW,
        MEDIUM,
        HIGH
    }

    public ContextAnomaly {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(severity, "severity");
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }
}
