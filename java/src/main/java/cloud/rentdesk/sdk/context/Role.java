package cloud.rentdesk.sdk.context;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Named permission set assigned to staff contexts.
 */
public record Role(
    String id,
    String name,
    String description,
    Set<String> permissions,
    @JsonProperty("is_system_role") boolean systemRole
) {

    public Role {
        permissions = permissions == null
            ? Set.of()
            : permissions.stream().filter(Objects::nonNull).collect(Collectors.toUnmodifiableSet());
    }
}
