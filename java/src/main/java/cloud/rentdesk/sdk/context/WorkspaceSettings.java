package cloud.rentdesk.sdk.context;

import com.fasterxml.jackson.annotation.JsonProperty;

public record WorkspaceSettings(
    String timezone,
    String currency,
    @JsonProperty("date_format") String dateFormat,
    @JsonProperty("allow_staff_invite") boolean allowStaffInvite,
    @JsonProperty("allow_tenant_portal") boolean allowTenantPortal
) {
}
