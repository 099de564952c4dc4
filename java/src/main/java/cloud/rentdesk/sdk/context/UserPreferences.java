package cloud.rentdesk.sdk.context;

import com.fasterxml.jackson.annotation.JsonProperty;

public record UserPreferences(
    String theme,
    String language,
    @JsonProperty("default_context_id") String defaultContextId,
    Notifications notifications
) {

    public record Notifications(
        boolean email,
        boolean sms,
        boolean push,
        @JsonProperty("payment_reminders") boolean paymentReminders,
        @JsonProperty("complaint_updates") boolean complaintUpdates
    ) {
    }
}
