package cloud.rentdesk.sdk.context;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Profile row of the signed-in identity. Created at registration and edited by the user; never deleted here.
 */
public record UserProfile(
    String id,
    @JsonProperty("user_id") String userId,
    String name,
    String email,
    String phone,
    @JsonProperty("profile_photo") String profilePhoto,
    UserPreferences preferences,
    @JsonProperty("last_login_at") Instant lastLoginAt,
    @JsonProperty("created_at") Instant createdAt
) {
}
