package cloud.rentdesk.sdk.auth;

import com.fasterxml.jackson.databind.JsonNode;
import cloud.rentdesk.sdk.internal.Json;

import java.io.IOException;
import java.util.Base64;

/**
 * Claims read from an access token without verifying its signature. Only used to label sessions locally; the
 * backend verifies tokens on every call.
 */
public record DecodedClaims(
    String subject,
    String email,
    String name,
    String role,
    String sessionId,
    long expiresAtUnix
) {

    public static DecodedClaims decode(String token) {
        if (token == null) {
            return empty();
        }
        try {
            String[] parts = token.split("\\.");
            if (parts.length < 2) {
                return empty();
            }

            byte[] payload = decodeBase64(parts[1]);
            JsonNode node = Json.mapper().readTree(payload);

            String name = text(node.path("user_metadata"), "name");
            if (name == null) {
                name = text(node, "name");
            }

            return new DecodedClaims(
                text(node, "sub"),
                text(node, "email"),
                name,
                text(node, "role"),
                text(node, "session_id"),
                node.path("exp").isNumber() ? node.path("exp").asLong(0L) : 0L
            );
        } catch (IOException | IllegalArgumentException ex) {
            return empty();
        }
    }

    public AuthUser toUser() {
        return subject == null ? null : new AuthUser(subject, email, name);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text == null || text.isBlank() ? null : text;
    }

    private static byte[] decodeBase64(String value) {
        try {
            return Base64.getUrlDecoder().decode(value);
        } catch (IllegalArgumentException ex) {
            return Base64.getDecoder().decode(value);
        }
    }

    private static DecodedClaims empty() {
        return new DecodedClaims(null, null, null, null, null, 0L);
    }
}
