package cloud.rentdesk.sdk.internal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import cloud.rentdesk.sdk.RentdeskApiException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Utility for decoding error payloads. The identity provider reports {@code error}/{@code error_description}
 * (or {@code msg}); the data API reports {@code code}/{@code message}.
 */
public final class ApiErrorDecoder {

    private static final ObjectMapper MAPPER = Json.mapper();

    private ApiErrorDecoder() {
    }

    public static RentdeskApiException decode(int statusCode, InputStream bodyStream) throws IOException {
        if (bodyStream == null) {
            return new RentdeskApiException(statusCode, null, null);
        }

        byte[] bytes = bodyStream.readAllBytes();
        if (bytes.length == 0) {
            return new RentdeskApiException(statusCode, null, null);
        }

        try {
            JsonNode node = MAPPER.readTree(bytes);
            String code = firstText(node, "code", "error_code", "error");
            String message = firstText(node, "message", "error_description", "msg");
            return new RentdeskApiException(statusCode, code, message);
        } catch (IOException ex) {
            String fallback = new String(bytes, StandardCharsets.UTF_8);
            return new RentdeskApiException(statusCode, null, fallback);
        }
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            if (node.hasNonNull(field)) {
                String value = node.get(field).asText();
                if (!value.isBlank()) {
                    return value;
                }
            }
        }
        return null;
    }
}
