package cloud.rentdesk.sdk.internal;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Helper methods for issuing HTTP requests with JSON payloads against the identity provider and the data API.
 * Every request carries the project {@code apikey} header; the bearer token is the caller's own session token.
 */
public final class HttpUtil {

    private HttpUtil() {
    }

    public static HttpResponse<InputStream> sendJson(
        HttpClient client,
        String method,
        String url,
        Object payload,
        String apiKey,
        String bearerToken,
        Duration timeout
    ) throws IOException, InterruptedException {

        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(url));

        if (payload == null) {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        } else {
            byte[] body = Json.mapper().writeValueAsBytes(payload);
            builder.method(method, HttpRequest.BodyPublishers.ofByteArray(body));
            builder.header("Content-Type", "application/json");
        }

        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("apikey", apiKey);
        }
        if (bearerToken != null && !bearerToken.isBlank()) {
            builder.header("Authorization", "Bearer " + bearerToken);
        }
        if (timeout != null) {
            builder.timeout(timeout);
        }

        builder.header("Accept", "application/json");

        HttpRequest request = builder.build();
        return client.send(request, HttpResponse.BodyHandlers.ofInputStream());
    }

    public static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
