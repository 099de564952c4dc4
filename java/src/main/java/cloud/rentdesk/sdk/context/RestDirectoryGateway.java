package cloud.rentdesk.sdk.context;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import cloud.rentdesk.sdk.RentdeskException;
import cloud.rentdesk.sdk.internal.ApiErrorDecoder;
import cloud.rentdesk.sdk.internal.HttpUtil;
import cloud.rentdesk.sdk.internal.Json;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * {@link DirectoryGateway} against the PostgREST data API ({@code /rest/v1}).
 */
public final class RestDirectoryGateway implements DirectoryGateway {

    private static final Logger LOGGER = Logger.getLogger(RestDirectoryGateway.class.getName());

    private static final TypeReference<List<UserContext>> CONTEXT_LIST = new TypeReference<>() {
    };

    private static final TypeReference<UserProfile> PROFILE = new TypeReference<>() {
    };

    private final HttpClient httpClient;
    private final String restUrl;
    private final String apiKey;
    private final Duration requestTimeout;

    public RestDirectoryGateway(HttpClient httpClient, String restUrl, String apiKey, Duration requestTimeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.restUrl = Objects.requireNonNull(restUrl, "restUrl");
        this.apiKey = Objects.requireNonNull(apiKey, "apiKey");
        this.requestTimeout = requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()
            ? Duration.ofSeconds(30) : requestTimeout;
    }

    @Override
    public List<UserContext> getUserContexts(String userId, String bearerToken) throws RentdeskException {
        LOGGER.fine(() -> "[rentdesk-sdk] requesting /rest/v1/rpc/get_user_contexts");
        JsonNode root = exchange("POST", "/rest/v1/rpc/get_user_contexts", Map.of("p_user_id", userId), bearerToken,
            "fetch contexts");
        if (!root.isArray()) {
            throw new RentdeskException("fetch contexts: unexpected response format");
        }
        List<UserContext> contexts = new ArrayList<>();
        List<UserContext> decoded = convert(root, CONTEXT_LIST, "fetch contexts");
        for (UserContext context : decoded) {
            if (context == null || context.contextId() == null || context.contextId().isBlank()) {
                continue;
            }
            contexts.add(context);
        }
        LOGGER.fine(() -> String.format(Locale.ROOT,
            "[rentdesk-sdk] get_user_contexts returned %d records", contexts.size()));
        return contexts;
    }

    @Override
    public Optional<UserProfile> getUserProfile(String userId, String bearerToken) throws RentdeskException {
        String path = "/rest/v1/user_profiles?user_id=eq." + HttpUtil.encode(userId) + "&select=*";
        JsonNode root = exchange("GET", path, null, bearerToken, "fetch profile");
        if (!root.isArray()) {
            throw new RentdeskException("fetch profile: unexpected response format");
        }
        if (root.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(convert(root.get(0), PROFILE, "fetch profile"));
    }

    @Override
    public boolean checkPlatformAdmin(String userId, String bearerToken) throws RentdeskException {
        String path = "/rest/v1/platform_admins?user_id=eq." + HttpUtil.encode(userId) + "&select=user_id";
        JsonNode root = exchange("GET", path, null, bearerToken, "check platform admin");
        if (!root.isArray()) {
            throw new RentdeskException("check platform admin: unexpected response format");
        }
        return !root.isEmpty();
    }

    @Override
    public void switchContext(String userId, String fromContextId, String toContextId, String bearerToken)
        throws RentdeskException {
        Map<String, Object> body = new HashMap<>();
        body.put("p_user_id", userId);
        body.put("p_to_context_id", toContextId);
        body.put("p_from_context_id", fromContextId);
        exchange("POST", "/rest/v1/rpc/switch_context", body, bearerToken, "switch context");
    }

    @Override
    public void setDefaultContext(String userId, String contextId, String bearerToken) throws RentdeskException {
        Map<String, Object> body = new HashMap<>();
        body.put("p_user_id", userId);
        body.put("p_context_id", contextId);
        exchange("POST", "/rest/v1/rpc/set_default_context", body, bearerToken, "set default context");
    }

    @Override
    public void emitAuditEvent(AuditEvent event, String bearerToken) throws RentdeskException {
        Map<String, Object> row = new HashMap<>();
        row.put("entity_type", event.entityType());
        row.put("entity_id", event.entityId());
        row.put("action", event.action());
        row.put("actor_id", event.actorId());
        row.put("actor_type", event.actorType());
        row.put("workspace_id", event.workspaceId());
        row.put("metadata", event.metadata());
        if (event.createdAt() != null) {
            row.put("created_at", DateTimeFormatter.ISO_INSTANT.format(event.createdAt()));
        }
        exchange("POST", "/rest/v1/audit_events", row, bearerToken, "emit audit event");
    }

    private JsonNode exchange(String method, String path, Object body, String bearerToken, String operation)
        throws RentdeskException {
        HttpResponse<InputStream> response;
        try {
            response = HttpUtil.sendJson(httpClient, method, restUrl + path, body, apiKey, bearerToken, requestTimeout);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new RentdeskException(operation + " interrupted", ex);
        } catch (IOException ex) {
            throw new RentdeskException(operation + " request: " + ex.getMessage(), ex);
        }

        try (InputStream bodyStream = response.body()) {
            if (response.statusCode() >= 400) {
                throw ApiErrorDecoder.decode(response.statusCode(), bodyStream);
            }
            byte[] bytes = bodyStream.readAllBytes();
            if (bytes.length == 0) {
                return Json.mapper().missingNode();
            }
            return Json.mapper().readTree(bytes);
        } catch (IOException ex) {
            throw new RentdeskException("decode " + operation + " response: " + ex.getMessage(), ex);
        }
    }

    private static <T> T convert(JsonNode node, TypeReference<T> type, String operation) throws RentdeskException {
        try {
            return Json.mapper().convertValue(node, type);
        } catch (IllegalArgumentException ex) {
            throw new RentdeskException("decode " + operation + " response: " + ex.getMessage(), ex);
        }
    }
}
