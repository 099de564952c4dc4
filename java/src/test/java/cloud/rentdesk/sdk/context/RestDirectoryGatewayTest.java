package cloud.rentdesk.sdk.context;

import com.fasterxml.jackson.databind.ObjectMapper;
import cloud.rentdesk.sdk.RentdeskApiException;
import cloud.rentdesk.sdk.RentdeskException;
import cloud.rentdesk.sdk.permission.PermissionEvaluator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RestDirectoryGatewayTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private HttpServer server;
    private RestDirectoryGateway gateway;
    private final Map<String, Object> seen = new ConcurrentHashMap<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.start();
        gateway = new RestDirectoryGateway(HttpClient.newHttpClient(),
            "http://localhost:" + server.getAddress().getPort(), "anon-key", Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void fetchesAndDecodesContexts() throws Exception {
        server.createContext("/rest/v1/rpc/get_user_contexts", exchange -> {
            seen.put("method", exchange.getRequestMethod());
            seen.put("authorization", exchange.getRequestHeaders().getFirst("Authorization"));
            seen.put("apikey", exchange.getRequestHeaders().getFirst("apikey"));
            seen.put("body", MAPPER.readValue(exchange.getRequestBody(), Map.class));

            Map<String, Object> staff = new HashMap<>();
            staff.put("context_id", "ctx-1");
            staff.put("user_id", "u1");
            staff.put("workspace_id", "ws-1");
            staff.put("workspace_name", "Sunrise PG");
            staff.put("context_type", "staff");
            staff.put("role_name", "Warden");
            staff.put("permissions", List.of("rooms.view", "complaints.view"));
            staff.put("is_default", true);
            staff.put("last_accessed_at", "2026-02-01T08:30:00Z");
            staff.put("access_count", 4);

            Map<String, Object> owner = new HashMap<>();
            owner.put("id", "ctx-2");
            owner.put("workspace_id", "ws-2");
            owner.put("context_type", "OWNER");
            owner.put("is_active", false);

            Map<String, Object> broken = new HashMap<>();
            broken.put("context_id", "");
            broken.put("context_type", "tenant");

            respond(exchange, 200, List.of(staff, owner, broken));
        });

        List<UserContext> contexts = gateway.getUserContexts("u1", "token-1");

        assertEquals("POST", seen.get("method"));
        assertEquals("Bearer token-1", seen.get("authorization"));
        assertEquals("anon-key", seen.get("apikey"));
        assertEquals(Map.of("p_user_id", "u1"), seen.get("body"));

        assertEquals(2, contexts.size());
        UserContext staff = contexts.get(0);
        assertEquals(ContextType.STAFF, staff.contextType());
        assertEquals(Set.of("rooms.view", "complaints.view"), staff.permissions());
        assertTrue(staff.isDefault());
        assertTrue(staff.isActive());
        assertEquals(Instant.parse("2026-02-01T08:30:00Z"), staff.lastAccessedAt());
        assertEquals("Warden", staff.displayRole());

        UserContext owner = contexts.get(1);
        assertEquals("ctx-2", owner.contextId());
        assertEquals(ContextType.OWNER, owner.contextType());
        assertFalse(owner.isActive());
        assertTrue(owner.permissions().isEmpty());
        assertEquals("Owner", owner.displayRole());
    }

    @Test
    void unknownContextTypeKeepsTheRowWithoutGrants() throws Exception {
        server.createContext("/rest/v1/rpc/get_user_contexts", exchange -> {
            Map<String, Object> vendor = new HashMap<>();
            vendor.put("context_id", "ctx-vendor");
            vendor.put("workspace_id", "ws-1");
            vendor.put("context_type", "vendor");
            vendor.put("permissions", List.of("rooms.view"));

            Map<String, Object> tenant = new HashMap<>();
            tenant.put("context_id", "ctx-tenant");
            tenant.put("workspace_id", "ws-1");
            tenant.put("context_type", "tenant");

            respond(exchange, 200, List.of(vendor, tenant));
        });

        List<UserContext> contexts = gateway.getUserContexts("u1", "t");

        assertEquals(2, contexts.size());
        assertNull(contexts.get(0).contextType());
        assertFalse(PermissionEvaluator.hasPermission(contexts.get(0), false, "rooms.view"));
        assertEquals(ContextType.TENANT, contexts.get(1).contextType());
    }

    @Test
    void rejectsNonArrayContextResponse() {
        server.createContext("/rest/v1/rpc/get_user_contexts",
            exchange -> respond(exchange, 200, Map.of("unexpected", true)));

        RentdeskException ex = assertThrows(RentdeskException.class, () -> gateway.getUserContexts("u1", "t"));
        assertTrue(ex.getMessage().contains("unexpected response format"));
    }

    @Test
    void surfacesDataApiErrors() {
        server.createContext("/rest/v1/rpc/get_user_contexts", exchange -> respond(exchange, 401,
            Map.of("code", "PGRST301", "message", "JWT expired")));

        RentdeskApiException ex = assertThrows(RentdeskApiException.class, () -> gateway.getUserContexts("u1", "t"));
        assertEquals(401, ex.getStatusCode());
        assertEquals("PGRST301", ex.getCode());
    }

    @Test
    void fetchesProfileByUserId() throws Exception {
        server.createContext("/rest/v1/user_profiles", exchange -> {
            seen.put("query", exchange.getRequestURI().getQuery());
            Map<String, Object> prefs = new HashMap<>();
            prefs.put("theme", "dark");
            prefs.put("default_context_id", "ctx-1");
            prefs.put("notifications", Map.of("email", true, "payment_reminders", true));
            Map<String, Object> row = new HashMap<>();
            row.put("id", "p1");
            row.put("user_id", "u1");
            row.put("name", "Asha");
            row.put("preferences", prefs);
            respond(exchange, 200, List.of(row));
        });

        Optional<UserProfile> profile = gateway.getUserProfile("u1", "t");

        assertEquals("user_id=eq.u1&select=*", seen.get("query"));
        assertEquals("Asha", profile.orElseThrow().name());
        assertEquals("ctx-1", profile.get().preferences().defaultContextId());
        assertTrue(profile.get().preferences().notifications().paymentReminders());
        assertFalse(profile.get().preferences().notifications().sms());
    }

    @Test
    void missingProfileIsEmpty() throws Exception {
        server.createContext("/rest/v1/user_profiles", exchange -> respond(exchange, 200, List.of()));

        assertTrue(gateway.getUserProfile("u1", "t").isEmpty());
    }

    @Test
    void platformAdminDependsOnAllowListRow() throws Exception {
        server.createContext("/rest/v1/platform_admins", exchange -> {
            String query = exchange.getRequestURI().getQuery();
            if (query.contains("eq.admin")) {
                respond(exchange, 200, List.of(Map.of("user_id", "admin")));
            } else {
                respond(exchange, 200, List.of());
            }
        });

        assertTrue(gateway.checkPlatformAdmin("admin", "t"));
        assertFalse(gateway.checkPlatformAdmin("u1", "t"));
    }

    @Test
    void switchContextSendsBothIds() throws Exception {
        server.createContext("/rest/v1/rpc/switch_context", exchange -> {
            seen.put("body", MAPPER.readValue(exchange.getRequestBody(), Map.class));
            exchange.sendResponseHeaders(204, -1);
            exchange.close();
        });

        gateway.switchContext("u1", "ctx-1", "ctx-2", "t");

        assertEquals(Map.of("p_user_id", "u1", "p_from_context_id", "ctx-1", "p_to_context_id", "ctx-2"),
            seen.get("body"));
    }

    @Test
    void setDefaultFailureIsThrown() {
        server.createContext("/rest/v1/rpc/set_default_context", exchange -> respond(exchange, 403,
            Map.of("code", "42501", "message", "permission denied")));

        RentdeskApiException ex = assertThrows(RentdeskApiException.class,
            () -> gateway.setDefaultContext("u1", "ctx-1", "t"));
        assertEquals("permission denied", ex.getMessage());
    }

    @Test
    void auditEventUsesSnakeCaseColumns() throws Exception {
        server.createContext("/rest/v1/audit_events", exchange -> {
            seen.put("body", MAPPER.readValue(exchange.getRequestBody(), Map.class));
            respond(exchange, 201, List.of());
        });

        gateway.emitAuditEvent(new AuditEvent("staff", "u1", "update", "u1", "owner", "ws-1",
            Map.of("operation", "logout"), Instant.parse("2026-03-01T10:00:00Z")), "t");

        Map<?, ?> body = (Map<?, ?>) seen.get("body");
        assertEquals("staff", body.get("entity_type"));
        assertEquals("ws-1", body.get("workspace_id"));
        assertEquals("2026-03-01T10:00:00Z", body.get("created_at"));
        assertEquals(Map.of("operation", "logout"), body.get("metadata"));
        assertNull(body.get("entityType"));
    }

    private static void respond(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload = MAPPER.writeValueAsBytes(body);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(payload);
        }
    }
}
