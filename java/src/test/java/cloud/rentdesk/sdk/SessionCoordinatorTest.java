package cloud.rentdesk.sdk;

import cloud.rentdesk.sdk.auth.AuthUser;
import cloud.rentdesk.sdk.auth.Session;
import cloud.rentdesk.sdk.auth.SessionError;
import cloud.rentdesk.sdk.auth.SessionErrorCode;
import cloud.rentdesk.sdk.auth.SessionEvent;
import cloud.rentdesk.sdk.auth.SessionEventType;
import cloud.rentdesk.sdk.auth.SignOutResult;
import cloud.rentdesk.sdk.context.AuditEvent;
import cloud.rentdesk.sdk.context.ContextAnomaly;
import cloud.rentdesk.sdk.context.InMemoryContextIdStore;
import cloud.rentdesk.sdk.context.UserContext;
import cloud.rentdesk.sdk.context.UserProfile;
import cloud.rentdesk.sdk.permission.Permissions;
import cloud.rentdesk.sdk.testing.FakeAuthGateway;
import cloud.rentdesk.sdk.testing.FakeDirectoryGateway;
import cloud.rentdesk.sdk.testing.Fixtures;
import cloud.rentdesk.sdk.testing.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionCoordinatorTest {

    private static final String USER = "u1";

    private MutableClock clock;
    private FakeAuthGateway authGateway;
    private FakeDirectoryGateway directoryGateway;
    private InMemoryContextIdStore contextIds;
    private SessionCoordinator coordinator;
    private RecordingListener listener;

    private final UserContext ownerCtx = Fixtures.owner("ctx-owner", USER, "ws-1", true);
    private final UserContext staffCtx = Fixtures.staff("ctx-staff", USER, "ws-2", "Warden",
        Set.of(Permissions.ROOMS_VIEW, Permissions.COMPLAINTS_RESOLVE), false);

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.now());
        authGateway = new FakeAuthGateway();
        directoryGateway = new FakeDirectoryGateway();
        contextIds = new InMemoryContextIdStore();
        listener = new RecordingListener();
    }

    @AfterEach
    void tearDown() {
        if (coordinator != null) {
            coordinator.close();
        }
    }

    private SessionCoordinator start(Config.Builder config) {
        coordinator = new SessionCoordinator(config.build(), authGateway, directoryGateway, contextIds);
        coordinator.subscribe(listener);
        return coordinator;
    }

    private Config.Builder config() {
        return Config.builder()
            .authUrl("https://project.rentdesk.test/auth/v1")
            .restUrl("https://project.rentdesk.test")
            .apiKey("anon-key")
            .autoRefresh(false)
            .baseRetryDelay(Duration.ofMillis(5))
            .maxRetryDelay(Duration.ofMillis(20))
            .clock(clock);
    }

    private void signedIn(Duration validFor) {
        authGateway.setCurrent(Fixtures.session(USER, "token-1", clock.instant().plus(validFor)));
        directoryGateway.setContexts(USER, List.of(ownerCtx, staffCtx));
    }

    private static AuthState await(CompletableFuture<AuthState> future) throws Exception {
        return future.get(5, TimeUnit.SECONDS);
    }

    @Test
    void concurrentInitializationFetchesTheSessionOnce() throws Exception {
        signedIn(Duration.ofHours(1));
        start(config());
        CountDownLatch gate = new CountDownLatch(1);
        authGateway.holdCurrentSession(gate);

        ExecutorService pool = Executors.newFixedThreadPool(6);
        List<CompletableFuture<AuthState>> results = new ArrayList<>();
        try {
            List<CompletableFuture<CompletableFuture<AuthState>>> calls = new ArrayList<>();
            for (int i = 0; i < 12; i++) {
                calls.add(CompletableFuture.supplyAsync(coordinator::initialize, pool));
            }
            for (CompletableFuture<CompletableFuture<AuthState>> call : calls) {
                results.add(call.get(5, TimeUnit.SECONDS));
            }
            gate.countDown();
            for (CompletableFuture<AuthState> result : results) {
                AuthState state = await(result);
                assertEquals(CoordinatorStatus.READY, state.status());
                assertTrue(state.isAuthenticated());
            }
        } finally {
            gate.countDown();
            pool.shutdownNow();
        }

        assertEquals(1, authGateway.currentSessionCalls.get());
        assertEquals(1, directoryGateway.contextCalls.get());

        AuthState again = await(coordinator.initialize());
        assertSame(coordinator.getState(), again);
        assertEquals(1, authGateway.currentSessionCalls.get());
    }

    @Test
    void ownerSwitchesToStaffAndLosesOwnerOnlyPermissions() throws Exception {
        signedIn(Duration.ofHours(1));
        start(config());

        AuthState ready = await(coordinator.initialize());
        assertEquals("ctx-owner", ready.currentContext().contextId());
        assertTrue(ready.isOwner());
        assertTrue(ready.hasMultipleContexts());
        assertTrue(coordinator.hasPermission(Permissions.SETTINGS_EDIT));

        assertTrue(coordinator.switchContext("ctx-staff").get(5, TimeUnit.SECONDS));

        AuthState switched = coordinator.getState();
        assertEquals("ctx-staff", switched.currentContext().contextId());
        assertTrue(switched.isStaff());
        assertEquals("Warden", switched.roleName());
        assertEquals("Workspace ws-2", switched.workspaceName());
        assertFalse(coordinator.hasPermission(Permissions.SETTINGS_EDIT));
        assertTrue(coordinator.hasPermission(Permissions.ROOMS_VIEW));
        assertTrue(coordinator.hasAnyPermission(List.of(Permissions.SETTINGS_EDIT, Permissions.ROOMS_VIEW)));
        assertFalse(coordinator.hasAllPermissions(List.of(Permissions.SETTINGS_EDIT, Permissions.ROOMS_VIEW)));
        assertEquals("ctx-staff", contextIds.load().orElseThrow());
        assertEquals(List.of(List.of(USER, "ctx-owner", "ctx-staff")), directoryGateway.switchCalls);
    }

    @Test
    void rejectedSwitchKeepsTheCurrentContext() throws Exception {
        signedIn(Duration.ofHours(1));
        start(config());
        await(coordinator.initialize());
        directoryGateway.setContexts(USER, List.of(ownerCtx));
        directoryGateway.setSwitchFailure(new RentdeskApiException(403, "42501", "permission denied"));

        assertFalse(coordinator.switchContext("ctx-staff").get(5, TimeUnit.SECONDS));
        assertFalse(coordinator.switchContext("ctx-unknown").get(5, TimeUnit.SECONDS));

        AuthState state = coordinator.getState();
        assertEquals("ctx-owner", state.currentContext().contextId());
        assertEquals("ctx-owner", contextIds.load().orElseThrow());
        assertEquals(1, state.contexts().size());
        assertFalse(state.hasMultipleContexts());
    }

    @Test
    void rapidSwitchingIsReported() throws Exception {
        signedIn(Duration.ofHours(1));
        start(config());
        await(coordinator.initialize());

        for (int i = 0; i < 11; i++) {
            String target = i % 2 == 0 ? "ctx-staff" : "ctx-owner";
            assertTrue(coordinator.switchContext(target).get(5, TimeUnit.SECONDS));
        }

        List<ContextAnomaly> anomalies = coordinator.getState().anomalies();
        assertEquals(1, anomalies.size());
        assertEquals(ContextAnomaly.Type.RAPID_CONTEXT_SWITCHING, anomalies.get(0).type());

        clock.advance(Duration.ofMinutes(2));
        coordinator.refreshContexts().get(5, TimeUnit.SECONDS);
        assertTrue(coordinator.getState().anomalies().isEmpty());
    }

    @Test
    void networkErrorsAreRetriedUntilTheSessionLoads() throws Exception {
        signedIn(Duration.ofHours(1));
        authGateway.currentSessionFailures.add(FakeAuthGateway.networkFailure());
        authGateway.currentSessionFailures.add(FakeAuthGateway.networkFailure());
        start(config().maxRetryAttempts(5));

        AuthState state = await(coordinator.initialize());

        assertEquals(CoordinatorStatus.READY, state.status());
        assertNull(state.error());
        assertTrue(state.isAuthenticated());
        assertEquals(3, authGateway.currentSessionCalls.get());
        assertTrue(listener.errors.isEmpty());
    }

    @Test
    void lapsingSessionIsRefreshedAfterNetworkErrors() throws Exception {
        authGateway.setCurrent(Fixtures.session(USER, "token-1", clock.instant().plusSeconds(10)));
        directoryGateway.setContexts(USER, List.of(ownerCtx));
        authGateway.refreshFailures.add(FakeAuthGateway.networkFailure());
        authGateway.refreshFailures.add(FakeAuthGateway.networkFailure());
        start(config().maxRetryAttempts(3));

        AuthState state = await(coordinator.initialize());

        assertEquals(CoordinatorStatus.READY, state.status());
        assertNull(state.error());
        assertEquals("refreshed-3", state.session().getAccessToken());
        assertEquals(3, authGateway.refreshCalls.get());
        assertEquals(1, authGateway.currentSessionCalls.get());
        assertTrue(listener.errors.isEmpty());
    }

    @Test
    void exhaustedRetriesEndInError() throws Exception {
        signedIn(Duration.ofHours(1));
        for (int i = 0; i < 5; i++) {
            authGateway.currentSessionFailures.add(FakeAuthGateway.networkFailure());
        }
        start(config().maxRetryAttempts(2));

        AuthState state = await(coordinator.initialize());

        assertEquals(CoordinatorStatus.ERROR, state.status());
        assertEquals(SessionErrorCode.NETWORK_ERROR, state.error().code());
        assertEquals(3, authGateway.currentSessionCalls.get());
        assertEquals(1, listener.errors.size());
    }

    @Test
    void missingSessionIsReadyWithoutUser() throws Exception {
        start(config());

        AuthState state = await(coordinator.initialize());

        assertEquals(CoordinatorStatus.READY, state.status());
        assertFalse(state.isAuthenticated());
        assertNull(state.error());
        assertTrue(listener.errors.isEmpty());
        assertFalse(coordinator.hasPermission(Permissions.PROFILE_VIEW));
    }

    @Test
    void sessionFetchTimeoutIsReadyWithRecordedError() throws Exception {
        signedIn(Duration.ofHours(1));
        CountDownLatch gate = new CountDownLatch(1);
        authGateway.holdCurrentSession(gate);
        start(config().sessionFetchTimeout(Duration.ofMillis(100)));

        try {
            AuthState state = await(coordinator.initialize());

            assertEquals(CoordinatorStatus.READY, state.status());
            assertFalse(state.isAuthenticated());
            assertEquals(SessionErrorCode.TIMEOUT, state.error().code());
            assertEquals(1, listener.errors.size());
        } finally {
            gate.countDown();
        }
    }

    @Test
    void loadsProfileAdminFlagAndAnomalies() throws Exception {
        signedIn(Duration.ofHours(1));
        UserContext tenantAtStaffWorkspace = Fixtures.tenant("ctx-tenant", USER, "ws-2", false);
        directoryGateway.setContexts(USER, List.of(ownerCtx, staffCtx, tenantAtStaffWorkspace));
        directoryGateway.setProfile(USER, new UserProfile("p1", USER, "Asha", "u1@example.com", null, null, null,
            null, null));
        directoryGateway.addAdmin(USER);
        start(config());

        AuthState state = await(coordinator.initialize());

        assertEquals("Asha", state.profile().name());
        assertTrue(state.platformAdmin());
        assertEquals(3, state.contexts().size());
        assertEquals(1, state.anomalies().size());
        assertEquals(ContextAnomaly.Type.STAFF_AND_TENANT_SAME_WORKSPACE, state.anomalies().get(0).type());
    }

    @Test
    void failedDataLoadsFallBackToNeutralValues() throws Exception {
        signedIn(Duration.ofHours(1));
        directoryGateway.setContextsFailure(new RentdeskApiException(500, "XX000", "internal error"));
        directoryGateway.setAdminFailure(new RentdeskApiException(403, "42501", "permission denied"));
        start(config());

        AuthState state = await(coordinator.initialize());

        assertEquals(CoordinatorStatus.READY, state.status());
        assertTrue(state.isAuthenticated());
        assertTrue(state.contexts().isEmpty());
        assertNull(state.currentContext());
        assertFalse(state.platformAdmin());
        assertNull(state.profile());
    }

    @Test
    void spuriousSignedOutIsIgnored() throws Exception {
        signedIn(Duration.ofHours(1));
        start(config());
        await(coordinator.initialize());

        coordinator.authEvents().publish(SessionEvent.of(SessionEventType.SIGNED_OUT, null, clock.instant()));

        AuthState state = coordinator.getState();
        assertEquals(CoordinatorStatus.READY, state.status());
        assertTrue(state.isAuthenticated());
        assertEquals("ctx-owner", state.currentContext().contextId());
    }

    @Test
    void userUpdatedEventReplacesTheUser() throws Exception {
        signedIn(Duration.ofHours(1));
        start(config());
        await(coordinator.initialize());

        AuthUser renamed = new AuthUser(USER, "u1@example.com", "Renamed");
        coordinator.authEvents().publish(new SessionEvent(SessionEventType.USER_UPDATED, renamed, null,
            clock.instant()));

        assertEquals("Renamed", coordinator.getState().user().name());
    }

    @Test
    void logoutClearsEverythingAndIsIdempotent() throws Exception {
        signedIn(Duration.ofHours(1));
        start(config());
        await(coordinator.initialize());

        SignOutResult first = coordinator.logout().get(5, TimeUnit.SECONDS);
        SignOutResult second = coordinator.logout().get(5, TimeUnit.SECONDS);

        assertTrue(first.success());
        assertTrue(second.success());
        assertEquals(1, authGateway.signOutCalls.get());
        AuthState state = coordinator.getState();
        assertEquals(CoordinatorStatus.UNINITIALIZED, state.status());
        assertFalse(state.isAuthenticated());
        assertTrue(state.contexts().isEmpty());
        assertTrue(contextIds.load().isEmpty());

        assertEquals(1, directoryGateway.auditEvents.size());
        AuditEvent audit = directoryGateway.auditEvents.get(0);
        assertEquals("logout", audit.metadata().get("operation"));
        assertEquals("ws-1", audit.workspaceId());
    }

    @Test
    void restoredSessionAfterLogoutStillIgnoresProviderSignOut() throws Exception {
        signedIn(Duration.ofHours(1));
        start(config());
        await(coordinator.initialize());
        coordinator.logout().get(5, TimeUnit.SECONDS);

        authGateway.setCurrent(Fixtures.session(USER, "token-2", clock.instant().plus(Duration.ofHours(1))));
        assertTrue(await(coordinator.initialize()).isAuthenticated());

        coordinator.authEvents().publish(SessionEvent.of(SessionEventType.SIGNED_OUT, null, clock.instant()));

        AuthState state = coordinator.getState();
        assertEquals(CoordinatorStatus.READY, state.status());
        assertTrue(state.isAuthenticated());
        assertEquals("token-2", state.session().getAccessToken());
    }

    @Test
    void logoutClearsLocalStateWhenRemoteSignOutFails() throws Exception {
        signedIn(Duration.ofHours(1));
        start(config());
        await(coordinator.initialize());
        authGateway.setSignOutFailure(FakeAuthGateway.networkFailure());

        SignOutResult result = coordinator.logout().get(5, TimeUnit.SECONDS);

        assertFalse(result.success());
        assertEquals(CoordinatorStatus.UNINITIALIZED, coordinator.getState().status());
        assertFalse(coordinator.hasPermission(Permissions.PROFILE_VIEW));
    }

    @Test
    void closedSubscriptionReceivesNothing() throws Exception {
        signedIn(Duration.ofHours(1));
        start(config());
        RecordingListener detached = new RecordingListener();
        Subscription subscription = coordinator.subscribe(detached);
        subscription.close();

        await(coordinator.initialize());

        assertFalse(subscription.isActive());
        assertTrue(detached.states.isEmpty());
        assertFalse(listener.states.isEmpty());
        assertEquals(CoordinatorStatus.READY, listener.states.get(listener.states.size() - 1).status());
    }

    @Test
    void refreshReplacesTheSession() throws Exception {
        signedIn(Duration.ofHours(1));
        start(config());
        await(coordinator.initialize());

        assertTrue(coordinator.refresh().get(5, TimeUnit.SECONDS));

        assertEquals("refreshed-1", coordinator.getState().session().getAccessToken());
        assertEquals(USER, coordinator.getState().user().id());
    }

    @Test
    void failedRefreshKeepsSessionAndReportsExpiry() throws Exception {
        signedIn(Duration.ofMinutes(10));
        start(config());
        Session original = await(coordinator.initialize()).session();

        clock.advance(Duration.ofMinutes(11));
        authGateway.refreshFailures.add(new RentdeskApiException(400, "invalid_grant", "Refresh token revoked"));

        assertFalse(coordinator.refresh().get(5, TimeUnit.SECONDS));

        AuthState state = coordinator.getState();
        assertSame(original, state.session());
        assertTrue(state.sessionExpired());
        assertEquals(SessionErrorCode.REFRESH_FAILED, state.error().code());
        assertEquals(1, listener.expired.get());
        assertEquals(CoordinatorStatus.READY, state.status());
    }

    @Test
    void backgroundRefreshNetworkErrorIsRecordedQuietly() throws Exception {
        signedIn(Duration.ofHours(1));
        start(config());
        await(coordinator.initialize());
        authGateway.refreshFailures.add(FakeAuthGateway.networkFailure());

        assertFalse(coordinator.refresh().get(5, TimeUnit.SECONDS));

        AuthState state = coordinator.getState();
        assertEquals(SessionErrorCode.NETWORK_ERROR, state.error().code());
        assertFalse(state.sessionExpired());
        assertNotNull(state.session());
        assertTrue(listener.errors.isEmpty());
        assertEquals(0, listener.expired.get());
    }

    @Test
    void signInLoadsTheNewUser() throws Exception {
        directoryGateway.setContexts("alice", List.of(Fixtures.tenant("ctx-alice", "alice", "ws-9", true)));
        start(config());
        await(coordinator.initialize());

        AuthState state = await(coordinator.signIn("alice@example.com", FakeAuthGateway.PASSWORD));

        assertEquals(CoordinatorStatus.READY, state.status());
        assertEquals("alice", state.user().id());
        assertTrue(state.isTenant());
        assertTrue(coordinator.hasPermission(Permissions.COMPLAINTS_CREATE));
        assertFalse(coordinator.hasPermission(Permissions.ROOMS_VIEW));
    }

    @Test
    void failedSignInReportsTheError() throws Exception {
        start(config());

        AuthState state = await(coordinator.signIn("alice@example.com", "wrong"));

        assertFalse(state.isAuthenticated());
        assertNotNull(state.error());
        assertEquals(1, listener.errors.size());
    }

    @Test
    void setDefaultContextRepublishesContexts() throws Exception {
        signedIn(Duration.ofHours(1));
        start(config());
        await(coordinator.initialize());

        assertTrue(coordinator.setDefaultContext("ctx-staff").get(5, TimeUnit.SECONDS));

        UserContext staff = coordinator.getState().contexts().stream()
            .filter(c -> c.contextId().equals("ctx-staff"))
            .findFirst()
            .orElseThrow();
        assertTrue(staff.isDefault());
        assertEquals("ctx-owner", coordinator.getState().currentContext().contextId());
    }

    @Test
    void refreshContextsFallsBackWhenCurrentDisappears() throws Exception {
        signedIn(Duration.ofHours(1));
        start(config());
        await(coordinator.initialize());
        directoryGateway.setContexts(USER, List.of(staffCtx));

        List<UserContext> contexts = coordinator.refreshContexts().get(5, TimeUnit.SECONDS);

        assertEquals(1, contexts.size());
        assertEquals("ctx-staff", coordinator.getState().currentContext().contextId());
        assertFalse(coordinator.getState().hasMultipleContexts());
    }

    private static final class RecordingListener implements SessionListener {
        final List<AuthState> states = new CopyOnWriteArrayList<>();
        final List<SessionError> errors = new CopyOnWriteArrayList<>();
        final AtomicInteger expired = new AtomicInteger();

        @Override
        public void onStateChanged(AuthState state) {
            states.add(state);
        }

        @Override
        public void onError(SessionError error) {
            errors.add(error);
        }

        @Override
        public void onSessionExpired() {
            expired.incrementAndGet();
        }
    }
}
