package cloud.rentdesk.sdk;

import cloud.rentdesk.sdk.auth.AuthEventBus;
import cloud.rentdesk.sdk.auth.AuthGateway;
import cloud.rentdesk.sdk.auth.AuthUser;
import cloud.rentdesk.sdk.auth.HttpAuthGateway;
import cloud.rentdesk.sdk.auth.Session;
import cloud.rentdesk.sdk.auth.SessionError;
import cloud.rentdesk.sdk.auth.SessionErrorCode;
import cloud.rentdesk.sdk.auth.SessionEvent;
import cloud.rentdesk.sdk.auth.SessionResult;
import cloud.rentdesk.sdk.auth.SessionStore;
import cloud.rentdesk.sdk.auth.SignOutResult;
import cloud.rentdesk.sdk.context.AuditEvent;
import cloud.rentdesk.sdk.context.ContextAnomaly;
import cloud.rentdesk.sdk.context.ContextAnomalyDetector;
import cloud.rentdesk.sdk.context.ContextDirectory;
import cloud.rentdesk.sdk.context.ContextIdStore;
import cloud.rentdesk.sdk.context.ContextResolver;
import cloud.rentdesk.sdk.context.DirectoryGateway;
import cloud.rentdesk.sdk.context.FileContextIdStore;
import cloud.rentdesk.sdk.context.InMemoryContextIdStore;
import cloud.rentdesk.sdk.context.RestDirectoryGateway;
import cloud.rentdesk.sdk.context.UserContext;
import cloud.rentdesk.sdk.context.UserProfile;
import cloud.rentdesk.sdk.internal.RetryPolicy;
import cloud.rentdesk.sdk.internal.SingleFlight;
import cloud.rentdesk.sdk.permission.PermissionEvaluator;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Process-wide owner of the signed-in user's session, contexts and permissions.
 *
 * <p>
 * The coordinator loads the session, the user's profile, contexts and platform-admin flag, resolves the active
 * context and publishes the result as an immutable {@link AuthState}. It keeps the session fresh on a timer, reacts
 * to {@link SessionEvent}s from the session store and exposes context switching and permission checks.
 * </p>
 *
 * <p>
 * Initialization and refresh are single-flight: concurrent callers share one run. Blocking remote calls execute on
 * an internal worker pool, so every operation returns a {@link CompletableFuture}. Call {@link #close()} to stop
 * the timers and worker threads.
 * </p>
 */
public final class SessionCoordinator implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(SessionCoordinator.class.getName());

    private final Config config;
    private final Clock clock;
    private final AuthEventBus events;
    private final SessionStore sessionStore;
    private final ContextDirectory directory;
    private final ContextResolver resolver;
    private final ContextAnomalyDetector anomalyDetector;
    private final RetryPolicy retryPolicy;

    private final ExecutorService worker;
    private final ScheduledExecutorService scheduler;

    private final Object stateLock = new Object();
    private AuthState state = AuthState.initial();

    private final List<ListenerRegistration> listeners = new CopyOnWriteArrayList<>();

    private final SingleFlight<AuthState> initFlight = new SingleFlight<>();
    private final SingleFlight<Boolean> refreshFlight = new SingleFlight<>();
    private final SingleFlight<SignOutResult> logoutFlight = new SingleFlight<>();

    private final AtomicBoolean explicitLogout = new AtomicBoolean();
    private final AtomicBoolean loggingOut = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();
    // bumped on logout so that work started for the previous user is discarded
    private final AtomicLong generation = new AtomicLong();

    private final Object timerLock = new Object();
    private ScheduledFuture<?> refreshTimer;
    private ScheduledFuture<?> checkTimer;
    private ScheduledFuture<?> expiryTimer;

    private final Subscription authSubscription;

    /**
     * Creates a coordinator talking to the identity endpoint and data API named in {@code config}.
     */
    public SessionCoordinator(Config config) {
        this(config, null, null, null);
    }

    /**
     * Creates a coordinator with explicit collaborators. {@code null} collaborators are built from {@code config}.
     */
    public SessionCoordinator(Config config, AuthGateway authGateway, DirectoryGateway directoryGateway,
                              ContextIdStore contextIdStore) {
        this.config = Objects.requireNonNull(config, "config").withDefaults();
        this.clock = this.config.getClock();

        AuthGateway resolvedAuth = authGateway != null ? authGateway : new HttpAuthGateway(
            this.config.getHttpClient(), this.config.getAuthUrl(), this.config.getApiKey(),
            this.config.getHttpTimeout(), clock);
        DirectoryGateway resolvedDirectory = directoryGateway != null ? directoryGateway : new RestDirectoryGateway(
            this.config.getHttpClient(), this.config.getRestUrl(), this.config.getApiKey(),
            this.config.getHttpTimeout());
        ContextIdStore resolvedStore = contextIdStore;
        if (resolvedStore == null) {
            resolvedStore = this.config.getContextStorePath() == null
                ? new InMemoryContextIdStore()
                : new FileContextIdStore(this.config.getContextStorePath());
        }

        this.events = new AuthEventBus();
        this.sessionStore = new SessionStore(resolvedAuth, events, resolvedStore,
            this.config.getSessionExpiryBuffer(), clock);
        this.directory = new ContextDirectory(resolvedDirectory, sessionStore);
        this.resolver = new ContextResolver(directory, resolvedStore, clock);
        this.anomalyDetector = new ContextAnomalyDetector(clock);
        this.retryPolicy = new RetryPolicy(this.config.getMaxRetryAttempts(), this.config.getBaseRetryDelay(),
            this.config.getMaxRetryDelay());

        this.worker = Executors.newCachedThreadPool(threadFactory("rentdesk-session-worker"));
        this.scheduler = Executors.newSingleThreadScheduledExecutor(threadFactory("rentdesk-session-timer"));

        this.authSubscription = events.subscribe(this::onAuthEvent);
    }

    /**
     * Loads the session and the user's data. Concurrent calls share one run; a coordinator that is already ready
     * with a session completes immediately. Calls made while a logout is running return the current state.
     */
    public CompletableFuture<AuthState> initialize() {
        if (closed.get()) {
            return CompletableFuture.failedFuture(new IllegalStateException("session coordinator is closed"));
        }
        if (loggingOut.get()) {
            LOGGER.info(() -> "[rentdesk-sdk] initialize ignored while logging out");
            return CompletableFuture.completedFuture(getState());
        }
        AuthState snapshot = getState();
        if (snapshot.status() == CoordinatorStatus.READY && snapshot.session() != null) {
            return CompletableFuture.completedFuture(snapshot);
        }
        return initFlight.run(() -> {
            long gen = generation.get();
            LOGGER.info(() -> "[rentdesk-sdk] initializing session");
            updateState(b -> b.status(CoordinatorStatus.INITIALIZING).error(null));
            return fetchSessionWithRetry(0)
                .thenCompose(result -> result.isOk()
                    ? loadUserData(result.session(), gen)
                    : CompletableFuture.completedFuture(handleSessionFailure(result.error(), gen)))
                .exceptionally(ex -> failInitialization(unwrap(ex), gen));
        });
    }

    private CompletableFuture<SessionResult> fetchSessionWithRetry(int attempt) {
        Duration timeout = config.getSessionFetchTimeout();
        CompletableFuture<SessionResult> fetch = CompletableFuture.supplyAsync(sessionStore::get, worker)
            .completeOnTimeout(
                SessionResult.failure(SessionErrorCode.TIMEOUT, "Session fetch timed out after " + timeout.toMillis() + "ms"),
                timeout.toMillis(), TimeUnit.MILLISECONDS);

        return fetch.thenCompose(result -> {
            if (result.isOk() || result.errorCode() != SessionErrorCode.NETWORK_ERROR) {
                return CompletableFuture.completedFuture(result);
            }
            OptionalLong delay = retryPolicy.delayFor(attempt);
            if (delay.isEmpty()) {
                LOGGER.severe(() -> String.format(Locale.ROOT,
                    "[rentdesk-sdk] session fetch failed after %d retries: %s", attempt, result.error().message()));
                return CompletableFuture.completedFuture(result);
            }
            LOGGER.warning(() -> String.format(Locale.ROOT,
                "[rentdesk-sdk] network error fetching session; retry %d/%d in %dms",
                attempt + 1, retryPolicy.maxAttempts(), delay.getAsLong()));
            Executor delayed = CompletableFuture.delayedExecutor(delay.getAsLong(), TimeUnit.MILLISECONDS, worker);
            return CompletableFuture.runAsync(() -> { }, delayed)
                .thenCompose(ignored -> fetchSessionWithRetry(attempt + 1));
        });
    }

    private AuthState handleSessionFailure(SessionError error, long gen) {
        if (gen != generation.get()) {
            return getState();
        }
        SessionErrorCode code = error == null ? SessionErrorCode.NO_SESSION : error.code();
        switch (code) {
            case NO_SESSION:
                LOGGER.info(() -> "[rentdesk-sdk] no active session; ready without a user");
                resolver.clear();
                return updateState(b -> unauthenticated(b).status(CoordinatorStatus.READY).error(null));
            case TIMEOUT:
                LOGGER.warning(() -> "[rentdesk-sdk] session fetch timed out; ready without a user");
                resolver.clear();
                AuthState timedOut = updateState(b -> unauthenticated(b).status(CoordinatorStatus.READY).error(error));
                notifyError(error);
                return timedOut;
            default:
                return failInitialization(error, gen);
        }
    }

    private AuthState failInitialization(SessionError error, long gen) {
        if (gen != generation.get()) {
            return getState();
        }
        LOGGER.severe(() -> "[rentdesk-sdk] initialization failed: " + error.code() + " " + error.message());
        AuthState failed = updateState(b -> b.status(CoordinatorStatus.ERROR).error(error));
        notifyError(error);
        return failed;
    }

    private CompletableFuture<AuthState> loadUserData(Session session, long gen) {
        String userId = session.getUserId();
        String token = session.getAccessToken();
        Duration timeout = config.getDataLoadTimeout();

        CompletableFuture<UserProfile> profile = bounded(
            () -> directory.fetchProfile(userId, token), null, timeout, "profile");
        CompletableFuture<List<UserContext>> contexts = bounded(
            () -> directory.fetchContexts(userId, token), List.of(), timeout, "contexts");
        CompletableFuture<Boolean> admin = bounded(
            () -> directory.checkPlatformAdmin(userId, token), Boolean.FALSE, timeout, "platform admin");

        return CompletableFuture.allOf(profile, contexts, admin).thenApply(ignored -> {
            if (gen != generation.get() || loggingOut.get()) {
                LOGGER.info(() -> "[rentdesk-sdk] discarding user data loaded before logout");
                return getState();
            }
            List<UserContext> loaded = contexts.join();
            UserContext current = resolver.resolveInitial(userId, loaded);
            List<ContextAnomaly> anomalies = anomalyDetector.detect(loaded, resolver.recentSwitchCount());
            // a restored session re-arms the guard against provider-side sign-outs
            explicitLogout.set(false);
            AuthUser user = session.getUser() != null ? session.getUser() : new AuthUser(userId, null, null);

            AuthState ready = updateState(b -> b
                .status(CoordinatorStatus.READY)
                .user(user)
                .session(session)
                .profile(profile.join())
                .contexts(resolver.getContexts())
                .currentContext(current)
                .platformAdmin(Boolean.TRUE.equals(admin.join()))
                .anomalies(anomalies)
                .error(null)
                .sessionExpired(false));
            LOGGER.info(() -> String.format(Locale.ROOT,
                "[rentdesk-sdk] session ready for user %s with %d contexts", userId, loaded.size()));
            scheduleTimers(session);
            return ready;
        });
    }

    private <T> CompletableFuture<T> bounded(Supplier<T> task, T fallback, Duration timeout, String label) {
        return CompletableFuture.supplyAsync(task, worker)
            .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
            .exceptionally(ex -> {
                Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
                if (cause instanceof TimeoutException) {
                    LOGGER.warning(() -> String.format(Locale.ROOT,
                        "[rentdesk-sdk] %s load timed out after %dms; using fallback", label, timeout.toMillis()));
                } else {
                    LOGGER.log(Level.WARNING, cause, () -> "[rentdesk-sdk] " + label + " load failed; using fallback");
                }
                return fallback;
            });
    }

    /**
     * Exchanges the refresh token for a new session. Concurrent calls share one exchange.
     *
     * @return future completing with {@code true} when the session was renewed.
     */
    public CompletableFuture<Boolean> refresh() {
        if (closed.get()) {
            return CompletableFuture.completedFuture(Boolean.FALSE);
        }
        long gen = generation.get();
        return refreshFlight.run(() -> CompletableFuture.supplyAsync(sessionStore::refresh, worker)
            .thenApply(result -> applyRefreshResult(result, gen)));
    }

    private boolean applyRefreshResult(SessionResult result, long gen) {
        if (gen != generation.get() || loggingOut.get()) {
            return false;
        }
        if (result.isOk()) {
            Session session = result.session();
            updateState(b -> {
                b.session(session).error(null).sessionExpired(false);
                if (session.getUser() != null) {
                    b.user(session.getUser());
                }
                return b;
            });
            scheduleTimers(session);
            return true;
        }

        SessionError error = result.error();
        Session previous = getState().session();
        Instant expiresAt = previous == null ? null : previous.getExpiresAt();
        boolean expired = expiresAt != null && !clock.instant().isBefore(expiresAt);

        // the previous session stays in place until it actually lapses
        updateState(b -> expired ? b.error(error).sessionExpired(true) : b.error(error));
        if (error.code() == SessionErrorCode.NETWORK_ERROR) {
            LOGGER.warning(() -> "[rentdesk-sdk] background refresh hit a network error: " + error.message());
        } else {
            LOGGER.warning(() -> "[rentdesk-sdk] refresh failed: " + error.code() + " " + error.message());
            notifyError(error);
        }

        if (expired) {
            LOGGER.warning(() -> "[rentdesk-sdk] session expired and could not be refreshed");
            notifySessionExpired();
        } else if (expiresAt != null) {
            scheduleExpiryCheck(previous);
        }
        return false;
    }

    /**
     * Signs in with email and password, then initializes.
     */
    public CompletableFuture<AuthState> signIn(String email, String password) {
        if (closed.get()) {
            return CompletableFuture.failedFuture(new IllegalStateException("session coordinator is closed"));
        }
        explicitLogout.set(false);
        return CompletableFuture.supplyAsync(() -> sessionStore.signInWithPassword(email, password), worker)
            .thenCompose(result -> {
                if (!result.isOk()) {
                    SessionError error = result.error();
                    LOGGER.warning(() -> "[rentdesk-sdk] sign in failed: " + error.code() + " " + error.message());
                    AuthState failed = updateState(b -> b.error(error));
                    notifyError(error);
                    return CompletableFuture.completedFuture(failed);
                }
                return initialize();
            });
    }

    /**
     * Signs out and resets to {@link CoordinatorStatus#UNINITIALIZED}. Local state is cleared even when the remote
     * sign-out fails. Calling it again, or while a logout runs, is harmless.
     */
    public CompletableFuture<SignOutResult> logout() {
        if (closed.get()) {
            return CompletableFuture.completedFuture(SignOutResult.ok());
        }
        return logoutFlight.run(() -> {
            explicitLogout.set(true);
            loggingOut.set(true);
            generation.incrementAndGet();
            cancelTimers();
            AuthState snapshot = getState();
            LOGGER.info(() -> "[rentdesk-sdk] logging out");

            return CompletableFuture.supplyAsync(() -> {
                emitLogoutAudit(snapshot);
                return sessionStore.signOut();
            }, worker).whenComplete((result, ex) -> {
                resolver.clear();
                initFlight.reset();
                refreshFlight.reset();
                updateState(b -> AuthState.initial().toBuilder());
                loggingOut.set(false);
                if (result != null && !result.success()) {
                    LOGGER.warning(() -> "[rentdesk-sdk] remote sign out failed; local state cleared");
                }
            });
        });
    }

    private void emitLogoutAudit(AuthState snapshot) {
        AuthUser user = snapshot.user();
        Session session = snapshot.session() != null ? snapshot.session() : sessionStore.peek();
        UserContext context = snapshot.currentContext();
        if (context == null && !snapshot.contexts().isEmpty()) {
            context = snapshot.contexts().get(0);
        }
        if (user == null || session == null || context == null) {
            return;
        }
        Instant now = clock.instant();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("operation", "logout");
        metadata.put("email", user.email());
        metadata.put("timestamp", DateTimeFormatter.ISO_INSTANT.format(now));
        String actorType = context.contextType() == null ? null : context.contextType().wireValue();
        AuditEvent event = new AuditEvent("staff", user.id(), "update", user.id(), actorType,
            context.workspaceId(), metadata, now);
        directory.emitAuditEvent(event, session.getAccessToken());
    }

    /**
     * Makes {@code contextId} the active context once the backend has acknowledged the switch.
     *
     * @return future completing with {@code false} when the switch was rejected or failed.
     */
    public CompletableFuture<Boolean> switchContext(String contextId) {
        return CompletableFuture.supplyAsync(() -> resolver.switchContext(contextId), worker)
            .thenApply(switched -> {
                // a rejected switch may have reloaded the context list
                publishContexts();
                return switched;
            });
    }

    public CompletableFuture<Boolean> setDefaultContext(String contextId) {
        return CompletableFuture.supplyAsync(() -> resolver.setDefault(contextId), worker)
            .thenApply(updated -> {
                if (updated) {
                    publishContexts();
                }
                return updated;
            });
    }

    public CompletableFuture<List<UserContext>> refreshContexts() {
        return CompletableFuture.supplyAsync(resolver::refreshContexts, worker)
            .thenApply(contexts -> {
                publishContexts();
                return contexts;
            });
    }

    private void publishContexts() {
        List<UserContext> contexts = resolver.getContexts();
        UserContext current = resolver.getCurrent();
        List<ContextAnomaly> anomalies = anomalyDetector.detect(contexts, resolver.recentSwitchCount());
        updateState(b -> b.contexts(contexts).currentContext(current).anomalies(anomalies));
    }

    public boolean hasPermission(String permission) {
        AuthState snapshot = getState();
        return PermissionEvaluator.hasPermission(snapshot.currentContext(), snapshot.platformAdmin(), permission);
    }

    public boolean hasAnyPermission(Collection<String> permissions) {
        AuthState snapshot = getState();
        return PermissionEvaluator.hasAny(snapshot.currentContext(), snapshot.platformAdmin(), permissions);
    }

    public boolean hasAllPermissions(Collection<String> permissions) {
        AuthState snapshot = getState();
        return PermissionEvaluator.hasAll(snapshot.currentContext(), snapshot.platformAdmin(), permissions);
    }

    private void onAuthEvent(SessionEvent event) {
        if (closed.get()) {
            return;
        }
        if (loggingOut.get()) {
            LOGGER.fine(() -> "[rentdesk-sdk] ignoring " + event.type() + " during logout");
            return;
        }
        switch (event.type()) {
            case SIGNED_IN:
            case TOKEN_REFRESHED:
                onSessionEstablished(event.session());
                break;
            case USER_UPDATED:
                if (event.user() != null) {
                    updateState(b -> b.user(event.user()));
                }
                break;
            case SIGNED_OUT:
                if (!explicitLogout.get()) {
                    LOGGER.warning(() -> "[rentdesk-sdk] ignoring SIGNED_OUT not initiated by logout");
                    return;
                }
                resolver.clear();
                cancelTimers();
                updateState(b -> AuthState.initial().toBuilder());
                break;
            case SESSION_EXPIRED:
                updateState(b -> b.sessionExpired(true));
                notifySessionExpired();
                break;
            default:
                break;
        }
    }

    private void onSessionEstablished(Session session) {
        if (session == null) {
            return;
        }
        explicitLogout.set(false);
        AuthState snapshot = getState();
        boolean userChanged = snapshot.user() == null || !Objects.equals(snapshot.user().id(), session.getUserId());
        if (userChanged) {
            long gen = generation.get();
            LOGGER.info(() -> "[rentdesk-sdk] session established for user " + session.getUserId() + "; loading data");
            initFlight.run(() -> {
                updateState(b -> b.status(CoordinatorStatus.INITIALIZING).error(null));
                return loadUserData(session, gen)
                    .exceptionally(ex -> failInitialization(unwrap(ex), gen));
            });
            return;
        }
        updateState(b -> {
            b.session(session);
            if (session.getUser() != null) {
                b.user(session.getUser());
            }
            return b;
        });
    }

    /**
     * Channel carrying session events. Integrations may publish provider-side events here.
     */
    public AuthEventBus authEvents() {
        return events;
    }

    private void scheduleTimers(Session session) {
        if (!config.isAutoRefresh() || closed.get()) {
            return;
        }
        synchronized (timerLock) {
            cancel(refreshTimer);
            cancel(expiryTimer);
            refreshTimer = null;
            expiryTimer = null;
            Instant expiresAt = session.getExpiresAt();
            if (expiresAt != null) {
                long delay = Math.max(0L,
                    Duration.between(clock.instant(), expiresAt.minus(config.getRefreshBuffer())).toMillis());
                refreshTimer = scheduler.schedule(() -> guarded("scheduled refresh", this::refresh),
                    delay, TimeUnit.MILLISECONDS);
                LOGGER.fine(() -> "[rentdesk-sdk] refresh scheduled in " + delay + "ms");
            }
            if (checkTimer == null) {
                long interval = config.getSessionCheckInterval().toMillis();
                checkTimer = scheduler.scheduleAtFixedRate(() -> guarded("session check", this::periodicCheck),
                    interval, interval, TimeUnit.MILLISECONDS);
            }
        }
    }

    private void scheduleExpiryCheck(Session session) {
        if (closed.get()) {
            return;
        }
        long delay = Math.max(0L, Duration.between(clock.instant(), session.getExpiresAt()).toMillis());
        synchronized (timerLock) {
            cancel(expiryTimer);
            expiryTimer = scheduler.schedule(() -> guarded("expiry check", () -> checkExpiry(session)),
                delay, TimeUnit.MILLISECONDS);
        }
    }

    private void checkExpiry(Session session) {
        AuthState snapshot = getState();
        if (snapshot.session() != session || snapshot.sessionExpired()) {
            return;
        }
        if (!clock.instant().isBefore(session.getExpiresAt())) {
            LOGGER.warning(() -> "[rentdesk-sdk] session expired");
            updateState(b -> b.sessionExpired(true));
            notifySessionExpired();
        }
    }

    private void periodicCheck() {
        AuthState snapshot = getState();
        if (snapshot.session() == null || loggingOut.get()) {
            return;
        }
        if (snapshot.willExpireSoon(clock, config.getRefreshBuffer()) && !refreshFlight.isInFlight()) {
            LOGGER.info(() -> "[rentdesk-sdk] session expiring soon; refreshing");
            refresh();
        }
    }

    private void cancelTimers() {
        synchronized (timerLock) {
            cancel(refreshTimer);
            cancel(checkTimer);
            cancel(expiryTimer);
            refreshTimer = null;
            checkTimer = null;
            expiryTimer = null;
        }
    }

    private static void cancel(ScheduledFuture<?> future) {
        if (future != null) {
            future.cancel(false);
        }
    }

    private static void guarded(String label, Runnable task) {
        try {
            task.run();
        } catch (RuntimeException ex) {
            LOGGER.log(Level.WARNING, ex, () -> "[rentdesk-sdk] " + label + " failed");
        }
    }

    public AuthState getState() {
        synchronized (stateLock) {
            return state;
        }
    }

    public Config getConfig() {
        return config;
    }

    /**
     * Registers a listener. Closing the returned subscription stops every further delivery to it.
     */
    public Subscription subscribe(SessionListener listener) {
        ListenerRegistration registration = new ListenerRegistration(Objects.requireNonNull(listener, "listener"));
        listeners.add(registration);
        return registration;
    }

    private AuthState updateState(UnaryOperator<AuthState.Builder> change) {
        AuthState updated;
        synchronized (stateLock) {
            updated = change.apply(state.toBuilder()).build();
            state = updated;
        }
        AuthState published = updated;
        deliver(listener -> listener.onStateChanged(published));
        return updated;
    }

    private static AuthState.Builder unauthenticated(AuthState.Builder builder) {
        return builder.user(null)
            .session(null)
            .profile(null)
            .contexts(List.of())
            .currentContext(null)
            .platformAdmin(false)
            .anomalies(List.of())
            .sessionExpired(false);
    }

    private void notifyError(SessionError error) {
        deliver(listener -> listener.onError(error));
    }

    private void notifySessionExpired() {
        deliver(SessionListener::onSessionExpired);
    }

    private void deliver(Consumer<SessionListener> callback) {
        for (ListenerRegistration registration : listeners) {
            if (!registration.isActive()) {
                continue;
            }
            try {
                callback.accept(registration.listener);
            } catch (RuntimeException ex) {
                LOGGER.log(Level.WARNING, ex, () -> "[rentdesk-sdk] session listener failed");
            }
        }
    }

    private static SessionError unwrap(Throwable ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        return SessionError.of(SessionErrorCode.UNKNOWN_ERROR, cause.getMessage(), cause);
    }

    private static ThreadFactory threadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Stops timers and worker threads. Listeners receive nothing afterwards.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        cancelTimers();
        authSubscription.close();
        for (ListenerRegistration registration : listeners) {
            registration.close();
        }
        scheduler.shutdownNow();
        worker.shutdownNow();
    }

    private final class ListenerRegistration implements Subscription {
        private final SessionListener listener;
        private final AtomicBoolean active = new AtomicBoolean(true);

        private ListenerRegistration(SessionListener listener) {
            this.listener = listener;
        }

        @Override
        public boolean isActive() {
            return active.get();
        }

        @Override
        public void close() {
            if (active.compareAndSet(true, false)) {
                listeners.remove(this);
            }
        }
    }
}
