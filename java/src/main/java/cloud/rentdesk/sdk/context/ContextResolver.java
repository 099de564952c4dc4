package cloud.rentdesk.sdk.context;

import cloud.rentdesk.sdk.RentdeskException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Tracks the contexts of the signed-in user and which of them is active.
 *
 * <p>
 * The active context, when set, is always one of the known contexts. Switches are confirmed remotely before they
 * are committed locally, and only one switch may await confirmation at a time.
 * </p>
 */
public final class ContextResolver {

    private static final Logger LOGGER = Logger.getLogger(ContextResolver.class.getName());

    /**
     * Window over which committed switches are counted.
     */
    public static final Duration SWITCH_WINDOW = Duration.ofMinutes(1);

    private final ContextDirectory directory;
    private final ContextIdStore idStore;
    private final Clock clock;

    private final Object lock = new Object();
    private final AtomicBoolean switching = new AtomicBoolean();

    private String userId;
    private List<UserContext> contexts = List.of();
    private UserContext current;
    private final Deque<Instant> switchTimes = new ArrayDeque<>();

    public ContextResolver(ContextDirectory directory, ContextIdStore idStore) {
        this(directory, idStore, Clock.systemUTC());
    }

    public ContextResolver(ContextDirectory directory, ContextIdStore idStore, Clock clock) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.idStore = Objects.requireNonNull(idStore, "idStore");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Binds the resolver to a user and picks the starting context: the remembered one if it is still offered, then
     * the user's default, then the first context.
     *
     * @return the resolved context, or {@code null} when the user has none.
     */
    public UserContext resolveInitial(String userId, List<UserContext> available) {
        List<UserContext> snapshot = sanitize(available);
        Optional<String> remembered = idStore.load();

        UserContext resolved = remembered.flatMap(id -> find(snapshot, id)).orElse(null);
        if (resolved == null) {
            resolved = fallback(snapshot);
        }

        synchronized (lock) {
            this.userId = userId;
            this.contexts = snapshot;
            this.current = resolved;
        }
        persist(resolved);

        UserContext picked = resolved;
        LOGGER.info(() -> String.format(Locale.ROOT, "[rentdesk-sdk] resolved context %s out of %d",
            picked == null ? "<none>" : picked.contextId(), snapshot.size()));
        return resolved;
    }

    /**
     * Makes {@code contextId} the active context.
     *
     * @return {@code false} when the id is unknown, the context has no workspace, another switch is still
     *     awaiting confirmation, or the remote switch failed. The active context is untouched in those cases; a
     *     remote rejection reloads the context list since access may have been revoked.
     */
    public boolean switchContext(String contextId) {
        UserContext target;
        String fromId;
        String boundUser;
        synchronized (lock) {
            target = find(contexts, contextId).orElse(null);
            fromId = current == null ? null : current.contextId();
            boundUser = userId;
        }
        if (target == null) {
            LOGGER.warning(() -> "[rentdesk-sdk] switch rejected: unknown context " + contextId);
            return false;
        }
        if (target.workspaceId() == null || target.workspaceId().isBlank()) {
            LOGGER.warning(() -> "[rentdesk-sdk] switch rejected: context " + contextId + " has no workspace");
            return false;
        }
        if (!switching.compareAndSet(false, true)) {
            LOGGER.warning(() -> "[rentdesk-sdk] switch rejected: another switch is in progress");
            return false;
        }

        try {
            directory.switchContext(boundUser, fromId, target.contextId());
            synchronized (lock) {
                // The context list may have been refreshed while the remote call ran.
                UserContext committed = find(contexts, target.contextId()).orElse(null);
                if (committed == null) {
                    LOGGER.warning(() -> "[rentdesk-sdk] context " + contextId + " disappeared during switch");
                    return false;
                }
                current = committed;
                Instant now = clock.instant();
                switchTimes.addLast(now);
                pruneSwitchTimes(now);
            }
            persist(target);
            LOGGER.info(() -> String.format(Locale.ROOT, "[rentdesk-sdk] switched context %s -> %s",
                fromId, target.contextId()));
            return true;
        } catch (RentdeskException ex) {
            LOGGER.log(Level.WARNING, ex, () -> "[rentdesk-sdk] remote switch to " + contextId + " failed");
            refreshContexts();
            return false;
        } finally {
            switching.set(false);
        }
    }

    /**
     * Marks {@code contextId} as the user's default remotely, then reloads the context list.
     */
    public boolean setDefault(String contextId) {
        String boundUser;
        synchronized (lock) {
            if (find(contexts, contextId).isEmpty()) {
                LOGGER.warning(() -> "[rentdesk-sdk] set default rejected: unknown context " + contextId);
                return false;
            }
            boundUser = userId;
        }
        try {
            directory.setDefaultContext(boundUser, contextId);
        } catch (RentdeskException ex) {
            LOGGER.log(Level.WARNING, ex, () -> "[rentdesk-sdk] set default context " + contextId + " failed");
            return false;
        }
        refreshContexts();
        return true;
    }

    /**
     * Re-fetches the bound user's contexts. The active context keeps its id when it is still offered; otherwise the
     * default (or first) context takes over. A failed fetch changes nothing.
     */
    public List<UserContext> refreshContexts() {
        String boundUser;
        synchronized (lock) {
            boundUser = userId;
        }
        if (boundUser == null) {
            return List.of();
        }
        List<UserContext> fresh;
        try {
            fresh = sanitize(directory.loadContexts(boundUser));
        } catch (RentdeskException ex) {
            LOGGER.log(Level.WARNING, ex, () -> "[rentdesk-sdk] context reload failed; keeping current contexts");
            return getContexts();
        }

        UserContext resolved;
        boolean replaced;
        synchronized (lock) {
            if (!Objects.equals(boundUser, userId)) {
                // cleared or rebound while fetching
                return contexts;
            }
            String currentId = current == null ? null : current.contextId();
            UserContext kept = currentId == null ? null : find(fresh, currentId).orElse(null);
            replaced = kept == null;
            resolved = kept != null ? kept : fallback(fresh);
            contexts = fresh;
            current = resolved;
        }
        if (replaced) {
            persist(resolved);
        }
        return fresh;
    }

    /**
     * Forgets everything about the bound user. The persisted id is left to the session store.
     */
    public void clear() {
        synchronized (lock) {
            userId = null;
            contexts = List.of();
            current = null;
            switchTimes.clear();
        }
    }

    /**
     * @return committed switches within {@link #SWITCH_WINDOW}.
     */
    public int recentSwitchCount() {
        synchronized (lock) {
            pruneSwitchTimes(clock.instant());
            return switchTimes.size();
        }
    }

    public List<UserContext> getContexts() {
        synchronized (lock) {
            return contexts;
        }
    }

    public UserContext getCurrent() {
        synchronized (lock) {
            return current;
        }
    }

    public String getUserId() {
        synchronized (lock) {
            return userId;
        }
    }

    public boolean isSwitching() {
        return switching.get();
    }

    private void pruneSwitchTimes(Instant now) {
        Instant cutoff = now.minus(SWITCH_WINDOW);
        while (!switchTimes.isEmpty() && switchTimes.peekFirst().isBefore(cutoff)) {
            switchTimes.pollFirst();
        }
    }

    private void persist(UserContext context) {
        if (context == null) {
            idStore.clear();
        } else {
            idStore.save(context.contextId());
        }
    }

    private static UserContext fallback(List<UserContext> contexts) {
        for (UserContext context : contexts) {
            if (context.isDefault()) {
                return context;
            }
        }
        return contexts.isEmpty() ? null : contexts.get(0);
    }

    private static Optional<UserContext> find(List<UserContext> contexts, String contextId) {
        if (contextId == null) {
            return Optional.empty();
        }
        for (UserContext context : contexts) {
            if (contextId.equals(context.contextId())) {
                return Optional.of(context);
            }
        }
        return Optional.empty();
    }

    private static List<UserContext> sanitize(List<UserContext> contexts) {
        if (contexts == null) {
            return List.of();
        }
        List<UserContext> kept = new ArrayList<>();
        for (UserContext context : contexts) {
            if (context == null || context.contextId() == null || context.contextId().isBlank()) {
                continue;
            }
            kept.add(context);
        }
        return List.copyOf(kept);
    }
}
