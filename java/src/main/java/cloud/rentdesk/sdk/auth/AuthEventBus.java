package cloud.rentdesk.sdk.auth;

import cloud.rentdesk.sdk.Subscription;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Synchronous channel for {@link SessionEvent}s. The session store publishes its own sign-in, refresh and
 * sign-out events here; identity-provider integrations may publish backend-initiated events as well.
 */
public final class AuthEventBus {

    private static final Logger LOGGER = Logger.getLogger(AuthEventBus.class.getName());

    private final List<Registration> registrations = new CopyOnWriteArrayList<>();

    public Subscription subscribe(Consumer<SessionEvent> listener) {
        Registration registration = new Registration(Objects.requireNonNull(listener, "listener"));
        registrations.add(registration);
        return registration;
    }

    public void publish(SessionEvent event) {
        Objects.requireNonNull(event, "event");
        for (Registration registration : registrations) {
            if (!registration.isActive()) {
                continue;
            }
            try {
                registration.listener.accept(event);
            } catch (RuntimeException ex) {
                LOGGER.log(Level.WARNING, ex, () -> "[rentdesk-sdk] auth event listener failed on " + event.type());
            }
        }
    }

    int listenerCount() {
        return registrations.size();
    }

    private final class Registration implements Subscription {
        private final Consumer<SessionEvent> listener;
        private final AtomicBoolean active = new AtomicBoolean(true);

        private Registration(Consumer<SessionEvent> listener) {
            this.listener = listener;
        }

        @Override
        public boolean isActive() {
            return active.get();
        }

        @Override
        public void close() {
            if (active.compareAndSet(true, false)) {
                registrations.remove(this);
            }
        }
    }
}
