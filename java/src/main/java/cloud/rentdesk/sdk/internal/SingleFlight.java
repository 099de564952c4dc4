package cloud.rentdesk.sdk.internal;

import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Coalesces concurrent calls into one underlying operation. The first caller starts the operation; callers
 * arriving while it is in flight receive the same future. The slot is released once the future completes, so the
 * next call after completion starts a fresh operation.
 */
public final class SingleFlight<T> {

    private final Object lock = new Object();
    private CompletableFuture<T> inFlight;

    public CompletableFuture<T> run(Supplier<CompletableFuture<T>> operation) {
        CompletableFuture<T> promise;
        synchronized (lock) {
            if (inFlight != null) {
                return inFlight;
            }
            promise = new CompletableFuture<>();
            inFlight = promise;
        }

        CompletableFuture<T> started;
        try {
            started = operation.get();
        } catch (RuntimeException ex) {
            started = CompletableFuture.failedFuture(ex);
        }
        started.whenComplete((value, error) -> {
            synchronized (lock) {
                if (inFlight == promise) {
                    inFlight = null;
                }
            }
            if (error != null) {
                promise.completeExceptionally(error);
            } else {
                promise.complete(value);
            }
        });
        return promise;
    }

    public boolean isInFlight() {
        synchronized (lock) {
            return inFlight != null;
        }
    }

    /**
     * Forgets the in-flight operation so the next call starts afresh. Callers already holding the future still
     * receive its result.
     */
    public void reset() {
        synchronized (lock) {
            inFlight = null;
        }
    }
}
