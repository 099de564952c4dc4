package cloud.rentdesk.sdk.internal;

import java.time.Duration;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with additive jitter: {@code delay = min(cap, base * 2^attempt)}, plus a uniform random
 * share of up to half that delay. Attempts are zero-indexed; attempts {@code 0..maxAttempts-1} yield a delay and
 * attempt {@code maxAttempts} is terminal.
 */
public final class RetryPolicy {

    private final int maxAttempts;
    private final long baseDelayMillis;
    private final long maxDelayMillis;
    private final DoubleSupplier random;

    public RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay) {
        this(maxAttempts, baseDelay, maxDelay, () -> ThreadLocalRandom.current().nextDouble());
    }

    public RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay, DoubleSupplier random) {
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts cannot be negative");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelayMillis = Objects.requireNonNull(baseDelay, "baseDelay").toMillis();
        this.maxDelayMillis = Objects.requireNonNull(maxDelay, "maxDelay").toMillis();
        this.random = Objects.requireNonNull(random, "random");
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public boolean canRetry(int attempt) {
        return attempt >= 0 && attempt < maxAttempts;
    }

    /**
     * Delay before retrying after the given failed attempt, or empty when the attempt ceiling is reached.
     */
    public OptionalLong delayFor(int attempt) {
        if (!canRetry(attempt)) {
            return OptionalLong.empty();
        }
        long capped = cappedDelay(attempt);
        double jitter = random.getAsDouble() * capped * 0.5;
        return OptionalLong.of((long) Math.floor(capped + jitter));
    }

    /**
     * Deterministic part of the delay; the jittered delay never exceeds one and a half times this value.
     */
    public long cappedDelay(int attempt) {
        if (attempt >= 62) {
            return maxDelayMillis;
        }
        long factor = 1L << attempt;
        if (baseDelayMillis > 0 && factor > maxDelayMillis / baseDelayMillis) {
            return maxDelayMillis;
        }
        return Math.min(maxDelayMillis, baseDelayMillis * factor);
    }
}
