package dao.bridge.relayer.util;

import lombok.extern.slf4j.Slf4j;

import java.util.function.IntToLongFunction;
import java.util.function.Supplier;

/**
 * Bounded retry with a pluggable delay function.
 * <p>
 * The delay after failed attempt {@code n} (1-based) is {@code delayMs.applyAsLong(n)}; no delay follows the last attempt.
 * Interruption while waiting stops retrying and restores the interrupt flag.
 */
@Slf4j
public final class RetryPolicy {

    private final int maxAttempts;
    private final IntToLongFunction delayMs;
    private final Sleeper sleeper;

    private RetryPolicy(int maxAttempts, IntToLongFunction delayMs, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.delayMs = delayMs;
        this.sleeper = sleeper;
    }

    /**
     * Pure exponential backoff: baseDelayMs * 2^attempt, no jitter, no cap.
     * With baseDelayMs = 1000 the waits are 2s, 4s, 8s, ...
     */
    public static RetryPolicy exponential(int maxAttempts, long baseDelayMs, Sleeper sleeper) {
        return new RetryPolicy(maxAttempts, attempt -> baseDelayMs * (1L << Math.min(attempt, 30)), sleeper);
    }

    public static RetryPolicy of(int maxAttempts, IntToLongFunction delayMs, Sleeper sleeper) {
        return new RetryPolicy(maxAttempts, delayMs, sleeper);
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public long delayAfterAttemptMs(int attempt) {
        return delayMs.applyAsLong(attempt);
    }

    /**
     * Run {@code action} until it returns or the attempts are exhausted.
     *
     * @param label used in log lines (e.g. "payout 0xab..")
     */
    public <T> Outcome<T> execute(String label, Supplier<T> action) {
        RuntimeException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return Outcome.success(action.get(), attempt);
            } catch (RuntimeException e) {
                last = e;
                log.warn("{} failed: attempt={}/{}, error={}", label, attempt, maxAttempts, e.getMessage());
            }

            if (attempt == maxAttempts) break;

            long waitMs = delayAfterAttemptMs(attempt);
            try {
                sleeper.sleep(waitMs);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                log.warn("{} retry interrupted after attempt {}", label, attempt);
                return Outcome.failure(last, attempt);
            }
        }
        return Outcome.failure(last, maxAttempts);
    }

    /**
     * Result of {@link #execute}: a value, or the last error once attempts ran out.
     */
    public record Outcome<T>(T value, RuntimeException lastError, int attempts) {

        static <T> Outcome<T> success(T value, int attempts) {
            return new Outcome<>(value, null, attempts);
        }

        static <T> Outcome<T> failure(RuntimeException lastError, int attempts) {
            return new Outcome<>(null, lastError, attempts);
        }

        public boolean succeeded() {
            return lastError == null;
        }
    }
}
