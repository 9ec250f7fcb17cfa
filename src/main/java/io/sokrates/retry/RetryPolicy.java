package io.sokrates.retry;

import java.util.function.LongUnaryOperator;

/**
 * Exponential backoff: {@code min(base * 2^(attempts-1), cap)}, optionally plus up to {@code jitterMs}
 * of random spread so tasks that failed together do not retry together.
 *
 * <p>Pure and stateless; the caller supplies the randomness.
 */
public record RetryPolicy(int maxAttempts, long baseBackoffMs, long maxBackoffMs, long jitterMs) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        if (baseBackoffMs < 0 || maxBackoffMs < 0 || jitterMs < 0) {
            throw new IllegalArgumentException("backoff values must not be negative");
        }
        if (maxBackoffMs < baseBackoffMs) {
            throw new IllegalArgumentException("maxBackoffMs must be >= baseBackoffMs");
        }
    }

    /**
     * Delay before the retry that follows {@code attempts} executions (1-based).
     */
    public long delayMs(int attempts) {
        long backoff = baseBackoffMs;
        for (int i = 1; i < attempts; i++) {
            if (backoff > maxBackoffMs / 2L) {
                return maxBackoffMs;
            }
            backoff *= 2L;
        }
        return Math.min(backoff, maxBackoffMs);
    }

    /**
     * @param jitterSource maps an exclusive upper bound to a value in {@code [0, bound)}
     */
    public long delayMs(int attempts, LongUnaryOperator jitterSource) {
        long delay = delayMs(attempts);
        if (jitterMs <= 0L || jitterSource == null) {
            return delay;
        }
        long jitter = Math.max(0L, Math.min(jitterMs, jitterSource.applyAsLong(jitterMs + 1L)));
        return Math.min(maxBackoffMs, delay + jitter);
    }

    public boolean allowsRetryAfter(int attempts) {
        return attempts < maxAttempts;
    }

    public RetryPolicy withMaxAttempts(int value) {
        return new RetryPolicy(value, baseBackoffMs, maxBackoffMs, jitterMs);
    }
}
