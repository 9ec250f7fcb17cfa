package io.sokrates.config;

import io.sokrates.retry.RetryPolicy;

/**
 * Daemon and retry tuning. The poll interval trades pickup latency for idle database reads.
 */
public record QueueSettings(
        long pollIntervalMs,
        long leaseTimeoutMs,
        long reclaimIntervalMs,
        long stopTimeoutMs,
        int defaultMaxAttempts,
        long baseBackoffMs,
        long maxBackoffMs,
        long jitterMs,
        int retentionDays
) {
    public QueueSettings {
        if (pollIntervalMs < 10L) {
            throw new IllegalArgumentException("pollIntervalMs must be >= 10, got " + pollIntervalMs);
        }
        if (leaseTimeoutMs < 1_000L) {
            throw new IllegalArgumentException("leaseTimeoutMs must be >= 1000, got " + leaseTimeoutMs);
        }
        if (defaultMaxAttempts < 1) {
            throw new IllegalArgumentException("defaultMaxAttempts must be >= 1, got " + defaultMaxAttempts);
        }
        reclaimIntervalMs = Math.max(1_000L, reclaimIntervalMs);
        stopTimeoutMs = Math.max(1_000L, stopTimeoutMs);
        retentionDays = Math.max(0, retentionDays);
    }

    public static QueueSettings defaults() {
        return new QueueSettings(
                SokratesConfig.DEFAULT_POLL_INTERVAL_MS,
                SokratesConfig.DEFAULT_LEASE_TIMEOUT_MS,
                SokratesConfig.DEFAULT_RECLAIM_INTERVAL_MS,
                SokratesConfig.DEFAULT_STOP_TIMEOUT_MS,
                SokratesConfig.DEFAULT_MAX_ATTEMPTS,
                SokratesConfig.DEFAULT_BASE_BACKOFF_MS,
                SokratesConfig.DEFAULT_MAX_BACKOFF_MS,
                SokratesConfig.DEFAULT_JITTER_MS,
                0
        );
    }

    public RetryPolicy retryPolicy() {
        return new RetryPolicy(defaultMaxAttempts, baseBackoffMs, maxBackoffMs, jitterMs);
    }

    public QueueSettings withPollIntervalMs(long value) {
        return new QueueSettings(value, leaseTimeoutMs, reclaimIntervalMs, stopTimeoutMs,
                defaultMaxAttempts, baseBackoffMs, maxBackoffMs, jitterMs, retentionDays);
    }

    public QueueSettings withBackoff(long baseMs, long maxMs, long jitter) {
        return new QueueSettings(pollIntervalMs, leaseTimeoutMs, reclaimIntervalMs, stopTimeoutMs,
                defaultMaxAttempts, baseMs, maxMs, jitter, retentionDays);
    }

    public QueueSettings withLeaseTimeoutMs(long value) {
        return new QueueSettings(pollIntervalMs, value, reclaimIntervalMs, stopTimeoutMs,
                defaultMaxAttempts, baseBackoffMs, maxBackoffMs, jitterMs, retentionDays);
    }
}
