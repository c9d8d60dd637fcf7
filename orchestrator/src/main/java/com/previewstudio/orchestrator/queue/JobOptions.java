package com.previewstudio.orchestrator.queue;

import com.previewstudio.orchestrator.config.QueueProperties;

import java.time.Duration;

/**
 * Per-entry retry settings. Backoff is exponential:
 * attempt n waits {@code backoffDelay * 2^(n-1)} before it is claimable again.
 */
public record JobOptions(int attempts, Duration backoffDelay) {

    public JobOptions {
        if (attempts < 1) throw new IllegalArgumentException("attempts must be >= 1, got " + attempts);
        if (backoffDelay == null || backoffDelay.isNegative()) backoffDelay = Duration.ZERO;
    }

    public static JobOptions defaults(QueueProperties properties) {
        return new JobOptions(properties.getAttempts(), properties.getBackoffDelay());
    }

    /** Delay before retry number {@code attemptsMade} + 1. */
    public static Duration backoffFor(long baseDelayMs, int attemptsMade) {
        int exponent = Math.max(0, Math.min(attemptsMade - 1, 20));
        return Duration.ofMillis(baseDelayMs * (1L << exponent));
    }
}
