package io.opsmesh.bridge;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with symmetric jitter. Attempt 1 is immediate; attempt {@code n > 1}
 * waits {@code base x 2^(n-2)} plus or minus up to {@code jitterMs}, never more than
 * {@code maxDelayMs}.
 */
public record RetryPolicy(int maxAttempts, long baseDelayMs, long maxDelayMs, long jitterMs) {
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_BASE_DELAY_MS = 1_000L;
    public static final long DEFAULT_MAX_DELAY_MS = 60_000L;
    public static final long DEFAULT_JITTER_MS = 250L;

    public RetryPolicy {
        maxAttempts = Math.max(1, maxAttempts);
        baseDelayMs = Math.max(0L, baseDelayMs);
        maxDelayMs = Math.max(baseDelayMs, maxDelayMs);
        jitterMs = Math.max(0L, jitterMs);
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_BASE_DELAY_MS, DEFAULT_MAX_DELAY_MS, DEFAULT_JITTER_MS);
    }

    public long delayBeforeAttempt(int attempt) {
        if (attempt <= 1) {
            return 0L;
        }
        long backoff = baseDelayMs;
        for (int i = 2; i < attempt; i++) {
            if (backoff >= maxDelayMs / 2L) {
                backoff = maxDelayMs;
                break;
            }
            backoff *= 2L;
        }
        backoff = Math.min(backoff, maxDelayMs);
        long jitter = jitterMs == 0L ? 0L : ThreadLocalRandom.current().nextLong(-jitterMs, jitterMs + 1L);
        return Math.max(0L, Math.min(maxDelayMs, backoff + jitter));
    }

    public boolean hasAttemptAfter(int attempt) {
        return attempt < maxAttempts;
    }
}
