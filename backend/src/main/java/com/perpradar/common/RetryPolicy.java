package com.perpradar.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with optional jitter for upstream API retries.
 */
public final class RetryPolicy {

    private final long baseDelayMs;
    private final double jitterFactor;
    private final int maxAttempts;

    public RetryPolicy(long baseDelayMs, double jitterFactor, int maxAttempts) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        this.baseDelayMs = baseDelayMs;
        this.jitterFactor = jitterFactor;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Delay in milliseconds before retrying after the given zero-based attempt.
     * Formula: baseDelay * 2^attempt, then ±jitterFactor.
     */
    public long delayMs(int attempt) {
        if (attempt <= 0) {
            return jitter(baseDelayMs);
        }
        long exponential = baseDelayMs * (1L << Math.min(attempt, 20));
        return jitter(exponential);
    }

    private long jitter(long value) {
        if (jitterFactor <= 0) {
            return Math.max(0, value);
        }
        ThreadLocalRandom r = ThreadLocalRandom.current();
        double jitter = 1.0 + (r.nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (value * jitter));
    }

    /** Total number of calls, including the first one. */
    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Default: 1s base, no jitter, 3 attempts (1s, 2s between them).
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(1000L, 0.0, 3);
    }
}
