package com.tracechain.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter for ledger RPC retries, capped at {@code maxDelayMs}.
 */
public final class RetryPolicy {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;
    private final int maxAttempts;

    public RetryPolicy(long baseDelayMs, long maxDelayMs, double jitterFactor, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.baseDelayMs = Math.max(0, baseDelayMs);
        this.maxDelayMs = Math.max(this.baseDelayMs, maxDelayMs);
        this.jitterFactor = Math.max(0, Math.min(1, jitterFactor));
        this.maxAttempts = maxAttempts;
    }

    /**
     * Delay in milliseconds before the retry that follows the given zero-based attempt.
     * baseDelay * 2^attempt, capped, then jittered.
     */
    public long delayMs(int attempt) {
        long exponential = attempt <= 0 ? baseDelayMs : baseDelayMs * (1L << Math.min(attempt, 20));
        return jitter(Math.min(exponential, maxDelayMs));
    }

    private long jitter(long value) {
        if (jitterFactor == 0) {
            return value;
        }
        ThreadLocalRandom r = ThreadLocalRandom.current();
        double jitter = 1.0 + (r.nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (value * jitter));
    }

    /** Total attempts including the first call. */
    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Default: 500ms base, 8s cap, ±20% jitter, 3 attempts.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(500L, 8_000L, 0.2, 3);
    }

    /** Single attempt, no retry. Used for non-idempotent submissions. */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(0L, 0L, 0, 1);
    }
}
