package com.chaincustody.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with optional jitter and an upper bound on the delay.
 * Used for node RPC retries and for the deposit monitor's error backoff.
 */
public final class RetryPolicy {

    private final long baseDelayMs;
    private final double jitterFactor;
    private final int maxAttempts;
    private final long maxDelayMs;

    public RetryPolicy(long baseDelayMs, double jitterFactor, int maxAttempts) {
        this(baseDelayMs, jitterFactor, maxAttempts, Long.MAX_VALUE);
    }

    public RetryPolicy(long baseDelayMs, double jitterFactor, int maxAttempts, long maxDelayMs) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        this.baseDelayMs = baseDelayMs;
        this.jitterFactor = jitterFactor;
        this.maxAttempts = maxAttempts;
        this.maxDelayMs = maxDelayMs;
    }

    /**
     * Delay in milliseconds for the given zero-based attempt.
     * Formula: min(baseDelay * 2^attempt, maxDelay), then ±jitter.
     */
    public long delayMs(int attempt) {
        if (attempt <= 0) {
            return jitter(Math.min(baseDelayMs, maxDelayMs));
        }
        long exponential = baseDelayMs * (1L << Math.min(attempt, 20));
        return jitter(Math.min(exponential, maxDelayMs));
    }

    private long jitter(long value) {
        if (jitterFactor <= 0) {
            return Math.max(0, value);
        }
        ThreadLocalRandom r = ThreadLocalRandom.current();
        double jitter = 1.0 + (r.nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (value * jitter));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    /**
     * Default: 1s base, ±20% jitter, 5 max attempts.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(1000L, 0.2, 5);
    }
}
