package com.walletd.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter for node calls, capped at {@code maxDelayMs}.
 */
public final class RetryPolicy {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;
    private final int maxAttempts;

    public RetryPolicy(long baseDelayMs, long maxDelayMs, double jitterFactor, int maxAttempts) {
        if (baseDelayMs < 0 || maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("Invalid delays: base=" + baseDelayMs + ", max=" + maxDelayMs);
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Delay before retrying after the given zero-based failed attempt: base * 2^attempt, capped, then jittered.
     */
    public long delayMs(int attempt) {
        long exponential = attempt <= 0 ? baseDelayMs : baseDelayMs * (1L << Math.min(attempt, 20));
        return jitter(Math.min(exponential, maxDelayMs));
    }

    private long jitter(long value) {
        double r = ThreadLocalRandom.current().nextDouble() * 2.0 - 1.0;
        return Math.max(0, (long) (value * (1.0 + r * jitterFactor)));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /** 250ms base, 5s cap, 20% jitter, 3 attempts. A sync cycle that still fails waits for the next trigger. */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(250L, 5_000L, 0.2, 3);
    }
}
