package com.vestpod.common;

/**
 * Exponential backoff for provider retries: initialDelay * multiplier^attempt.
 */
public final class RetryPolicy {

    private final long initialDelayMs;
    private final double multiplier;
    private final int maxRetries;

    public RetryPolicy(long initialDelayMs, double multiplier, int maxRetries) {
        if (initialDelayMs < 0) {
            throw new IllegalArgumentException("initialDelayMs must not be negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        this.initialDelayMs = initialDelayMs;
        this.multiplier = multiplier;
        this.maxRetries = maxRetries;
    }

    /**
     * Delay in milliseconds after the given zero-based failed attempt.
     */
    public long delayMs(int attempt) {
        if (attempt <= 0) {
            return initialDelayMs;
        }
        double exponential = initialDelayMs * Math.pow(multiplier, Math.min(attempt, 30));
        return exponential >= Long.MAX_VALUE ? Long.MAX_VALUE : (long) Math.ceil(exponential);
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    /** Retries plus the initial call. */
    public int getMaxAttempts() {
        return maxRetries + 1;
    }

    /**
     * Default: 1s initial delay, doubling, 3 retries (4 attempts).
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(1000L, 2.0, 3);
    }
}
