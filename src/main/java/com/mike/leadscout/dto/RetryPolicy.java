package com.mike.leadscout.dto;

/**
 * Bounded retry with exponential backoff: {@code maxRetries + 1} attempts in total,
 * waiting {@code initialBackoffMs * backoffMultiplier^i} before retry {@code i + 1}.
 */
public record RetryPolicy(int maxRetries, long initialBackoffMs, double backoffMultiplier) {

    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final long DEFAULT_INITIAL_BACKOFF_MS = 1000;
    public static final double DEFAULT_BACKOFF_MULTIPLIER = 2.0;

    public RetryPolicy {
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0, was " + maxRetries);
        if (initialBackoffMs < 0) throw new IllegalArgumentException("initialBackoffMs must be >= 0, was " + initialBackoffMs);
        if (Double.isNaN(backoffMultiplier) || backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1, was " + backoffMultiplier);
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_RETRIES, DEFAULT_INITIAL_BACKOFF_MS, DEFAULT_BACKOFF_MULTIPLIER);
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }
}
