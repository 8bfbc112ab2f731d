package com.clapgrow.channels.common.retry;

/**
 * Bounded exponential backoff.
 *
 * <p>{@code maxRetries == 0} together with {@code shouldRetry == true} means the caller
 * retries indefinitely; the delay still never exceeds {@code maxDelayMs}.
 *
 * @param shouldRetry       whether a failure is retried at all
 * @param initialDelayMs    delay before the first retry
 * @param maxDelayMs        upper bound for any single delay
 * @param backoffMultiplier growth factor between consecutive delays
 * @param maxRetries        retry budget, 0 for unlimited
 * @param jitterRatio       fraction of the delay randomised in both directions (0.2 = +/-20%)
 */
public record RetryPolicy(
    boolean shouldRetry,
    long initialDelayMs,
    long maxDelayMs,
    double backoffMultiplier,
    int maxRetries,
    double jitterRatio
) {

    public RetryPolicy {
        if (initialDelayMs < 0 || maxDelayMs < 0) {
            throw new IllegalArgumentException("Delays must not be negative");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("Backoff multiplier must be >= 1.0");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("Max retries must not be negative");
        }
        if (jitterRatio < 0.0 || jitterRatio >= 1.0) {
            throw new IllegalArgumentException("Jitter ratio must be in [0, 1)");
        }
    }

    /**
     * No retry policy (permanent failures).
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(false, 0, 0, 1.0, 0, 0.0);
    }

    /**
     * Standard policy for short-lived transient failures such as store writes.
     */
    public static RetryPolicy standard() {
        return new RetryPolicy(true, 200, 5_000, 2.0, 3, 0.0);
    }

    /**
     * Reconnect policy: 1s, 2s, 4s ... capped at 60s with 20% jitter, unlimited attempts.
     */
    public static RetryPolicy reconnect() {
        return new RetryPolicy(true, 1_000, 60_000, 2.0, 0, 0.2);
    }

    public boolean isUnlimited() {
        return shouldRetry && maxRetries == 0;
    }

    /**
     * Whether another retry is allowed after {@code attempt} retries have already been made.
     */
    public boolean allowsAttempt(int attempt) {
        return shouldRetry && (maxRetries == 0 || attempt <= maxRetries);
    }

    /**
     * Delay before retry number {@code attempt} (1-based) without jitter.
     */
    public long baseDelayMs(int attempt) {
        if (!shouldRetry || attempt < 1) {
            return 0;
        }
        double delay = initialDelayMs * Math.pow(backoffMultiplier, attempt - 1);
        if (Double.isInfinite(delay) || delay > maxDelayMs) {
            return maxDelayMs;
        }
        return (long) delay;
    }

    /**
     * Delay before retry number {@code attempt} with jitter applied.
     *
     * @param random a value in [0, 1), normally {@code ThreadLocalRandom.current().nextDouble()}
     */
    public long delayMs(int attempt, double random) {
        long base = baseDelayMs(attempt);
        if (jitterRatio == 0.0 || base == 0) {
            return base;
        }
        double factor = 1.0 + jitterRatio * (2.0 * random - 1.0);
        return Math.min(maxDelayMs, Math.max(0L, Math.round(base * factor)));
    }
}
