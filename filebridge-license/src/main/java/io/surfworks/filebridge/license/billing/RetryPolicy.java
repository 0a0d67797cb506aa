package io.surfworks.filebridge.license.billing;

import java.time.Duration;

/**
 * Bounded retry with exponential backoff for applying webhook events.
 *
 * @param maxAttempts attempts before an event is parked
 * @param initialBackoff wait after the first failure
 * @param multiplier growth factor per further failure
 * @param maxBackoff upper bound on a single wait
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, double multiplier, Duration maxBackoff) {

    public static final RetryPolicy DEFAULT = new RetryPolicy(5, Duration.ofMillis(200), 2.0, Duration.ofSeconds(5));

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be at least 1.0");
        }
    }

    /**
     * Wait after the given failed attempt (1-based).
     */
    public Duration backoff(int attempt) {
        double millis = initialBackoff.toMillis() * Math.pow(multiplier, Math.max(0, attempt - 1));
        long capped = (long) Math.min(millis, maxBackoff.toMillis());
        return Duration.ofMillis(capped);
    }
}
