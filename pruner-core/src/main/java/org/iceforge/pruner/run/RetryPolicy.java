package org.iceforge.pruner.run;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounded exponential backoff used for listing pages and for each delete.
 *
 * @param maxAttempts    total attempts including the first one, at least 1
 * @param initialBackoff wait after the first failed attempt
 * @param multiplier     growth factor between consecutive waits, at least 1
 * @param maxBackoff     upper bound for a single wait
 */
public record RetryPolicy(
        int maxAttempts,
        Duration initialBackoff,
        double multiplier,
        Duration maxBackoff
) {
    public RetryPolicy {
        Objects.requireNonNull(initialBackoff, "initialBackoff");
        Objects.requireNonNull(maxBackoff, "maxBackoff");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (initialBackoff.isNegative() || maxBackoff.isNegative()) {
            throw new IllegalArgumentException("backoff durations must be non-negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(5, Duration.ofMillis(200), 2.0, Duration.ofSeconds(10));
    }

    public static RetryPolicy noRetries() {
        return new RetryPolicy(1, Duration.ZERO, 1.0, Duration.ZERO);
    }

    /**
     * Wait before the attempt following failed attempt number {@code failedAttempt} (1-based).
     */
    public Duration backoff(int failedAttempt) {
        double millis = initialBackoff.toMillis() * Math.pow(multiplier, Math.max(0, failedAttempt - 1));
        long capped = (long) Math.min(millis, (double) maxBackoff.toMillis());
        return Duration.ofMillis(capped);
    }
}
