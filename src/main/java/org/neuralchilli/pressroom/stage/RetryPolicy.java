package org.neuralchilli.pressroom.stage;

import java.time.Duration;

/**
 * Attempt budget, backoff and per-attempt timeout of one stage.
 */
public record RetryPolicy(
        int maxAttempts,
        Duration initialBackoff,
        double multiplier,
        Duration maxBackoff,
        Duration timeout
) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("Max attempts must be >= 1");
        }
        if (initialBackoff == null || initialBackoff.isNegative()) {
            throw new IllegalArgumentException("Initial backoff must be zero or positive");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("Backoff multiplier must be >= 1.0");
        }
        if (maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("Max backoff must be >= initial backoff");
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("Timeout must be positive");
        }
    }

    /**
     * Delay after the given failed attempt: initial * multiplier^(attempt-1),
     * capped at the max backoff.
     */
    public Duration backoffAfter(int attempt) {
        double millis = initialBackoff.toMillis() * Math.pow(multiplier, attempt - 1);
        if (millis >= maxBackoff.toMillis()) {
            return maxBackoff;
        }
        return Duration.ofMillis((long) millis);
    }
}
