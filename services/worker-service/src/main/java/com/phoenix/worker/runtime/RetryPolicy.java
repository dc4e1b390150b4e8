package com.phoenix.worker.runtime;

import java.time.Duration;

public record RetryPolicy(
    int maxAttempts,
    Duration timeout,
    Duration initialBackoff,
    double backoffMultiplier,
    Duration maxBackoff
) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
    }

    /**
     * Delay before the attempt following {@code failedAttempt} (1-based).
     */
    public Duration backoffAfter(int failedAttempt) {
        double millis = initialBackoff.toMillis() * Math.pow(backoffMultiplier, failedAttempt - 1);
        return Duration.ofMillis((long) Math.min(millis, maxBackoff.toMillis()));
    }
}
