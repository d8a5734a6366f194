package com.whereq.roundhouse.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Backoff policy for failed callback deliveries
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetryPolicy {

    /**
     * Delivery attempts before a callback is abandoned, the first delivery included
     */
    @Builder.Default
    private int maxAttempts = 10;

    /**
     * Delay after the first failed delivery
     */
    @Builder.Default
    private Duration initialInterval = Duration.ofSeconds(5);

    /**
     * Backoff multiplier
     */
    @Builder.Default
    private double multiplier = 2.0;

    /**
     * Upper bound for a single delay
     */
    @Builder.Default
    private Duration maxInterval = Duration.ofMinutes(30);

    /**
     * Get default retry policy
     */
    public static RetryPolicy defaultPolicy() {
        return RetryPolicy.builder().build();
    }

    /**
     * Delay before the next delivery, given the number of attempts already made.
     * Grows exponentially from {@code initialInterval} and is capped at {@code maxInterval}.
     */
    public Duration backoffFor(int attemptsSoFar) {
        int exponent = Math.max(0, attemptsSoFar - 1);
        double millis = initialInterval.toMillis() * Math.pow(multiplier, exponent);
        long capped = (long) Math.min(millis, maxInterval.toMillis());
        return Duration.ofMillis(Math.max(1, capped));
    }

    public boolean isExhausted(int attemptsSoFar) {
        return attemptsSoFar >= maxAttempts;
    }
}
