package com.whereq.kiln.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Duration;

/**
 * Retry policy for failed build jobs
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetryPolicy implements Serializable {
    private static final long serialVersionUID = 1L;

    /**
     * Maximum number of attempts before a job is dead-lettered
     */
    @Builder.Default
    private int maxAttempts = 3;

    /**
     * Backoff before the first retry
     */
    @Builder.Default
    private Duration initialInterval = Duration.ofSeconds(5);

    /**
     * Backoff multiplier
     */
    @Builder.Default
    private int backoffMultiplier = 2;

    /**
     * Upper bound for a single backoff, null means unbounded
     */
    private Duration maxInterval;

    /**
     * Get default retry policy
     */
    public static RetryPolicy defaultPolicy() {
        return RetryPolicy.builder().build();
    }

    /**
     * Backoff to wait after the given number of failed attempts (1-based).
     *
     * @param attempts failed attempts so far, including the one just reported
     * @return delay before the job re-enters the queue
     */
    public Duration backoffFor(int attempts) {
        int exponent = Math.max(0, attempts - 1);
        double factor = Math.pow(backoffMultiplier, exponent);
        double millis = initialInterval.toMillis() * factor;
        long backoff = millis >= Long.MAX_VALUE ? Long.MAX_VALUE : (long) millis;
        if (maxInterval != null) {
            backoff = Math.min(backoff, maxInterval.toMillis());
        }
        return Duration.ofMillis(backoff);
    }
}
