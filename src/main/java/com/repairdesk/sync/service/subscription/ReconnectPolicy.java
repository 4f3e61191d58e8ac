package com.repairdesk.sync.service.subscription;

import io.github.resilience4j.core.IntervalFunction;

import java.time.Duration;

/**
 * Exponential backoff with bounded jitter and a capped interval.
 *
 * @param name        label used in logs
 * @param intervals   delay per attempt, attempts counted from 1
 * @param maxAttempts attempts allowed before giving up, 0 for unlimited
 */
public record ReconnectPolicy(String name, IntervalFunction intervals, int maxAttempts) {

    public static ReconnectPolicy exponential(String name, Duration initial, double multiplier,
                                              double jitter, Duration max, int maxAttempts) {
        IntervalFunction intervals = IntervalFunction.ofExponentialRandomBackoff(
                initial.toMillis(), multiplier, jitter, max.toMillis());
        return new ReconnectPolicy(name, intervals, maxAttempts);
    }

    /**
     * Fixed delay, for tests.
     */
    public static ReconnectPolicy fixed(String name, Duration delay, int maxAttempts) {
        return new ReconnectPolicy(name, IntervalFunction.of(delay.toMillis()), maxAttempts);
    }

    public Duration delayFor(int attempt) {
        return Duration.ofMillis(intervals.apply(Math.max(1, attempt)));
    }

    public boolean allowsAttempt(int attempt) {
        return maxAttempts <= 0 || attempt <= maxAttempts;
    }
}
