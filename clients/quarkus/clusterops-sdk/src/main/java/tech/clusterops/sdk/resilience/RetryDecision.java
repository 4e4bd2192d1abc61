package tech.clusterops.sdk.resilience;

import java.time.Duration;

/**
 * Whether to re-issue a request, and how long to wait first.
 */
public record RetryDecision(boolean retry, Duration delay) {

    private static final RetryDecision STOP = new RetryDecision(false, Duration.ZERO);

    public static RetryDecision stop() {
        return STOP;
    }

    public static RetryDecision retryAfter(Duration delay) {
        return new RetryDecision(true, delay);
    }
}
