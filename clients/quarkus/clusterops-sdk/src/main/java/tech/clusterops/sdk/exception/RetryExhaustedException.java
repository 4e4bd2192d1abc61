package tech.clusterops.sdk.exception;

import tech.clusterops.sdk.resilience.ApiFailure;

import java.util.Map;

/**
 * Every attempt of a call failed with a retryable error and the retry budget is spent.
 */
public class RetryExhaustedException extends ClusterOpsException {

    private final int attempts;
    private final ApiFailure lastFailure;
    private final String endpoint;

    public RetryExhaustedException(String endpoint, String method, int attempts, ApiFailure lastFailure) {
        super(String.format("%s %s gave up after %d attempt(s): %s",
                method, endpoint, attempts, lastFailure.message()),
            lastFailure.status().orElse(0), lastFailure.cause(),
            Map.of("endpoint", endpoint, "method", method, "attempts", attempts,
                "category", lastFailure.category().label()));
        this.attempts = attempts;
        this.lastFailure = lastFailure;
        this.endpoint = endpoint;
    }

    public int getAttempts() {
        return attempts;
    }

    public ApiFailure getLastFailure() {
        return lastFailure;
    }

    public String getEndpoint() {
        return endpoint;
    }
}
