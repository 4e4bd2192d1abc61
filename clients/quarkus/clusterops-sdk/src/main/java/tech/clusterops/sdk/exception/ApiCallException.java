package tech.clusterops.sdk.exception;

import tech.clusterops.sdk.resilience.ApiFailure;
import tech.clusterops.sdk.resilience.ErrorCategory;

import java.util.Map;

/**
 * A classified API failure that was not retried: the request failed outright.
 *
 * <p>Compare with {@link RetryExhaustedException}, which signals that the failure was
 * transient but the retry budget ran out.
 */
public class ApiCallException extends ClusterOpsException {

    private final ApiFailure failure;
    private final String endpoint;
    private final String method;
    private final int attempts;

    public ApiCallException(ApiFailure failure, String endpoint, String method, int attempts) {
        super(method + " " + endpoint + " failed: " + failure.message(),
            failure.status().orElse(0), failure.cause(),
            Map.of("endpoint", endpoint, "method", method, "category", failure.category().label(),
                "attempts", attempts));
        this.failure = failure;
        this.endpoint = endpoint;
        this.method = method;
        this.attempts = attempts;
    }

    public ApiFailure getFailure() {
        return failure;
    }

    public ErrorCategory getCategory() {
        return failure.category();
    }

    public String getEndpoint() {
        return endpoint;
    }

    public String getMethod() {
        return method;
    }

    public int getAttempts() {
        return attempts;
    }

    /**
     * Whether the server rejected the credential (HTTP 401 or 403).
     */
    public boolean isAuthRejection() {
        int status = getStatusCode();
        return status == 401 || status == 403;
    }
}
