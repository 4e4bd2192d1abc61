package tech.clusterops.sdk.exception;

import java.util.Map;

/**
 * Base exception for ClusterOps SDK errors.
 */
public class ClusterOpsException extends RuntimeException {

    private final int statusCode;
    private final Map<String, Object> context;

    public ClusterOpsException(String message) {
        this(message, 0, null, Map.of());
    }

    public ClusterOpsException(String message, int statusCode) {
        this(message, statusCode, null, Map.of());
    }

    public ClusterOpsException(String message, Throwable cause) {
        this(message, 0, cause, Map.of());
    }

    public ClusterOpsException(String message, int statusCode, Throwable cause, Map<String, Object> context) {
        super(message, cause);
        this.statusCode = statusCode;
        this.context = context != null ? context : Map.of();
    }

    /**
     * HTTP status associated with the failure, or 0 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }

    public Map<String, Object> getContext() {
        return context;
    }
}
