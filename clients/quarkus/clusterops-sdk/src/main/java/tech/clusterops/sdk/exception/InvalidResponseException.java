package tech.clusterops.sdk.exception;

import tech.clusterops.sdk.resilience.ApiFailure;

/**
 * Response body could not be read as the expected shape.
 *
 * <p>Never retried: a malformed body on a successful status points at a version mismatch,
 * not a transient fault.
 */
public class InvalidResponseException extends ApiCallException {

    public InvalidResponseException(ApiFailure.InvalidBody failure, String endpoint, String method) {
        super(failure, endpoint, method, 1);
    }
}
