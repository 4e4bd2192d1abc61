package tech.clusterops.sdk.resilience;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * Sealed interface representing the classified outcome of one failed attempt.
 *
 * <h2>Failure Types</h2>
 * <ul>
 *   <li>{@link Transport} - connection-level failure (retryable)</li>
 *   <li>{@link Timeout} - connect or response timeout (retryable)</li>
 *   <li>{@link Tls} - TLS handshake or certificate failure (not retryable)</li>
 *   <li>{@link HttpStatus} - error status code (429, 502, 503, 504 retryable; all others not)</li>
 *   <li>{@link InvalidBody} - body did not parse as the expected shape (not retryable)</li>
 *   <li>{@link Unexpected} - anything unclassified (not retryable)</li>
 * </ul>
 */
public sealed interface ApiFailure permits
    ApiFailure.Transport,
    ApiFailure.Timeout,
    ApiFailure.Tls,
    ApiFailure.HttpStatus,
    ApiFailure.InvalidBody,
    ApiFailure.Unexpected {

    ErrorCategory category();

    boolean isRetryable();

    /**
     * Human-readable description, safe to show to an operator.
     */
    String message();

    /**
     * HTTP status, when a response was received.
     */
    default OptionalInt status() {
        return OptionalInt.empty();
    }

    /**
     * Raw {@code Retry-After} header value, when the response carried one.
     */
    default Optional<String> retryAfter() {
        return Optional.empty();
    }

    /**
     * Underlying exception, or {@code null} for status-based failures.
     */
    default Throwable cause() {
        return null;
    }

    record Transport(Throwable cause) implements ApiFailure {
        @Override
        public ErrorCategory category() {
            return ErrorCategory.TRANSPORT;
        }

        @Override
        public boolean isRetryable() {
            return true;
        }

        @Override
        public String message() {
            return "Transport error: " + describe(cause);
        }
    }

    record Timeout(Throwable cause) implements ApiFailure {
        @Override
        public ErrorCategory category() {
            return ErrorCategory.TIMEOUT;
        }

        @Override
        public boolean isRetryable() {
            return true;
        }

        @Override
        public String message() {
            return "Request timed out: " + describe(cause);
        }
    }

    record Tls(Throwable cause) implements ApiFailure {
        @Override
        public ErrorCategory category() {
            return ErrorCategory.TLS;
        }

        @Override
        public boolean isRetryable() {
            return false;
        }

        @Override
        public String message() {
            return "TLS error: " + describe(cause);
        }
    }

    /**
     * Error status code returned by the server.
     *
     * @param statusCode       HTTP status
     * @param detail           condensed server message, or the status line when the body had none
     * @param retryAfterHeader raw {@code Retry-After} value (may be null)
     * @param requestId        server-assigned request id (may be null)
     */
    record HttpStatus(int statusCode, String detail, String retryAfterHeader, String requestId) implements ApiFailure {
        @Override
        public ErrorCategory category() {
            if (statusCode >= 400 && statusCode < 500) {
                return ErrorCategory.HTTP_4XX;
            }
            if (statusCode >= 500 && statusCode < 600) {
                return ErrorCategory.HTTP_5XX;
            }
            return ErrorCategory.API;
        }

        @Override
        public boolean isRetryable() {
            return ErrorClassifier.isRetryableStatus(statusCode);
        }

        @Override
        public String message() {
            return "HTTP " + statusCode + ": " + detail
                + (requestId != null ? " [Request ID: " + requestId + "]" : "");
        }

        @Override
        public OptionalInt status() {
            return OptionalInt.of(statusCode);
        }

        @Override
        public Optional<String> retryAfter() {
            return Optional.ofNullable(retryAfterHeader);
        }
    }

    /**
     * Response arrived but its body could not be read as the expected shape.
     */
    record InvalidBody(int statusCode, String detail, Throwable cause) implements ApiFailure {
        @Override
        public ErrorCategory category() {
            return ErrorCategory.UNKNOWN;
        }

        @Override
        public boolean isRetryable() {
            return false;
        }

        @Override
        public String message() {
            return "Invalid response body (HTTP " + statusCode + "): " + detail;
        }

        @Override
        public OptionalInt status() {
            return OptionalInt.of(statusCode);
        }
    }

    record Unexpected(Throwable cause) implements ApiFailure {
        @Override
        public ErrorCategory category() {
            return ErrorCategory.UNKNOWN;
        }

        @Override
        public boolean isRetryable() {
            return false;
        }

        @Override
        public String message() {
            return "Unexpected error: " + describe(cause);
        }
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
