package tech.clusterops.sdk.resilience;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import tech.clusterops.sdk.metrics.ApiMetrics;

import javax.net.ssl.SSLException;
import java.io.IOException;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.channels.UnresolvedAddressException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Maps raw failures (transport exceptions, error responses, unreadable bodies) onto
 * {@link ApiFailure} and counts each one under {@code clusterops.api.failures}.
 */
public class ErrorClassifier {

    private static final int MAX_DETAIL_LENGTH = 200;

    private final ApiMetrics metrics;
    private final ObjectMapper objectMapper;

    public ErrorClassifier(ApiMetrics metrics, ObjectMapper objectMapper) {
        this.metrics = metrics;
        this.objectMapper = objectMapper;
    }

    /**
     * Retryable statuses: 429 Too Many Requests and the transient gateway errors 502, 503, 504.
     * 500 and 501 usually mean a server bug or unsupported call and fail immediately.
     */
    public static boolean isRetryableStatus(int status) {
        return status == 429 || status == 502 || status == 503 || status == 504;
    }

    /**
     * Classify an exception raised while sending a request or awaiting its response.
     */
    public ApiFailure classify(Throwable error, String endpoint, String method) {
        ApiFailure failure = classifyThrowable(unwrap(error));
        metrics.recordFailure(endpoint, method, failure.category());
        return failure;
    }

    /**
     * Classify a response whose status is not 2xx.
     */
    public ApiFailure classify(HttpResponse<String> response, String endpoint, String method) {
        ApiFailure failure = new ApiFailure.HttpStatus(
            response.statusCode(),
            extractDetail(response.statusCode(), response.body()),
            response.headers().firstValue("Retry-After").orElse(null),
            response.headers().firstValue("X-Request-Id").orElse(null)
        );
        metrics.recordFailure(endpoint, method, failure.category());
        return failure;
    }

    /**
     * Classify a body that failed to parse. Always fatal, whatever the status.
     */
    public ApiFailure.InvalidBody classifyInvalidBody(int status, Throwable error, String endpoint, String method) {
        var failure = new ApiFailure.InvalidBody(status,
            error.getMessage() != null ? truncate(error.getMessage()) : error.getClass().getSimpleName(),
            error);
        metrics.recordFailure(endpoint, method, failure.category());
        metrics.recordDeserializationFailure(endpoint, method);
        return failure;
    }

    private ApiFailure classifyThrowable(Throwable error) {
        List<Throwable> chain = causeChain(error);
        for (Throwable t : chain) {
            if (t instanceof SSLException) {
                return new ApiFailure.Tls(error);
            }
        }
        for (Throwable t : chain) {
            if (t instanceof HttpTimeoutException) {
                return new ApiFailure.Timeout(error);
            }
        }
        for (Throwable t : chain) {
            if (t instanceof IOException || t instanceof UnresolvedAddressException) {
                return new ApiFailure.Transport(error);
            }
        }
        return new ApiFailure.Unexpected(error);
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static List<Throwable> causeChain(Throwable error) {
        List<Throwable> chain = new ArrayList<>();
        Throwable current = error;
        while (current != null && !chain.contains(current)) {
            chain.add(current);
            current = current.getCause();
        }
        return chain;
    }

    /**
     * Condense a {"messages":[{"type":..,"text":..}]} error body into "TYPE: text; ...",
     * falling back to the raw body and then to the bare status.
     */
    private String extractDetail(int status, String body) {
        if (body == null || body.isBlank()) {
            return "status " + status;
        }
        try {
            JsonNode messages = objectMapper.readTree(body).path("messages");
            if (messages.isArray() && !messages.isEmpty()) {
                List<String> parts = new ArrayList<>();
                for (JsonNode message : messages) {
                    parts.add(message.path("type").asText("ERROR") + ": " + message.path("text").asText(""));
                }
                return truncate(String.join("; ", parts));
            }
        } catch (IOException e) {
            return truncate(body.strip());
        }
        return truncate(body.strip());
    }

    private static String truncate(String s) {
        return s.length() <= MAX_DETAIL_LENGTH ? s : s.substring(0, MAX_DETAIL_LENGTH) + "...";
    }
}
