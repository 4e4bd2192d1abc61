package tech.clusterops.sdk.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.clusterops.sdk.resilience.ErrorCategory;

import java.time.Duration;

/**
 * Micrometer recorder for API calls and transactions.
 *
 * <p>Every method is best-effort: a failure inside the metrics backend is logged at DEBUG and
 * dropped, so recording can never cause or mask an API failure.
 *
 * <p>Tags: {@code endpoint} (templated path), {@code method}, {@code status} and {@code category}.
 */
@ApplicationScoped
public class ApiMetrics {

    private static final Logger LOG = Logger.getLogger(ApiMetrics.class);

    public static final String REQUESTS = "clusterops.api.requests";
    public static final String RETRIES = "clusterops.api.retries";
    public static final String REQUEST_DURATION = "clusterops.api.request.duration";
    public static final String ERRORS = "clusterops.api.errors";
    public static final String FAILURES = "clusterops.api.failures";
    public static final String DESERIALIZATION_FAILURES = "clusterops.api.deserialization.failures";

    public static final String COMMIT_ATTEMPTS = "clusterops.transaction.commit.attempts";
    public static final String COMMIT_SUCCESSES = "clusterops.transaction.commit.successes";
    public static final String COMMIT_FAILURES = "clusterops.transaction.commit.failures";
    public static final String ROLLBACK_ATTEMPTS = "clusterops.transaction.rollback.attempts";
    public static final String ROLLBACK_FAILURES = "clusterops.transaction.rollback.failures";

    private final MeterRegistry meterRegistry;

    @Inject
    public ApiMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * Recorder backed by a private in-memory registry, for callers that do not export metrics.
     */
    public static ApiMetrics inMemory() {
        return new ApiMetrics(new SimpleMeterRegistry());
    }

    public MeterRegistry registry() {
        return meterRegistry;
    }

    public void recordRequest(String endpoint, String method) {
        increment(REQUESTS, "endpoint", endpoint, "method", method);
    }

    public void recordRetry(String endpoint, String method) {
        increment(RETRIES, "endpoint", endpoint, "method", method);
    }

    /**
     * @param status HTTP status, or {@code null} when no response arrived
     */
    public void recordDuration(String endpoint, String method, Duration duration, Integer status) {
        safely(() -> Timer.builder(REQUEST_DURATION)
            .tag("endpoint", endpoint)
            .tag("method", method)
            .tag("status", status != null ? String.valueOf(status) : "error")
            .register(meterRegistry)
            .record(duration));
    }

    /**
     * A call ended in failure (after any retries).
     */
    public void recordError(String endpoint, String method, ErrorCategory category) {
        increment(ERRORS, "endpoint", endpoint, "method", method, "category", category.label());
    }

    /**
     * A single attempt was classified as failed.
     */
    public void recordFailure(String endpoint, String method, ErrorCategory category) {
        increment(FAILURES, "endpoint", endpoint, "method", method, "category", category.label());
    }

    public void recordDeserializationFailure(String endpoint, String method) {
        increment(DESERIALIZATION_FAILURES, "endpoint", endpoint, "method", method);
    }

    public void recordTransaction(String metric) {
        recordTransaction(metric, 1);
    }

    public void recordTransaction(String metric, int amount) {
        safely(() -> meterRegistry.counter(metric).increment(amount));
    }

    private void increment(String name, String... tags) {
        safely(() -> Counter.builder(name)
            .tags(tags)
            .register(meterRegistry)
            .increment());
    }

    private void safely(Runnable recording) {
        try {
            recording.run();
        } catch (RuntimeException e) {
            LOG.debugf(e, "Dropping metric update after recorder failure");
        }
    }
}
