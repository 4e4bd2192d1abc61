package tech.clusterops.sdk.resilience;

import org.jboss.logging.Logger;
import tech.clusterops.sdk.exception.ApiCallException;
import tech.clusterops.sdk.exception.RetryExhaustedException;
import tech.clusterops.sdk.metrics.ApiMetrics;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Runs one logical API call as a sequence of attempts.
 *
 * <p>Each attempt is sent with {@link HttpClient#sendAsync}; failures are classified by the
 * {@link ErrorClassifier}, and retryable ones are re-issued after the wait chosen by the
 * {@link RetryScheduler}. Waits go through a {@link Delayer}, so no thread sleeps.
 *
 * <p>The returned future completes with:
 * <ul>
 *   <li>the 2xx response; the caller deserializes it</li>
 *   <li>{@link ApiCallException} for a non-retryable failure</li>
 *   <li>{@link RetryExhaustedException} once {@code maxRetries + 1} attempts have failed</li>
 * </ul>
 * Cancelling the returned future aborts the call: an in-flight attempt or wait is cancelled and
 * no further attempt is made.
 */
public class ResilientExecutor {

    private static final Logger LOG = Logger.getLogger(ResilientExecutor.class);

    private final HttpClient httpClient;
    private final ErrorClassifier classifier;
    private final RetryScheduler scheduler;
    private final Delayer delayer;
    private final ApiMetrics metrics;

    public ResilientExecutor(HttpClient httpClient, ErrorClassifier classifier, RetryScheduler scheduler,
                             Delayer delayer, ApiMetrics metrics) {
        this.httpClient = httpClient;
        this.classifier = classifier;
        this.scheduler = scheduler;
        this.delayer = delayer;
        this.metrics = metrics;
    }

    /**
     * Execute a call.
     *
     * @param request    builds a fresh request for every attempt
     * @param endpoint   templated endpoint label, e.g. {@code /services/data/indexes/{name}}
     * @param method     HTTP method label
     * @param maxRetries retries allowed after the first attempt
     */
    public CompletableFuture<HttpResponse<String>> execute(Supplier<HttpRequest> request, String endpoint,
                                                           String method, int maxRetries) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative, got " + maxRetries);
        }
        Call call = new Call(request, endpoint, method, maxRetries);
        call.attempt(1);
        return call.result;
    }

    public ErrorClassifier classifier() {
        return classifier;
    }

    private final class Call {

        final CompletableFuture<HttpResponse<String>> result = new CompletableFuture<>();
        final Supplier<HttpRequest> request;
        final String endpoint;
        final String method;
        final int maxRetries;
        volatile CompletableFuture<?> inFlight;

        Call(Supplier<HttpRequest> request, String endpoint, String method, int maxRetries) {
            this.request = request;
            this.endpoint = endpoint;
            this.method = method;
            this.maxRetries = maxRetries;
            result.whenComplete((response, error) -> {
                CompletableFuture<?> pending = inFlight;
                if (result.isCancelled() && pending != null) {
                    LOG.debugf("%s %s cancelled by caller", method, endpoint);
                    pending.cancel(true);
                }
            });
        }

        void attempt(int ordinal) {
            if (result.isDone()) {
                return;
            }
            metrics.recordRequest(endpoint, method);
            if (ordinal > 1) {
                metrics.recordRetry(endpoint, method);
            }

            HttpRequest httpRequest;
            try {
                httpRequest = request.get();
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
                return;
            }

            long started = System.nanoTime();
            CompletableFuture<HttpResponse<String>> sent =
                httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString());
            inFlight = sent;
            if (result.isCancelled()) {
                sent.cancel(true);
                return;
            }
            sent.whenComplete((response, error) -> {
                Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
                if (result.isDone()) {
                    return;
                }
                if (error != null) {
                    metrics.recordDuration(endpoint, method, elapsed, null);
                    ApiFailure failure;
                    try {
                        failure = classifier.classify(error, endpoint, method);
                    } catch (RuntimeException e) {
                        result.completeExceptionally(e);
                        return;
                    }
                    onFailure(ordinal, failure);
                    return;
                }
                int status = response.statusCode();
                metrics.recordDuration(endpoint, method, elapsed, status);
                if (status >= 200 && status < 300) {
                    if (ordinal > 1) {
                        LOG.debugf("%s %s succeeded on attempt %d", method, endpoint, ordinal);
                    }
                    result.complete(response);
                } else {
                    ApiFailure failure;
                    try {
                        failure = classifier.classify(response, endpoint, method);
                    } catch (RuntimeException e) {
                        result.completeExceptionally(e);
                        return;
                    }
                    onFailure(ordinal, failure);
                }
            });
        }

        void onFailure(int ordinal, ApiFailure failure) {
            try {
                retryOrGiveUp(ordinal, failure);
            } catch (RuntimeException e) {
                LOG.errorf(e, "%s %s failed while scheduling attempt %d", method, endpoint, ordinal + 1);
                result.completeExceptionally(e);
            }
        }

        void retryOrGiveUp(int ordinal, ApiFailure failure) {
            RetryDecision decision = scheduler.decide(ordinal, failure, maxRetries);
            if (decision.retry()) {
                LOG.debugf("%s %s attempt %d/%d failed (%s), retrying in %s",
                    method, endpoint, ordinal, maxRetries + 1, failure.message(), decision.delay());
                CompletableFuture<Void> wait = delayer.delay(decision.delay());
                inFlight = wait;
                if (result.isCancelled()) {
                    wait.cancel(true);
                    return;
                }
                wait.whenComplete((ignored, error) -> {
                    if (error == null) {
                        attempt(ordinal + 1);
                    } else if (!result.isDone()) {
                        result.completeExceptionally(error);
                    }
                });
                return;
            }

            metrics.recordError(endpoint, method, failure.category());
            if (failure.isRetryable()) {
                LOG.warnf("%s %s gave up after %d attempt(s): %s", method, endpoint, ordinal, failure.message());
                result.completeExceptionally(new RetryExhaustedException(endpoint, method, ordinal, failure));
            } else {
                LOG.debugf("%s %s failed with non-retryable %s: %s",
                    method, endpoint, failure.category().label(), failure.message());
                result.completeExceptionally(new ApiCallException(failure, endpoint, method, ordinal));
            }
        }
    }
}
