package tech.clusterops.sdk.resilience;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Decides whether and when to make the next attempt of a call.
 *
 * <p>The wait before retry {@code n} (1-based) is {@code baseDelay * 2^(n-1)}, raised to the
 * server's {@code Retry-After} value when that is longer. A server's backpressure signal is
 * never shortened, and a missing header still leaves the exponential delay in place. Every wait is
 * capped at {@link #MAX_WAIT}.
 */
public class RetryScheduler {

    public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(1);

    /** Upper bound on any single wait, whatever the server asks for. */
    public static final Duration MAX_WAIT = Duration.ofDays(1);

    // 2^30 seconds is already decades
    private static final int MAX_SHIFT = 30;

    private final Duration baseDelay;
    private final Clock clock;

    public RetryScheduler() {
        this(DEFAULT_BASE_DELAY, Clock.systemUTC());
    }

    public RetryScheduler(Duration baseDelay, Clock clock) {
        if (baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must not be negative");
        }
        this.baseDelay = baseDelay;
        this.clock = clock;
    }

    /**
     * Exponential backoff for the given retry.
     *
     * @param retryIndex 1 for the first retry, 2 for the second, ...
     */
    public Duration backoff(int retryIndex) {
        if (retryIndex < 1) {
            throw new IllegalArgumentException("retryIndex starts at 1, got " + retryIndex);
        }
        try {
            return baseDelay.multipliedBy(1L << Math.min(retryIndex - 1, MAX_SHIFT));
        } catch (ArithmeticException e) {
            return MAX_WAIT;
        }
    }

    /**
     * Decide what happens after attempt {@code attemptsMade} failed with {@code failure}.
     */
    public RetryDecision decide(int attemptsMade, ApiFailure failure, int maxRetries) {
        if (!failure.isRetryable() || attemptsMade > maxRetries) {
            return RetryDecision.stop();
        }

        Duration wait = backoff(attemptsMade);
        Optional<Duration> serverWait = failure.retryAfter().flatMap(header -> RetryAfter.parse(header, clock));
        if (serverWait.isPresent() && serverWait.get().compareTo(wait) > 0) {
            wait = serverWait.get();
        }
        if (wait.compareTo(MAX_WAIT) > 0) {
            wait = MAX_WAIT;
        }
        return RetryDecision.retryAfter(wait);
    }
}
