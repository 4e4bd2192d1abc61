package tech.clusterops.sdk.resilience;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Suspends a call between attempts without holding a thread.
 */
@FunctionalInterface
public interface Delayer {

    /**
     * Future that completes once {@code duration} has elapsed. Cancelling it abandons the wait.
     */
    CompletableFuture<Void> delay(Duration duration);

    static Delayer nonBlocking() {
        return duration -> {
            long millis;
            try {
                millis = duration.toMillis();
            } catch (ArithmeticException e) {
                millis = Long.MAX_VALUE;
            }
            return CompletableFuture.runAsync(() -> {},
                CompletableFuture.delayedExecutor(millis, TimeUnit.MILLISECONDS));
        };
    }
}
