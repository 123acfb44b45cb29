package com.williamcallahan.chatrelay.support;

import java.time.Duration;
import java.util.function.Predicate;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retries an outbound call with exponential backoff while the failure is classified as transient.
 *
 * <p>The wait doubles after each failed attempt and never exceeds {@link #MAX_BACKOFF}. The final failure,
 * or the first one the classifier rejects, is rethrown unchanged so callers can inspect the original
 * exception type.</p>
 */
public final class RetrySupport {

    private static final Logger log = LoggerFactory.getLogger(RetrySupport.class);

    static final double BACKOFF_MULTIPLIER = 2.0;
    static final Duration MAX_BACKOFF = Duration.ofSeconds(30);

    private RetrySupport() {}

    /**
     * Runs {@code call} up to {@code maxAttempts} times.
     *
     * @param call outbound call
     * @param description label used in log lines
     * @param maxAttempts total attempts including the first, at least 1
     * @param initialBackoff wait before the second attempt
     * @param isTransient returns true for failures worth another attempt
     * @param <T> result type
     * @return the first successful result
     */
    public static <T> T executeWithRetry(
            Supplier<T> call,
            String description,
            int maxAttempts,
            Duration initialBackoff,
            Predicate<Throwable> isTransient) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        Duration backoff = initialBackoff;
        int attempt = 1;
        while (true) {
            try {
                return call.get();
            } catch (RuntimeException failure) {
                if (!isTransient.test(failure)) {
                    log.warn("{}: permanent failure on attempt {}/{}", description, attempt, maxAttempts);
                    throw failure;
                }
                if (attempt >= maxAttempts) {
                    log.error("{}: giving up after {} attempts", description, maxAttempts);
                    throw failure;
                }
                log.warn("{}: transient failure on attempt {}/{} ({}), next try in {}ms",
                        description, attempt, maxAttempts, failure.getClass().getSimpleName(), backoff.toMillis());
                pause(backoff);
                backoff = nextBackoff(backoff);
                attempt++;
            }
        }
    }

    static Duration nextBackoff(Duration current) {
        long doubledMillis = (long) (current.toMillis() * BACKOFF_MULTIPLIER);
        return Duration.ofMillis(Math.min(doubledMillis, MAX_BACKOFF.toMillis()));
    }

    private static void pause(Duration backoff) {
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting to retry", interrupted);
        }
    }
}
