package com.osint.correlation.aggregation;

import com.osint.correlation.source.SourceException;

import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Exponential backoff for transient source failures.
 *
 * @param maxRetries retries after the first attempt
 * @param baseDelay  delay before the first retry
 * @param maxDelay   cap on any single delay
 */
public record RetryPolicy(int maxRetries, Duration baseDelay, Duration maxDelay) {

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must not be negative");
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= baseDelay");
        }
    }

    public static RetryPolicy none() {
        return new RetryPolicy(0, Duration.ZERO, Duration.ZERO);
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }

    /**
     * Delay before retry number {@code retry} (0-based): {@code min(base * 2^retry, max)}.
     */
    public Duration delayBefore(int retry) {
        if (retry >= 31) {
            return maxDelay;
        }
        long millis;
        try {
            millis = Math.multiplyExact(baseDelay.toMillis(), 1L << retry);
        } catch (ArithmeticException overflow) {
            return maxDelay;
        }
        return millis >= maxDelay.toMillis() ? maxDelay : Duration.ofMillis(millis);
    }

    /**
     * Network failures, timeouts and rate limiting are transient; everything else is permanent.
     */
    public static boolean isTransient(Throwable failure) {
        if (failure instanceof SourceException sourceException) {
            return sourceException.isTransient();
        }
        return failure instanceof UncheckedIOException || failure instanceof TimeoutException;
    }
}
