package net.miragecodex.support.retry;

import java.util.function.Predicate;
import java.util.function.Supplier;
import org.slf4j.Logger;

/**
 * Executes operations with bounded retry and configurable backoff.
 */
public final class RetrySupport {

    /**
     * How the wait between attempts grows.
     */
    public enum Backoff {
        /** {@code base * attempt} */
        LINEAR,
        /** {@code base * 2^(attempt - 1)} */
        EXPONENTIAL
    }

    /**
     * Bundles the retry parameters that are constant per call site:
     * the logger, maximum attempts, base backoff interval and growth.
     */
    public record RetryConfig(Logger logger, int maxAttempts, long baseBackoffMillis, Backoff backoff) {

        /** Retry config used when acquiring search generation advisory locks. */
        public static RetryConfig forAdvisoryLock(Logger logger) {
            return new RetryConfig(logger, 3, 100L, Backoff.LINEAR);
        }

        /** Exponential retry config used by generator calls. */
        public static RetryConfig exponential(Logger logger, int maxAttempts, long baseBackoffMillis) {
            return new RetryConfig(logger, maxAttempts, baseBackoffMillis, Backoff.EXPONENTIAL);
        }

        long backoffForAttempt(int attempt) {
            long base = Math.max(baseBackoffMillis, 0L);
            if (backoff == Backoff.LINEAR) {
                return base * attempt;
            }
            return base * (1L << Math.min(attempt - 1, 20));
        }
    }

    private RetrySupport() {
    }

    /**
     * Executes the action, retrying runtime exceptions accepted by {@code retryable}.
     *
     * <p>Non-retryable exceptions propagate immediately. When every attempt fails
     * the last retryable exception is rethrown unchanged.
     */
    public static <T> T execute(RetryConfig config,
                                String operationLabel,
                                Supplier<T> action,
                                Predicate<RuntimeException> retryable) {
        int maxAttempts = config.maxAttempts();
        if (maxAttempts < 1) {
            throw new IllegalArgumentException(
                "maxAttempts must be at least 1 for operation '" + operationLabel + "' but was " + maxAttempts
            );
        }
        RuntimeException lastException = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return action.get();
            } catch (RuntimeException exception) {
                if (!retryable.test(exception)) {
                    throw exception;
                }
                lastException = exception;
                if (attempt < maxAttempts) {
                    long backoff = config.backoffForAttempt(attempt);
                    config.logger().warn(
                        "{} failed (attempt {}/{}): {}. Retrying in {}ms",
                        operationLabel,
                        attempt,
                        maxAttempts,
                        exception.getMessage(),
                        backoff
                    );
                    sleepUnchecked(backoff);
                }
            }
        }
        throw lastException;
    }

    /**
     * Retries only {@link AdvisoryLockAcquisitionException}.
     */
    public static <T> T executeWithLockRetry(RetryConfig config, String operationLabel, Supplier<T> action) {
        return execute(config, operationLabel, action, AdvisoryLockAcquisitionException.class::isInstance);
    }

    private static void sleepUnchecked(long durationMillis) {
        if (durationMillis <= 0) {
            return;
        }
        try {
            Thread.sleep(durationMillis);
        } catch (InterruptedException interruptedException) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting to retry", interruptedException);
        }
    }
}
