package com.gateproof.runtime;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded retry with linear backoff. Only failures of the retryable type are retried; anything else
 * and the last retryable failure are rethrown unchanged.
 */
public record RetryPolicy(int maxRetries, Duration backoff) {
    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (backoff == null || backoff.isNegative()) {
            throw new IllegalArgumentException("backoff must be >= 0");
        }
    }

    public static RetryPolicy none() {
        return new RetryPolicy(0, Duration.ZERO);
    }

    @FunctionalInterface
    public interface ThrowingSupplier<T, E extends Exception> {
        T get() throws E;
    }

    public <T, E extends Exception> T run(String operation, Class<? extends Exception> retryOn, ThrowingSupplier<T, E> supplier) throws E {
        int maxAttempts = maxRetries + 1;
        for (int attempt = 1; ; attempt++) {
            try {
                return supplier.get();
            } catch (Exception e) {
                if (!retryOn.isInstance(e) || attempt >= maxAttempts) {
                    throw e;
                }
                long backoffMs = backoff.toMillis() * attempt;
                log.warn("retry operation={} attempt={} maxAttempts={} backoffMs={} reason={}", operation, attempt, maxAttempts, backoffMs, e.getMessage());
                try {
                    Thread.sleep(backoffMs);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    e.addSuppressed(interrupted);
                    throw e;
                }
            }
        }
    }
}
