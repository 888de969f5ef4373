package com.project.hatchmark.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Bounded retry with exponential backoff. The delay doubles after each failed attempt and is
 * capped at {@code maxBackoffMillis}.
 */
public record RetryPolicy(int maxAttempts, long initialBackoffMillis, long maxBackoffMillis) {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (initialBackoffMillis < 0 || maxBackoffMillis < initialBackoffMillis) {
            throw new IllegalArgumentException("invalid backoff bounds");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, 200, 2000);
    }

    public static RetryPolicy none() {
        return new RetryPolicy(1, 0, 0);
    }

    /**
     * Run {@code attempt} until it succeeds, throws an exception {@code retryable} rejects,
     * or attempts run out. The last failure is rethrown unchanged.
     *
     * @param description used in log lines
     */
    public <T> T execute(String description, Supplier<T> attempt, Predicate<RuntimeException> retryable) {
        long backoffMs = initialBackoffMillis;
        for (int i = 1; ; i++) {
            try {
                return attempt.get();
            } catch (RuntimeException ex) {
                if (i >= maxAttempts || !retryable.test(ex)) {
                    throw ex;
                }
                log.debug("{} failed (attempt {}/{}), retrying in {} ms: {}",
                        description, i, maxAttempts, backoffMs, ex.getMessage());
                sleep(backoffMs, description);
                backoffMs = Math.min(backoffMs * 2, maxBackoffMillis);
            }
        }
    }

    private static void sleep(long millis, String description) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while retrying " + description, ie);
        }
    }
}
