package com.vestpod.common;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CancellationException;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Runs an operation with exponential backoff. Failures matching the retryable predicate are retried
 * up to {@link RetryPolicy#getMaxRetries()} times; anything else is rethrown immediately.
 */
@Slf4j
public class BackoffExecutor {

    private final RetryPolicy retryPolicy;
    private final Predicate<Throwable> retryable;
    private final Sleeper sleeper;

    public BackoffExecutor(RetryPolicy retryPolicy, Predicate<Throwable> retryable) {
        this(retryPolicy, retryable, Sleeper.threadSleep());
    }

    public BackoffExecutor(RetryPolicy retryPolicy, Predicate<Throwable> retryable, Sleeper sleeper) {
        this.retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.defaultPolicy();
        this.retryable = retryable;
        this.sleeper = sleeper != null ? sleeper : Sleeper.threadSleep();
    }

    /**
     * @param operation label used in log lines and in the exhaustion message
     * @throws RetriesExhaustedException when all attempts failed with retryable errors
     * @throws CancellationException when interrupted while backing off
     */
    public <T> T execute(String operation, Supplier<T> op) {
        RuntimeException lastFailure = null;
        int maxAttempts = retryPolicy.getMaxAttempts();
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            if (attempt > 0) {
                long delay = retryPolicy.delayMs(attempt - 1);
                log.warn("Retrying {} (attempt {}/{}) in {}ms after: {}",
                        operation, attempt + 1, maxAttempts, delay, lastFailure.getMessage());
                pause(operation, delay);
            }
            try {
                return op.get();
            } catch (RuntimeException e) {
                if (!retryable.test(e)) {
                    throw e;
                }
                lastFailure = e;
            }
        }
        throw new RetriesExhaustedException(operation, maxAttempts, lastFailure);
    }

    private void pause(String operation, long delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            CancellationException cancelled = new CancellationException("Interrupted while retrying " + operation);
            cancelled.initCause(e);
            throw cancelled;
        }
    }
}
