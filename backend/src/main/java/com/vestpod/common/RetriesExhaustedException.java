package com.vestpod.common;

/**
 * Thrown by {@link BackoffExecutor} when every attempt failed with a retryable error.
 * Still reports itself as retryable so callers can escalate instead of treating it as a data error.
 */
public class RetriesExhaustedException extends RuntimeException {

    private final int attempts;

    public RetriesExhaustedException(String operation, int attempts, Throwable lastFailure) {
        super(operation + " failed after " + attempts + " attempts: " + messageOf(lastFailure), lastFailure);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }

    public boolean isRetryable() {
        return true;
    }

    private static String messageOf(Throwable t) {
        if (t == null) {
            return "unknown";
        }
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }
}
