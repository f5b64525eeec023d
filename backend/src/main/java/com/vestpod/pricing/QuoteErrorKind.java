package com.vestpod.pricing;

/**
 * Failure classes for provider calls.
 */
public enum QuoteErrorKind {
    /** Connection failure or timeout. Retried. */
    NETWORK(true),
    /** HTTP 429 from the provider. Retried. */
    THROTTLED(true),
    /** HTTP 5xx. Retried. */
    SERVER(true),
    /** Local call budget spent, or the provider reported its quota as used up. Skipped for this cycle. */
    RATE_LIMITED(false),
    /** Other 4xx, bad credentials, unknown symbol. */
    CLIENT(false),
    /** Malformed or incomplete payload. */
    PARSE(false),
    /** Retryable failures on every attempt. */
    EXHAUSTED(true);

    private final boolean retryable;

    QuoteErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
