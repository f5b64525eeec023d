package com.vestpod.pricing;

import lombok.Getter;

/**
 * Thrown when a provider call fails. {@link #isRetryable()} drives the backoff executor;
 * {@link #isEscalatable()} drives provider-to-provider fallback.
 */
@Getter
public class QuoteException extends RuntimeException {

    private final QuoteErrorKind kind;
    private final String providerId;
    private final Integer statusCode;

    public QuoteException(QuoteErrorKind kind, String providerId, String message) {
        this(kind, providerId, null, message, null);
    }

    public QuoteException(QuoteErrorKind kind, String providerId, Integer statusCode, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.providerId = providerId;
        this.statusCode = statusCode;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }

    /**
     * True when another provider may still succeed: the failure is about this provider's availability,
     * not about the symbol or the data.
     */
    public boolean isEscalatable() {
        return kind.isRetryable() || kind == QuoteErrorKind.RATE_LIMITED;
    }

    public static QuoteException fromStatus(String providerId, int status, String message, Throwable cause) {
        QuoteErrorKind kind;
        if (status == 429) {
            kind = QuoteErrorKind.THROTTLED;
        } else if (status >= 500) {
            kind = QuoteErrorKind.SERVER;
        } else {
            kind = QuoteErrorKind.CLIENT;
        }
        return new QuoteException(kind, providerId, status, providerId + " HTTP " + status + ": " + message, cause);
    }

    public static QuoteException network(String providerId, String message, Throwable cause) {
        return new QuoteException(QuoteErrorKind.NETWORK, providerId, null, providerId + " network error: " + message, cause);
    }

    public static QuoteException rateLimited(String providerId, String message) {
        return new QuoteException(QuoteErrorKind.RATE_LIMITED, providerId, providerId + " rate limit: " + message);
    }

    public static QuoteException unknownSymbol(String providerId, String symbol) {
        return new QuoteException(QuoteErrorKind.CLIENT, providerId, "Unknown symbol for " + providerId + ": " + symbol);
    }

    public static QuoteException client(String providerId, String message) {
        return new QuoteException(QuoteErrorKind.CLIENT, providerId, message);
    }

    public static QuoteException parse(String providerId, String message) {
        return new QuoteException(QuoteErrorKind.PARSE, providerId, message);
    }

    public static QuoteException parse(String providerId, String message, Throwable cause) {
        return new QuoteException(QuoteErrorKind.PARSE, providerId, null, message, cause);
    }

    public static QuoteException exhausted(String providerId, Throwable cause) {
        Integer status = cause != null && cause.getCause() instanceof QuoteException q ? q.getStatusCode() : null;
        return new QuoteException(QuoteErrorKind.EXHAUSTED, providerId, status,
                cause != null ? cause.getMessage() : providerId + " retries exhausted", cause);
    }
}
