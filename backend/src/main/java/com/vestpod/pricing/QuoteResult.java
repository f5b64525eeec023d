package com.vestpod.pricing;

import lombok.Getter;

import java.util.Optional;

/**
 * Per-symbol outcome of a batch fetch: a quote (possibly from a backup provider) or the failure.
 */
@Getter
public class QuoteResult {

    private final Quote quote;
    private final QuoteException error;
    /** Resolved by a provider other than the first in its chain. */
    private final boolean degraded;

    private QuoteResult(Quote quote, QuoteException error, boolean degraded) {
        this.quote = quote;
        this.error = error;
        this.degraded = degraded;
    }

    public static QuoteResult success(Quote quote) {
        return new QuoteResult(quote, null, false);
    }

    public static QuoteResult failure(QuoteException error) {
        return new QuoteResult(null, error, false);
    }

    public QuoteResult withDegraded(boolean degraded) {
        return new QuoteResult(quote, error, degraded);
    }

    public boolean isSuccess() {
        return quote != null;
    }

    public Optional<String> getSourceProviderId() {
        return quote == null ? Optional.empty() : Optional.ofNullable(quote.sourceProviderId());
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "QuoteResult[" + quote + (degraded ? ", degraded" : "") + "]"
                : "QuoteResult[error=" + error.getMessage() + "]";
    }
}
