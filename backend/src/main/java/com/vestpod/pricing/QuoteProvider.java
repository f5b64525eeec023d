package com.vestpod.pricing;

import java.util.List;
import java.util.Map;

/**
 * One external price source. Implementations charge the rate limiter before every request and
 * retry through the backoff executor.
 */
public interface QuoteProvider {

    String getProviderId();

    /**
     * @throws QuoteException on any failure for this symbol
     */
    Quote fetchQuote(String symbol);

    /**
     * Quotes for all symbols. The key set equals the distinct input symbols; one symbol's failure
     * is recorded as that symbol's result and never hides the others.
     *
     * @throws QuoteException when the provider fails wholesale (e.g. the batch request itself is rejected)
     */
    Map<String, QuoteResult> fetchBatch(List<String> symbols);
}
