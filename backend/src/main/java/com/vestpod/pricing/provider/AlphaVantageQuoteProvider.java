package com.vestpod.pricing.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.vestpod.pricing.Quote;
import com.vestpod.pricing.QuoteErrorKind;
import com.vestpod.pricing.QuoteException;
import com.vestpod.pricing.QuoteResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Backup equities source: Alpha Vantage GLOBAL_QUOTE, one request per symbol.
 * Free keys allow 25 calls/day and 5/minute, so a batch stops at the first rate-limit answer
 * and the rest of the symbols are reported as rate limited without being requested.
 */
@Slf4j
public class AlphaVantageQuoteProvider extends AbstractHttpQuoteProvider {

    private final String baseUrl;
    private final String apiKey;

    public AlphaVantageQuoteProvider(String baseUrl, String apiKey, QuoteHttpSupport support) {
        super(ProviderIds.ALPHA_VANTAGE, support);
        this.baseUrl = baseUrl;
        this.apiKey = apiKey;
    }

    @Override
    public Quote fetchQuote(String symbol) {
        String ticker = symbol.trim().toUpperCase(Locale.ROOT);
        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .path("/query")
                .queryParam("function", "GLOBAL_QUOTE")
                .queryParam("symbol", ticker)
                .queryParam("apikey", apiKey)
                .encode()
                .build()
                .toUri();
        return parseGlobalQuote(symbol, getJson("GLOBAL_QUOTE " + ticker, uri));
    }

    @Override
    public Map<String, QuoteResult> fetchBatch(List<String> symbols) {
        Map<String, QuoteResult> results = new LinkedHashMap<>();
        QuoteException stopReason = null;
        for (String symbol : new LinkedHashSet<>(symbols)) {
            if (stopReason != null) {
                results.put(symbol, QuoteResult.failure(stopReason));
                continue;
            }
            try {
                results.put(symbol, QuoteResult.success(fetchQuote(symbol)));
            } catch (QuoteException e) {
                results.put(symbol, QuoteResult.failure(e));
                if (e.getKind() == QuoteErrorKind.RATE_LIMITED) {
                    log.info("Alpha Vantage rate limit reached, skipping remaining symbols of the batch");
                    stopReason = e;
                }
            }
        }
        return results;
    }

    Quote parseGlobalQuote(String symbol, JsonNode root) {
        if (root.hasNonNull("Error Message")) {
            throw QuoteException.unknownSymbol(getProviderId(), symbol);
        }
        if (root.hasNonNull("Note") || root.hasNonNull("Information")) {
            throw QuoteException.rateLimited(getProviderId(), "provider reported its request quota as used up");
        }
        JsonNode quote = root.path("Global Quote");
        if (quote.isMissingNode() || !quote.isObject()) {
            throw QuoteException.parse(getProviderId(), "Invalid GLOBAL_QUOTE structure for " + symbol);
        }
        if (quote.isEmpty() || !quote.hasNonNull("01. symbol")) {
            throw QuoteException.unknownSymbol(getProviderId(), symbol);
        }
        return quote(symbol, requirePrice(quote.path("05. price"), symbol), null);
    }
}
