package com.vestpod.pricing.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.vestpod.pricing.Quote;
import com.vestpod.pricing.QuoteException;
import com.vestpod.pricing.QuoteResult;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;

/**
 * Primary commodities source: gold-api.com spot prices per troy ounce in USD. Keyless.
 */
public class GoldApiQuoteProvider extends AbstractHttpQuoteProvider {

    private final String baseUrl;

    public GoldApiQuoteProvider(String baseUrl, QuoteHttpSupport support) {
        super(ProviderIds.GOLD_API, support);
        this.baseUrl = baseUrl;
    }

    @Override
    public Quote fetchQuote(String symbol) {
        String metal = MetalSymbols.normalize(symbol)
                .orElseThrow(() -> QuoteException.unknownSymbol(getProviderId(), symbol));
        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .path("/price/{symbol}")
                .buildAndExpand(metal)
                .encode()
                .toUri();
        return parsePrice(symbol, getJson("price " + metal, uri));
    }

    @Override
    public Map<String, QuoteResult> fetchBatch(List<String> symbols) {
        return fetchEachSymbol(symbols);
    }

    Quote parsePrice(String symbol, JsonNode root) {
        if (!root.hasNonNull("price")) {
            throw QuoteException.parse(getProviderId(), "Invalid price structure for " + symbol);
        }
        return quote(symbol, requirePrice(root.path("price"), symbol), parseUpdatedAt(root.path("updatedAt")));
    }

    private static Instant parseUpdatedAt(JsonNode node) {
        if (!node.isTextual()) {
            return null;
        }
        try {
            return Instant.parse(node.asText().trim());
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
