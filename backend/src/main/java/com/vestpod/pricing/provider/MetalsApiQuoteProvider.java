package com.vestpod.pricing.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.vestpod.pricing.Quote;
import com.vestpod.pricing.QuoteException;
import com.vestpod.pricing.QuoteResult;
import org.springframework.web.util.UriComponentsBuilder;

import java.math.BigDecimal;
import java.net.URI;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Backup commodities source: Metals-API /latest with USD base. Rates come back as metal per USD,
 * so the price per ounce is 1/rate. One request covers the whole batch; the free plan allows 50 calls/month.
 */
public class MetalsApiQuoteProvider extends AbstractHttpQuoteProvider {

    /** Metals-API error code for "monthly usage limit reached". */
    private static final int USAGE_LIMIT_REACHED = 104;

    private final String baseUrl;
    private final String apiKey;

    public MetalsApiQuoteProvider(String baseUrl, String apiKey, QuoteHttpSupport support) {
        super(ProviderIds.METALS_API, support);
        this.baseUrl = baseUrl;
        this.apiKey = apiKey;
    }

    @Override
    public Quote fetchQuote(String symbol) {
        QuoteResult result = fetchBatch(List.of(symbol)).get(symbol);
        if (!result.isSuccess()) {
            throw result.getError();
        }
        return result.getQuote();
    }

    @Override
    public Map<String, QuoteResult> fetchBatch(List<String> symbols) {
        Map<String, QuoteResult> results = new LinkedHashMap<>();
        Map<String, String> metalBySymbol = new LinkedHashMap<>();
        for (String symbol : new LinkedHashSet<>(symbols)) {
            Optional<String> metal = MetalSymbols.normalize(symbol);
            if (metal.isPresent()) {
                metalBySymbol.put(symbol, metal.get());
            } else {
                results.put(symbol, QuoteResult.failure(QuoteException.unknownSymbol(getProviderId(), symbol)));
            }
        }
        if (metalBySymbol.isEmpty()) {
            return results;
        }
        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .path("/latest")
                .queryParam("access_key", apiKey)
                .queryParam("base", "USD")
                .queryParam("symbols", String.join(",", new LinkedHashSet<>(metalBySymbol.values())))
                .encode()
                .build()
                .toUri();
        JsonNode root = getJson("latest (" + metalBySymbol.size() + ")", uri);
        checkSuccess(root);
        JsonNode rates = root.path("rates");
        Instant observedAt = root.path("timestamp").isNumber()
                ? Instant.ofEpochSecond(root.path("timestamp").asLong())
                : null;
        metalBySymbol.forEach((symbol, metal) -> {
            try {
                results.put(symbol, QuoteResult.success(quote(symbol, invertRate(rates.path(metal), symbol), observedAt)));
            } catch (QuoteException e) {
                results.put(symbol, QuoteResult.failure(e));
            }
        });
        Map<String, QuoteResult> ordered = new LinkedHashMap<>();
        for (String symbol : new LinkedHashSet<>(symbols)) {
            ordered.put(symbol, results.get(symbol));
        }
        return ordered;
    }

    private void checkSuccess(JsonNode root) {
        if (root.path("success").asBoolean(true)) {
            return;
        }
        JsonNode error = root.path("error");
        int code = error.path("code").asInt(400);
        String info = error.path("info").asText("Unknown API error");
        if (code == USAGE_LIMIT_REACHED) {
            throw QuoteException.rateLimited(getProviderId(), info);
        }
        throw QuoteException.client(getProviderId(), "Metals-API error " + code + ": " + info);
    }

    BigDecimal invertRate(JsonNode rate, String symbol) {
        if (rate == null || !rate.isNumber() || rate.decimalValue().signum() <= 0) {
            throw QuoteException.client(getProviderId(), "No price data available for " + symbol);
        }
        return BigDecimal.ONE.divide(rate.decimalValue(), PRICE_SCALE, ROUNDING);
    }
}
