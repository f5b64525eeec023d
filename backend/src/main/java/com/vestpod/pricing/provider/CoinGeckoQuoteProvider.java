package com.vestpod.pricing.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.vestpod.pricing.Quote;
import com.vestpod.pricing.QuoteException;
import com.vestpod.pricing.QuoteResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;

/**
 * Crypto source: CoinGecko /simple/price in USD, up to {@value #CHUNK_SIZE} coin ids per request.
 * The demo key is optional; without it the public rate applies.
 */
@Slf4j
public class CoinGeckoQuoteProvider extends AbstractHttpQuoteProvider {

    static final int CHUNK_SIZE = 250;

    private final String baseUrl;
    private final String apiKey;
    private final CoinGeckoSymbolResolver symbolResolver;

    public CoinGeckoQuoteProvider(String baseUrl, String apiKey, CoinGeckoSymbolResolver symbolResolver,
                                  QuoteHttpSupport support) {
        super(ProviderIds.COINGECKO, support);
        this.baseUrl = baseUrl;
        this.apiKey = apiKey;
        this.symbolResolver = symbolResolver;
    }

    @Override
    public Quote fetchQuote(String symbol) {
        QuoteResult result = fetchBatch(List.of(symbol)).get(symbol);
        if (!result.isSuccess()) {
            throw result.getError();
        }
        return result.getQuote();
    }

    /**
     * A failed /coins/list load fails the whole batch; a failed price chunk fails only its symbols.
     */
    @Override
    public Map<String, QuoteResult> fetchBatch(List<String> symbols) {
        Map<String, QuoteResult> results = new LinkedHashMap<>();
        Map<String, String> coinIdBySymbol = new LinkedHashMap<>();
        for (String symbol : new LinkedHashSet<>(symbols)) {
            Optional<String> coinId = resolveCoinId(symbol);
            if (coinId.isPresent()) {
                coinIdBySymbol.put(symbol, coinId.get());
            } else {
                results.put(symbol, QuoteResult.failure(QuoteException.unknownSymbol(getProviderId(), symbol)));
            }
        }

        List<String> coinIds = new ArrayList<>(new LinkedHashSet<>(coinIdBySymbol.values()));
        Map<String, JsonNode> pricesById = new LinkedHashMap<>();
        Map<String, QuoteException> chunkErrorById = new LinkedHashMap<>();
        for (int i = 0; i < coinIds.size(); i += CHUNK_SIZE) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException(getProviderId() + " batch cancelled");
            }
            List<String> chunk = coinIds.subList(i, Math.min(i + CHUNK_SIZE, coinIds.size()));
            try {
                JsonNode root = getJson("simple/price (" + chunk.size() + ")", simplePriceUri(chunk));
                for (String id : chunk) {
                    JsonNode entry = root.path(id);
                    if (!entry.isMissingNode()) {
                        pricesById.put(id, entry);
                    }
                }
            } catch (QuoteException e) {
                log.warn("CoinGecko price chunk of {} id(s) failed: {}", chunk.size(), e.getMessage());
                chunk.forEach(id -> chunkErrorById.put(id, e));
            }
        }

        coinIdBySymbol.forEach((symbol, coinId) -> {
            QuoteException chunkError = chunkErrorById.get(coinId);
            if (chunkError != null) {
                results.put(symbol, QuoteResult.failure(chunkError));
                return;
            }
            JsonNode entry = pricesById.get(coinId);
            if (entry == null) {
                results.put(symbol, QuoteResult.failure(QuoteException.client(getProviderId(),
                        "No price data for " + symbol + " (" + coinId + ")")));
                return;
            }
            try {
                results.put(symbol, QuoteResult.success(toQuote(symbol, entry)));
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

    private Optional<String> resolveCoinId(String symbol) {
        try {
            return symbolResolver.resolve(symbol, this::fetchCoinsList);
        } catch (QuoteException e) {
            throw e;
        } catch (RuntimeException e) {
            throw QuoteException.parse(getProviderId(), "CoinGecko coins list unusable: " + e.getMessage(), e);
        }
    }

    private JsonNode fetchCoinsList() {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(baseUrl).path("/coins/list");
        addKey(builder);
        JsonNode root = getJson("coins/list", builder.encode().build().toUri());
        if (!root.isArray()) {
            throw QuoteException.parse(getProviderId(), "CoinGecko coins/list is not an array");
        }
        return root;
    }

    private URI simplePriceUri(List<String> coinIds) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .path("/simple/price")
                .queryParam("ids", String.join(",", coinIds))
                .queryParam("vs_currencies", "usd")
                .queryParam("include_last_updated_at", "true");
        addKey(builder);
        return builder.encode().build().toUri();
    }

    private void addKey(UriComponentsBuilder builder) {
        if (apiKey != null && !apiKey.isBlank()) {
            builder.queryParam("x_cg_demo_api_key", apiKey);
        }
    }

    Quote toQuote(String symbol, JsonNode entry) {
        JsonNode updatedAt = entry.path("last_updated_at");
        Instant observedAt = updatedAt.isNumber() ? Instant.ofEpochSecond(updatedAt.asLong()) : null;
        return quote(symbol, requirePrice(entry.path("usd"), symbol), observedAt);
    }
}
