package com.vestpod.pricing.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.vestpod.pricing.Quote;
import com.vestpod.pricing.QuoteException;
import com.vestpod.pricing.QuoteResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CancellationException;

/**
 * Primary equities source: Massive.com (Polygon-compatible) stock snapshots.
 * Batches go through the multi-ticker snapshot endpoint, {@value #BATCH_SIZE} tickers per request.
 */
@Slf4j
public class MassiveQuoteProvider extends AbstractHttpQuoteProvider {

    static final int BATCH_SIZE = 100;
    private static final String SNAPSHOT_PATH = "/v2/snapshot/locale/us/markets/stocks/tickers";

    private final String baseUrl;
    private final String apiKey;

    public MassiveQuoteProvider(String baseUrl, String apiKey, QuoteHttpSupport support) {
        super(ProviderIds.MASSIVE, support);
        this.baseUrl = baseUrl;
        this.apiKey = apiKey;
    }

    @Override
    public Quote fetchQuote(String symbol) {
        String ticker = normalize(symbol);
        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .path(SNAPSHOT_PATH + "/{ticker}")
                .queryParam("apiKey", apiKey)
                .buildAndExpand(ticker)
                .encode()
                .toUri();
        JsonNode root;
        try {
            root = getJson("snapshot " + ticker, uri);
        } catch (QuoteException e) {
            if (e.getStatusCode() != null && e.getStatusCode() == 404) {
                throw QuoteException.unknownSymbol(getProviderId(), symbol);
            }
            throw e;
        }
        JsonNode ticker0 = root.path("ticker");
        if (ticker0.isMissingNode() || ticker0.isNull()) {
            throw QuoteException.parse(getProviderId(), "Invalid snapshot structure for " + symbol);
        }
        return toQuote(symbol, ticker0);
    }

    @Override
    public Map<String, QuoteResult> fetchBatch(List<String> symbols) {
        List<String> distinct = new ArrayList<>(new LinkedHashSet<>(symbols));
        Map<String, QuoteResult> results = new LinkedHashMap<>();
        QuoteException lastChunkError = null;
        int failedChunks = 0;
        int chunks = 0;
        for (int i = 0; i < distinct.size(); i += BATCH_SIZE) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException(getProviderId() + " batch cancelled");
            }
            List<String> chunk = distinct.subList(i, Math.min(i + BATCH_SIZE, distinct.size()));
            chunks++;
            Map<String, JsonNode> byTicker;
            try {
                byTicker = fetchSnapshots(chunk);
            } catch (QuoteException e) {
                log.warn("Massive snapshot chunk of {} ticker(s) failed: {}", chunk.size(), e.getMessage());
                lastChunkError = e;
                failedChunks++;
                for (String symbol : chunk) {
                    results.put(symbol, QuoteResult.failure(e));
                }
                continue;
            }
            for (String symbol : chunk) {
                JsonNode node = byTicker.get(normalize(symbol));
                if (node == null) {
                    results.put(symbol, QuoteResult.failure(QuoteException.unknownSymbol(getProviderId(), symbol)));
                    continue;
                }
                try {
                    results.put(symbol, QuoteResult.success(toQuote(symbol, node)));
                } catch (QuoteException e) {
                    results.put(symbol, QuoteResult.failure(e));
                }
            }
        }
        // nothing came back at all: let the caller escalate the whole batch
        if (lastChunkError != null && failedChunks == chunks) {
            throw lastChunkError;
        }
        return results;
    }

    private Map<String, JsonNode> fetchSnapshots(List<String> chunk) {
        String tickers = String.join(",", chunk.stream().map(MassiveQuoteProvider::normalize).toList());
        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .path(SNAPSHOT_PATH)
                .queryParam("tickers", tickers)
                .queryParam("apiKey", apiKey)
                .encode()
                .build()
                .toUri();
        JsonNode root = getJson("snapshot batch (" + chunk.size() + ")", uri);
        JsonNode list = root.path("tickers");
        if (!list.isArray()) {
            throw QuoteException.parse(getProviderId(), "Invalid batch snapshot structure");
        }
        Map<String, JsonNode> byTicker = new HashMap<>();
        for (JsonNode t : list) {
            String ticker = t.path("ticker").asText("");
            if (!ticker.isBlank()) {
                byTicker.put(ticker.toUpperCase(Locale.ROOT), t);
            }
        }
        return byTicker;
    }

    /**
     * Last trade price, falling back to the day close and then the previous close.
     */
    Quote toQuote(String symbol, JsonNode ticker) {
        JsonNode price = firstPositive(
                ticker.path("lastTrade").path("p"),
                ticker.path("day").path("c"),
                ticker.path("prevDay").path("c"));
        return quote(symbol, requirePrice(price, symbol), null);
    }

    private static JsonNode firstPositive(JsonNode... candidates) {
        for (JsonNode c : candidates) {
            if (c.isNumber() && c.decimalValue().signum() > 0) {
                return c;
            }
        }
        return null;
    }

    private static String normalize(String symbol) {
        return symbol.trim().toUpperCase(Locale.ROOT);
    }
}
