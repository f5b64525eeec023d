package com.vestpod.pricing.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.benmanes.caffeine.cache.Cache;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Resolves ticker symbol to CoinGecko coin id. Configured overrides win; otherwise the
 * /coins/list index is loaded once and cached (24h by default). The index keeps the first coin
 * listed for a symbol, which is what CoinGecko's own search ranks first for the majors.
 */
@Slf4j
public class CoinGeckoSymbolResolver {

    static final String CACHE_KEY = "coins-list";

    private final Map<String, String> overrides;
    private final Cache<String, Map<String, String>> coinsListCache;

    public CoinGeckoSymbolResolver(Map<String, String> overrides, Cache<String, Map<String, String>> coinsListCache) {
        Map<String, String> normalized = new HashMap<>();
        if (overrides != null) {
            overrides.forEach((symbol, coinId) -> normalized.put(symbol.trim().toLowerCase(Locale.ROOT), coinId));
        }
        this.overrides = Map.copyOf(normalized);
        this.coinsListCache = coinsListCache;
    }

    /**
     * @param loader fetches the /coins/list payload; called only when the cached index is absent or expired.
     *               Its failure propagates to the caller.
     */
    public Optional<String> resolve(String symbol, Supplier<JsonNode> loader) {
        if (symbol == null || symbol.isBlank()) {
            return Optional.empty();
        }
        String key = symbol.trim().toLowerCase(Locale.ROOT);
        String override = overrides.get(key);
        if (override != null) {
            return Optional.of(override);
        }
        Map<String, String> index = coinsListCache.get(CACHE_KEY, k -> {
            log.debug("CoinGecko coins list not cached, loading");
            return parseIndex(loader.get());
        });
        return Optional.ofNullable(index.get(key));
    }

    static Map<String, String> parseIndex(JsonNode root) {
        Map<String, String> index = new HashMap<>();
        if (root == null || !root.isArray()) {
            return index;
        }
        for (JsonNode coin : root) {
            JsonNode idNode = coin.path("id");
            JsonNode symbolNode = coin.path("symbol");
            if (!idNode.isTextual() || !symbolNode.isTextual()) {
                continue;
            }
            String coinId = idNode.asText();
            String symbol = symbolNode.asText().trim().toLowerCase(Locale.ROOT);
            if (coinId.isBlank() || symbol.isBlank()) {
                continue;
            }
            index.putIfAbsent(symbol, coinId);
        }
        return index;
    }
}
