package com.vestpod.pricing;

import com.vestpod.domain.AssetClass;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;

/**
 * Per asset class, asks providers in priority order. Symbols the first provider could not resolve
 * for availability reasons move on to the next one; their quotes are tagged degraded.
 * Never retries a provider; retry happens inside each provider.
 */
@Slf4j
public class QuoteFallbackCoordinator {

    private final Map<AssetClass, List<QuoteProvider>> chains;

    public QuoteFallbackCoordinator(Map<AssetClass, List<QuoteProvider>> chains) {
        Map<AssetClass, List<QuoteProvider>> copy = new EnumMap<>(AssetClass.class);
        chains.forEach((assetClass, providers) -> copy.put(assetClass, List.copyOf(providers)));
        this.chains = copy;
    }

    /**
     * @return one entry per distinct input symbol, in input order; a null or blank symbol gets a
     * CLIENT failure without reaching any provider
     */
    public Map<String, QuoteResult> fetchQuotes(AssetClass assetClass, Collection<String> symbols) {
        Set<String> inputOrder = new LinkedHashSet<>(symbols);
        Set<String> distinct = new LinkedHashSet<>();
        Map<String, QuoteResult> results = new LinkedHashMap<>();
        for (String symbol : inputOrder) {
            if (symbol == null || symbol.isBlank()) {
                results.put(symbol, QuoteResult.failure(QuoteException.client("none", "Blank symbol")));
            } else {
                distinct.add(symbol);
            }
        }
        if (distinct.isEmpty()) {
            return results;
        }
        List<QuoteProvider> chain = chains.getOrDefault(assetClass, List.of());
        if (chain.isEmpty()) {
            QuoteException noChain = QuoteException.client("none", "No provider chain for " + assetClass);
            distinct.forEach(s -> results.put(s, QuoteResult.failure(noChain)));
            return inOrder(inputOrder, results);
        }

        Set<String> pending = new LinkedHashSet<>(distinct);
        Map<String, QuoteException> lastErrors = new LinkedHashMap<>();
        for (int position = 0; position < chain.size() && !pending.isEmpty(); position++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("Quote fetch for " + assetClass + " cancelled");
            }
            QuoteProvider provider = chain.get(position);
            boolean degraded = position > 0;
            Map<String, QuoteResult> batch;
            try {
                batch = provider.fetchBatch(new ArrayList<>(pending));
            } catch (CancellationException e) {
                throw e;
            } catch (QuoteException e) {
                log.warn("{} batch failed for {} {} symbol(s), escalating: {}",
                        provider.getProviderId(), pending.size(), assetClass, e.getMessage());
                pending.forEach(s -> lastErrors.put(s, e));
                continue;
            } catch (RuntimeException e) {
                log.warn("{} batch aborted for {} {} symbol(s), escalating", provider.getProviderId(), pending.size(), assetClass, e);
                QuoteException wrapped = QuoteException.network(provider.getProviderId(), messageOf(e), e);
                pending.forEach(s -> lastErrors.put(s, wrapped));
                continue;
            }

            int resolved = 0;
            for (String symbol : new ArrayList<>(pending)) {
                QuoteResult r = batch.get(symbol);
                if (r == null) {
                    lastErrors.put(symbol, QuoteException.parse(provider.getProviderId(),
                            provider.getProviderId() + " returned no entry for " + symbol));
                    continue;
                }
                if (r.isSuccess()) {
                    results.put(symbol, r.withDegraded(degraded));
                    pending.remove(symbol);
                    resolved++;
                } else if (r.getError().isEscalatable()) {
                    lastErrors.put(symbol, r.getError());
                } else {
                    results.put(symbol, QuoteResult.failure(r.getError()));
                    pending.remove(symbol);
                }
            }
            log.debug("{} resolved {} {} symbol(s), {} left for fallback",
                    provider.getProviderId(), resolved, assetClass, pending.size());
        }

        for (String symbol : pending) {
            QuoteException error = Objects.requireNonNullElseGet(lastErrors.get(symbol),
                    () -> QuoteException.client("none", "No provider resolved " + symbol));
            results.put(symbol, QuoteResult.failure(error));
        }

        return inOrder(inputOrder, results);
    }

    private static Map<String, QuoteResult> inOrder(Set<String> inputOrder, Map<String, QuoteResult> results) {
        Map<String, QuoteResult> ordered = new LinkedHashMap<>();
        for (String symbol : inputOrder) {
            ordered.put(symbol, results.get(symbol));
        }
        return ordered;
    }

    private static String messageOf(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
