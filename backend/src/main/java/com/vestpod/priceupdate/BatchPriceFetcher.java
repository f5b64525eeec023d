package com.vestpod.priceupdate;

import com.vestpod.config.AsyncConfig;
import com.vestpod.domain.Asset;
import com.vestpod.domain.AssetClass;
import com.vestpod.domain.AssetRepository;
import com.vestpod.domain.PriceHistoryRecord;
import com.vestpod.domain.PriceHistoryRepository;
import com.vestpod.domain.PriceUpdateEvent;
import com.vestpod.pricing.Quote;
import com.vestpod.pricing.QuoteFallbackCoordinator;
import com.vestpod.pricing.QuoteResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Refreshes one user's listed assets: one fallback fetch per asset class (classes in parallel),
 * then a single write pass. Assets without a quote keep their stale price. Writes are per asset;
 * a failed write does not undo the others.
 */
@Component
@Slf4j
public class BatchPriceFetcher {

    private static final int PERCENT_SCALE = 4;

    private final AssetRepository assetRepository;
    private final PriceHistoryRepository priceHistoryRepository;
    private final QuoteFallbackCoordinator quoteFallbackCoordinator;
    private final ApplicationEventPublisher eventPublisher;
    private final AsyncTaskExecutor quoteFetchExecutor;
    private final Clock clock;

    public BatchPriceFetcher(AssetRepository assetRepository,
                             PriceHistoryRepository priceHistoryRepository,
                             QuoteFallbackCoordinator quoteFallbackCoordinator,
                             ApplicationEventPublisher eventPublisher,
                             @Qualifier(AsyncConfig.QUOTE_FETCH_EXECUTOR) AsyncTaskExecutor quoteFetchExecutor,
                             Clock clock) {
        this.assetRepository = assetRepository;
        this.priceHistoryRepository = priceHistoryRepository;
        this.quoteFallbackCoordinator = quoteFallbackCoordinator;
        this.eventPublisher = eventPublisher;
        this.quoteFetchExecutor = quoteFetchExecutor;
        this.clock = clock;
    }

    /**
     * @throws CancellationException when interrupted before the write pass; nothing is written for the user then
     */
    public UserPriceRefreshResult refreshUser(String ownerId) {
        List<Asset> assets = assetRepository.findListedByOwnerId(ownerId).stream()
                .filter(Asset::isListed)
                .toList();
        if (assets.isEmpty()) {
            return UserPriceRefreshResult.empty(ownerId);
        }
        Map<AssetClass, List<Asset>> byClass = new EnumMap<>(AssetClass.class);
        for (Asset asset : assets) {
            byClass.computeIfAbsent(asset.getAssetClass(), c -> new ArrayList<>()).add(asset);
        }

        Map<AssetClass, Map<String, QuoteResult>> quotes = fetchByClass(ownerId, byClass);
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Price refresh for " + ownerId + " cancelled before writing");
        }
        return persist(ownerId, assets, quotes);
    }

    private Map<AssetClass, Map<String, QuoteResult>> fetchByClass(String ownerId, Map<AssetClass, List<Asset>> byClass) {
        Map<AssetClass, Future<Map<String, QuoteResult>>> futures = new EnumMap<>(AssetClass.class);
        byClass.forEach((assetClass, classAssets) -> {
            List<String> symbols = classAssets.stream().map(BatchPriceFetcher::symbolOf).distinct().toList();
            futures.put(assetClass, quoteFetchExecutor.submit(
                    () -> quoteFallbackCoordinator.fetchQuotes(assetClass, symbols)));
        });

        Map<AssetClass, Map<String, QuoteResult>> results = new EnumMap<>(AssetClass.class);
        for (Map.Entry<AssetClass, Future<Map<String, QuoteResult>>> entry : futures.entrySet()) {
            try {
                results.put(entry.getKey(), entry.getValue().get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.values().forEach(f -> f.cancel(true));
                throw new CancellationException("Price refresh for " + ownerId + " interrupted");
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof CancellationException cancelled) {
                    futures.values().forEach(f -> f.cancel(true));
                    throw cancelled;
                }
                log.warn("Quote fetch for user {} {} failed, keeping stale prices: {}",
                        ownerId, entry.getKey(), cause.getMessage());
                results.put(entry.getKey(), Map.of());
            }
        }
        return results;
    }

    private UserPriceRefreshResult persist(String ownerId, List<Asset> assets,
                                           Map<AssetClass, Map<String, QuoteResult>> quotes) {
        Instant now = clock.instant();
        List<PriceUpdateEvent.AssetPriceChange> changes = new ArrayList<>();
        int failed = 0;
        int degraded = 0;
        for (Asset asset : assets) {
            QuoteResult result = quotes.getOrDefault(asset.getAssetClass(), Map.of()).get(symbolOf(asset));
            if (result == null || !result.isSuccess()) {
                failed++;
                log.debug("No quote for {} ({}): {}", asset.getSymbol(), asset.getId(),
                        result != null ? result.getError().getMessage() : "not fetched");
                continue;
            }
            Quote quote = result.getQuote();
            BigDecimal oldPrice = asset.getCurrentPrice();
            Instant oldUpdateTime = asset.getLastPriceUpdateTime();
            asset.setCurrentPrice(quote.price());
            asset.setLastPriceUpdateTime(now);
            try {
                assetRepository.save(asset);
            } catch (DataAccessException e) {
                asset.setCurrentPrice(oldPrice);
                asset.setLastPriceUpdateTime(oldUpdateTime);
                failed++;
                log.warn("Price write failed for asset {} ({}): {}", asset.getId(), asset.getSymbol(), e.getMessage());
                continue;
            }
            appendHistory(asset, quote);
            if (result.isDegraded()) {
                degraded++;
            }
            changes.add(new PriceUpdateEvent.AssetPriceChange(
                    asset.getId(),
                    asset.getSymbol(),
                    asset.getPortfolioId(),
                    oldPrice,
                    quote.price(),
                    percentChange(oldPrice, quote.price()),
                    quote.sourceProviderId(),
                    result.isDegraded()));
        }

        boolean published = publish(ownerId, now, changes);
        log.info("Price refresh for user {}: {} updated, {} failed, {} from backup providers",
                ownerId, changes.size(), failed, degraded);
        return new UserPriceRefreshResult(ownerId, assets.size(), changes.size(), failed, degraded, published);
    }

    private void appendHistory(Asset asset, Quote quote) {
        try {
            priceHistoryRepository.save(new PriceHistoryRecord(null, asset.getId(), quote.symbol(),
                    asset.getAssetClass(), quote.price(), quote.observedAt(), quote.sourceProviderId()));
        } catch (DataAccessException e) {
            log.warn("Price history append failed for asset {}: {}", asset.getId(), e.getMessage());
        }
    }

    private boolean publish(String ownerId, Instant now, List<PriceUpdateEvent.AssetPriceChange> changes) {
        if (changes.isEmpty()) {
            return false;
        }
        try {
            eventPublisher.publishEvent(new PriceUpdateEvent(ownerId, now, List.copyOf(changes)));
            return true;
        } catch (RuntimeException e) {
            log.warn("Price update event for user {} not delivered: {}", ownerId, e.getMessage());
            return false;
        }
    }

    /**
     * Change from the previous stored price in percent; 0 when there was no usable previous price.
     */
    static BigDecimal percentChange(BigDecimal oldPrice, BigDecimal newPrice) {
        if (oldPrice == null || oldPrice.signum() == 0 || newPrice == null) {
            return BigDecimal.ZERO;
        }
        return newPrice.subtract(oldPrice)
                .multiply(BigDecimal.valueOf(100))
                .divide(oldPrice, PERCENT_SCALE, RoundingMode.HALF_UP);
    }

    private static String symbolOf(Asset asset) {
        return asset.getSymbol().trim();
    }
}
