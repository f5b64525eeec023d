package com.vestpod.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Application event: prices of some of a user's assets changed in one refresh.
 * Published by the price update job after its writes; delivery is best-effort.
 */
public record PriceUpdateEvent(String ownerId, Instant timestamp, List<AssetPriceChange> updates) {

    public record AssetPriceChange(
            String assetId,
            String symbol,
            String portfolioId,
            BigDecimal oldPrice,
            BigDecimal newPrice,
            BigDecimal priceChangePercent,
            String sourceProviderId,
            boolean degraded) {
    }
}
