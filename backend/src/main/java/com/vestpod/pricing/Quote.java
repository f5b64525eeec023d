package com.vestpod.pricing;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One price observation for a symbol from one provider.
 */
public record Quote(String symbol, BigDecimal price, String sourceProviderId, Instant observedAt) {
}
