package com.vestpod.domain;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Append-only price point for charts. One per successful quote.
 */
@Document(collection = "price_history")
@CompoundIndex(name = "asset_observed", def = "{'assetId': 1, 'observedAt': -1}")
@NoArgsConstructor
@AllArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class PriceHistoryRecord {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String assetId;
    private String symbol;
    private AssetClass assetClass;
    private BigDecimal price;
    private Instant observedAt;
    private String sourceProviderId;
}
