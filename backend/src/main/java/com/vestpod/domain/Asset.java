package com.vestpod.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * A user's holding. Price fields are written only by the price update job; everything else by user CRUD.
 * All monetary/quantity fields are BigDecimal.
 */
@Document(collection = "assets")
@CompoundIndex(name = "owner_last_update", def = "{'ownerId': 1, 'lastPriceUpdateTime': -1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Asset {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String ownerId;
    private String portfolioId;
    private AssetClass assetClass;
    /** Null for unlisted assets. */
    private String symbol;
    private String name;
    private BigDecimal currentPrice;
    private Instant lastPriceUpdateTime;
    private BigDecimal purchasePrice;
    private BigDecimal quantity;
    private LocalDate maturityDate;

    public boolean isListed() {
        return assetClass != null && assetClass.isListed() && symbol != null && !symbol.isBlank();
    }

    /** Name and symbol as shown in notifications, e.g. "Apple (AAPL)". */
    public String displayName() {
        String label = name != null && !name.isBlank() ? name : (symbol != null ? symbol : id);
        return label + " (" + (symbol != null ? symbol : "N/A") + ")";
    }
}
