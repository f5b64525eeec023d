package com.vestpod.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Subscription level of a user: price refresh cadence and alert quota.
 */
@Document(collection = "subscriptions")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class SubscriptionTier {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed(unique = true)
    private String ownerId;
    private boolean premium;
    private int priceUpdateFrequencyMinutes;
    private int maxActiveAlerts;
    /** Null for free users and open-ended subscriptions. */
    private Instant subscriptionEndDate;

    public boolean isExpired(Instant now) {
        return subscriptionEndDate != null && now.isAfter(subscriptionEndDate);
    }

    /**
     * Refresh cadence in minutes. A premium subscription that has run out is refreshed at the free cadence;
     * a tier without an explicit cadence gets the default of its level.
     */
    public int effectiveUpdateFrequencyMinutes(Instant now, int freeFrequencyMinutes, int premiumFrequencyMinutes) {
        if (premium && isExpired(now)) {
            return freeFrequencyMinutes;
        }
        if (priceUpdateFrequencyMinutes > 0) {
            return priceUpdateFrequencyMinutes;
        }
        return premium ? premiumFrequencyMinutes : freeFrequencyMinutes;
    }
}
