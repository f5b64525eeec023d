package com.vestpod.priceupdate;

import com.vestpod.domain.Asset;
import com.vestpod.domain.AssetRepository;
import com.vestpod.domain.SubscriptionTier;
import com.vestpod.domain.SubscriptionTierRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Picks the users whose prices are due for a refresh. Admission control only: a user whose previous
 * refresh has not written yet is selected again, so refreshes must tolerate repeats.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class UpdateEligibilityGate {

    private final SubscriptionTierRepository subscriptionTierRepository;
    private final AssetRepository assetRepository;
    private final PriceUpdateProperties properties;

    /**
     * @return owner ids with at least one listed asset whose most recent price update is at least one cadence old
     */
    public List<String> selectEligibleUsers(Instant now) {
        List<SubscriptionTier> tiers = subscriptionTierRepository.findAll();
        Set<String> eligible = new LinkedHashSet<>();
        int noAssets = 0;
        for (SubscriptionTier tier : tiers) {
            if (tier.getOwnerId() == null || eligible.contains(tier.getOwnerId())) {
                continue;
            }
            try {
                Optional<Asset> latest = assetRepository.findMostRecentlyUpdatedListed(tier.getOwnerId());
                if (latest.isEmpty()) {
                    noAssets++;
                    continue;
                }
                if (isDue(tier, latest.get().getLastPriceUpdateTime(), now)) {
                    eligible.add(tier.getOwnerId());
                }
            } catch (DataAccessException e) {
                log.warn("Eligibility check failed for user {}: {}", tier.getOwnerId(), e.getMessage());
            }
        }
        log.info("Price update eligibility: {} of {} subscribed users due ({} without listed assets)",
                eligible.size(), tiers.size(), noAssets);
        return new ArrayList<>(eligible);
    }

    boolean isDue(SubscriptionTier tier, Instant lastPriceUpdate, Instant now) {
        Instant last = lastPriceUpdate != null ? lastPriceUpdate : Instant.EPOCH;
        long minutesSinceLastUpdate = Duration.between(last, now).toMinutes();
        int cadence = tier.effectiveUpdateFrequencyMinutes(now,
                properties.getFreeFrequencyMinutes(), properties.getPremiumFrequencyMinutes());
        return minutesSinceLastUpdate >= cadence;
    }
}
