package com.vestpod.priceupdate;

import com.vestpod.domain.Asset;
import com.vestpod.domain.AssetRepository;
import com.vestpod.domain.SubscriptionTier;
import com.vestpod.domain.SubscriptionTierRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class UpdateEligibilityGateTest {

    private static final Instant NOW = Instant.parse("2025-06-02T14:00:00Z");

    @Mock
    SubscriptionTierRepository subscriptionTierRepository;
    @Mock
    AssetRepository assetRepository;

    private UpdateEligibilityGate gate;

    @BeforeEach
    void setUp() {
        gate = new UpdateEligibilityGate(subscriptionTierRepository, assetRepository, new PriceUpdateProperties());
    }

    private static SubscriptionTier tier(String ownerId, boolean premium, int frequencyMinutes, Instant endDate) {
        SubscriptionTier tier = new SubscriptionTier();
        tier.setOwnerId(ownerId);
        tier.setPremium(premium);
        tier.setPriceUpdateFrequencyMinutes(frequencyMinutes);
        tier.setSubscriptionEndDate(endDate);
        return tier;
    }

    private void lastUpdate(String ownerId, Instant lastUpdate) {
        Asset asset = new Asset();
        asset.setOwnerId(ownerId);
        asset.setLastPriceUpdateTime(lastUpdate);
        when(assetRepository.findMostRecentlyUpdatedListed(ownerId)).thenReturn(Optional.of(asset));
    }

    @ParameterizedTest(name = "free user last updated {0} min ago -> due={1}")
    @CsvSource({"14, false", "15, true", "60, true"})
    @DisplayName("free user is due once the free cadence has elapsed")
    void freeCadence(long minutesAgo, boolean due) {
        assertThat(gate.isDue(tier("u1", false, 0, null), NOW.minusSeconds(minutesAgo * 60), NOW)).isEqualTo(due);
    }

    @Test
    @DisplayName("premium user with explicit 5 min cadence is due after 5 minutes")
    void premiumCadence() {
        SubscriptionTier premium = tier("u1", true, 5, NOW.plusSeconds(86_400));

        assertThat(gate.isDue(premium, NOW.minusSeconds(4 * 60 + 59), NOW)).isFalse();
        assertThat(gate.isDue(premium, NOW.minusSeconds(5 * 60), NOW)).isTrue();
    }

    @Test
    @DisplayName("expired premium subscription falls back to the free cadence")
    void expiredPremium() {
        SubscriptionTier expired = tier("u1", true, 5, NOW.minusSeconds(60));

        assertThat(gate.isDue(expired, NOW.minusSeconds(10 * 60), NOW)).isFalse();
        assertThat(gate.isDue(expired, NOW.minusSeconds(15 * 60), NOW)).isTrue();
    }

    @Test
    @DisplayName("never-priced assets are due immediately")
    void neverPriced() {
        assertThat(gate.isDue(tier("u1", false, 0, null), null, NOW)).isTrue();
    }

    @Test
    @DisplayName("selects due users once each and skips users without listed assets")
    void selectEligibleUsers() {
        when(subscriptionTierRepository.findAll()).thenReturn(List.of(
                tier("due", false, 0, null),
                tier("recent", true, 5, null),
                tier("empty", false, 0, null),
                tier("due", false, 0, null),
                tier(null, false, 0, null)));
        lastUpdate("due", NOW.minusSeconds(20 * 60));
        lastUpdate("recent", NOW.minusSeconds(60));
        when(assetRepository.findMostRecentlyUpdatedListed("empty")).thenReturn(Optional.empty());

        assertThat(gate.selectEligibleUsers(NOW)).containsExactly("due");
    }

    @Test
    @DisplayName("a failing lookup for one user does not block the others")
    void lookupFailureIsolated() {
        when(subscriptionTierRepository.findAll()).thenReturn(List.of(tier("broken", false, 0, null), tier("ok", false, 0, null)));
        when(assetRepository.findMostRecentlyUpdatedListed("broken"))
                .thenThrow(new DataAccessResourceFailureException("timeout"));
        lastUpdate("ok", null);

        assertThat(gate.selectEligibleUsers(NOW)).containsExactly("ok");
    }
}
