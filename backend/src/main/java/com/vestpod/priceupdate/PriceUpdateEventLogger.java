package com.vestpod.priceupdate;

import com.vestpod.domain.PriceUpdateEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Default consumer of {@link PriceUpdateEvent}: logs what a realtime channel would broadcast to the user.
 */
@Component
@Slf4j
public class PriceUpdateEventLogger {

    @EventListener
    public void onPriceUpdate(PriceUpdateEvent event) {
        log.info("Broadcast price update to user {}: {} asset(s)", event.ownerId(), event.updates().size());
        for (PriceUpdateEvent.AssetPriceChange change : event.updates()) {
            log.debug("  {} {} -> {} ({}%) via {}{}", change.symbol(), change.oldPrice(), change.newPrice(),
                    change.priceChangePercent(), change.sourceProviderId(), change.degraded() ? " (backup)" : "");
        }
    }
}
