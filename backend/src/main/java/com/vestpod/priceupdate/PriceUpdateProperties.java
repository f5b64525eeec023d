package com.vestpod.priceupdate;

import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Price update job configuration. Documented in application.yml under vestpod.price-update.
 */
@ConfigurationProperties(prefix = "vestpod.price-update")
@Validated
@Getter
@Setter
public class PriceUpdateProperties {

    /** When false the scheduled tick does nothing; one-shot runs still work. */
    private boolean enabled = true;

    /** Spring cron expression for the scheduled tick. */
    private String cron = "0 */5 * * * *";

    /** Cadence for free users and for premium subscriptions that have expired. */
    @Min(1)
    private int freeFrequencyMinutes = 15;

    /** Cadence for premium users whose subscription record has no explicit cadence. */
    @Min(1)
    private int premiumFrequencyMinutes = 5;

    /** Users refreshed concurrently (size of price-update-executor). */
    @Min(1)
    private int userParallelism = 4;

    /** Asset-class fetches running concurrently across all users (size of quote-fetch-executor). */
    @Min(1)
    private int quoteFetchParallelism = 6;
}
