package com.vestpod.alert;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.ZoneId;

/**
 * Alert check job configuration. Documented in application.yml under vestpod.alerts.
 */
@ConfigurationProperties(prefix = "vestpod.alerts")
@Validated
@Getter
@Setter
public class AlertProperties {

    private boolean enabled = true;

    /** Spring cron expression for the scheduled check. */
    private String cron = "0 */5 * * * *";

    /** Zone in which a maturity date starts; the asset matures at local midnight of that day. */
    @NotNull
    private ZoneId maturityZone = ZoneId.of("UTC");

    /** Users checked concurrently (size of alert-check-executor). Alerts of one user are checked in order. */
    @Min(1)
    private int userParallelism = 4;
}
