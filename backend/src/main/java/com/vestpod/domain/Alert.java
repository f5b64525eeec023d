package com.vestpod.domain;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * User-defined alert on one asset. ACTIVE until its condition is met once, then TRIGGERED for good.
 * State only moves through {@link #trigger(Instant, String)}.
 */
@Document(collection = "alerts")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Alert {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed
    private String ownerId;
    private String assetId;
    private AlertKind kind;
    private AlertOperator operator;
    private BigDecimal thresholdValue;
    private Integer reminderDaysBefore;
    @Indexed
    @Setter(AccessLevel.NONE)
    private AlertState state = AlertState.ACTIVE;
    private Instant lastCheckedAt;
    @Setter(AccessLevel.NONE)
    private Instant triggeredAt;
    @Setter(AccessLevel.NONE)
    private String triggerReason;

    public boolean isActive() {
        return state == AlertState.ACTIVE;
    }

    public void markChecked(Instant now) {
        this.lastCheckedAt = now;
    }

    /**
     * ACTIVE -> TRIGGERED. Fails on an alert that already fired.
     */
    public void trigger(Instant now, String reason) {
        if (state == AlertState.TRIGGERED) {
            throw new IllegalStateException("Alert " + id + " already triggered at " + triggeredAt);
        }
        this.state = AlertState.TRIGGERED;
        this.triggeredAt = now;
        this.triggerReason = reason;
    }
}
