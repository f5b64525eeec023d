package com.vestpod.alert;

/**
 * Result of checking one alert.
 */
public record AlertCheckOutcome(String alertId, Status status, String reason, boolean notificationSent) {

    public enum Status {
        /** Already TRIGGERED; nothing was touched. */
        SKIPPED,
        NOT_TRIGGERED,
        TRIGGERED
    }

    public static AlertCheckOutcome skipped(String alertId) {
        return new AlertCheckOutcome(alertId, Status.SKIPPED, null, false);
    }

    public static AlertCheckOutcome notTriggered(String alertId) {
        return new AlertCheckOutcome(alertId, Status.NOT_TRIGGERED, null, false);
    }

    public static AlertCheckOutcome triggered(String alertId, String reason, boolean notificationSent) {
        return new AlertCheckOutcome(alertId, Status.TRIGGERED, reason, notificationSent);
    }

    public boolean isTriggered() {
        return status == Status.TRIGGERED;
    }
}
