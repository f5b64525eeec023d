package com.vestpod.alert;

/**
 * Whether an alert condition holds, and the reason shown to the user when it does.
 */
public record ConditionResult(boolean triggered, String reason) {

    private static final ConditionResult NOT_TRIGGERED = new ConditionResult(false, null);

    public static ConditionResult notTriggered() {
        return NOT_TRIGGERED;
    }

    public static ConditionResult triggered(String reason) {
        return new ConditionResult(true, reason);
    }
}
