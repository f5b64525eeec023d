package com.vestpod.common;

/**
 * Configured call budget for one window of a provider, e.g. 25 per DAY.
 */
public record BudgetWindow(WindowKind kind, int limit) {

    public BudgetWindow {
        if (kind == null) {
            throw new IllegalArgumentException("kind is required");
        }
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative");
        }
    }
}
