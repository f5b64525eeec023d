package com.vestpod.common;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-provider call budgets over minute/day/month windows. Non-blocking: a spent budget
 * means the call is skipped for this cycle. Must be consulted before every outbound request,
 * retries included.
 */
public class RateLimiter {

    private final Map<String, List<BudgetWindow>> windowsByProvider;
    private final ProviderBudgetStore store;
    private final Clock clock;

    /**
     * @param windowsByProvider provider id to its windows; providers not listed are unlimited
     */
    public RateLimiter(Map<String, List<BudgetWindow>> windowsByProvider, ProviderBudgetStore store, Clock clock) {
        this.windowsByProvider = Map.copyOf(windowsByProvider);
        this.store = store;
        this.clock = clock;
    }

    /**
     * Returns true and charges every window of the provider if all have headroom.
     */
    public boolean tryAcquire(String providerId) {
        List<BudgetWindow> windows = windowsByProvider.get(providerId);
        if (windows == null || windows.isEmpty()) {
            return true;
        }
        return store.tryAcquire(providerId, windows, clock.instant());
    }

    /**
     * Current counters for the provider, e.g. for logging remaining calls.
     */
    public Optional<ProviderBudget> status(String providerId) {
        return store.find(providerId);
    }
}
