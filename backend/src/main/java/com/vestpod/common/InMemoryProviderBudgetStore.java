package com.vestpod.common;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide budget counters. One instance per application.
 */
public class InMemoryProviderBudgetStore implements ProviderBudgetStore {

    private final Map<String, ProviderBudget> budgets = new ConcurrentHashMap<>();

    @Override
    public boolean tryAcquire(String providerId, List<BudgetWindow> windows, Instant now) {
        ProviderBudget budget = budgets.computeIfAbsent(providerId, id -> new ProviderBudget(id, List.of()));
        synchronized (budget) {
            return budget.tryAcquire(windows, now);
        }
    }

    @Override
    public Optional<ProviderBudget> find(String providerId) {
        ProviderBudget budget = budgets.get(providerId);
        if (budget == null) {
            return Optional.empty();
        }
        synchronized (budget) {
            return Optional.of(budget.copy());
        }
    }
}
