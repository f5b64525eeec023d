package com.vestpod.common;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Where provider budget counters live. In-memory for a single instance; a shared store when
 * several instances spend the same provider credentials.
 */
public interface ProviderBudgetStore {

    /**
     * Atomically applies {@link ProviderBudget#tryAcquire} to the stored budget of the provider.
     */
    boolean tryAcquire(String providerId, List<BudgetWindow> windows, Instant now);

    /**
     * Copy of the current counters, empty when the provider was never charged.
     */
    Optional<ProviderBudget> find(String providerId);
}
