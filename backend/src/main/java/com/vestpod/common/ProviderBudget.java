package com.vestpod.common;

import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Call budget state for one provider across all its windows. Not thread-safe; stores guard access.
 */
@Getter
public class ProviderBudget {

    private final String providerId;
    private final List<WindowCounter> counters;

    public ProviderBudget(String providerId, List<WindowCounter> counters) {
        this.providerId = providerId;
        this.counters = new ArrayList<>(counters != null ? counters : List.of());
    }

    /**
     * Takes one call from every window, or none if any window is spent.
     * Windows whose reset time has passed start over before the check.
     */
    public boolean tryAcquire(List<BudgetWindow> windows, Instant now) {
        alignWith(windows);
        for (WindowCounter counter : counters) {
            counter.rollOverIfDue(now);
        }
        for (WindowCounter counter : counters) {
            if (!counter.hasHeadroom()) {
                return false;
            }
        }
        for (WindowCounter counter : counters) {
            counter.setCount(counter.getCount() + 1);
        }
        return true;
    }

    private void alignWith(List<BudgetWindow> windows) {
        List<WindowCounter> aligned = new ArrayList<>(windows.size());
        for (BudgetWindow window : windows) {
            WindowCounter existing = counters.stream()
                    .filter(c -> c.getKind() == window.kind())
                    .findFirst()
                    .orElseGet(() -> new WindowCounter(window.kind(), window.limit()));
            existing.setLimit(window.limit());
            aligned.add(existing);
        }
        counters.clear();
        counters.addAll(aligned);
    }

    public ProviderBudget copy() {
        List<WindowCounter> copies = new ArrayList<>(counters.size());
        for (WindowCounter c : counters) {
            copies.add(new WindowCounter(c.getKind(), c.getLimit(), c.getCount(), c.getWindowResetAt()));
        }
        return new ProviderBudget(providerId, copies);
    }
}
