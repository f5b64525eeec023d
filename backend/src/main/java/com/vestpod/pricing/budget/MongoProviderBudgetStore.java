package com.vestpod.pricing.budget;

import com.vestpod.common.BudgetWindow;
import com.vestpod.common.ProviderBudget;
import com.vestpod.common.ProviderBudgetStore;
import com.vestpod.common.WindowCounter;
import com.vestpod.common.WindowKind;
import com.vestpod.domain.ProviderBudgetDocument;
import com.vestpod.domain.ProviderBudgetRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.OptimisticLockingFailureException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Budget counters shared by every instance through the provider_budgets collection.
 * Read-modify-write guarded by the document version; a lost race is replayed on fresh state.
 */
@RequiredArgsConstructor
@Slf4j
public class MongoProviderBudgetStore implements ProviderBudgetStore {

    static final int MAX_CONFLICT_RETRIES = 5;

    private final ProviderBudgetRepository repository;

    @Override
    public boolean tryAcquire(String providerId, List<BudgetWindow> windows, Instant now) {
        for (int attempt = 1; ; attempt++) {
            ProviderBudgetDocument doc = repository.findById(providerId).orElseGet(() -> newDocument(providerId));
            ProviderBudget budget = toBudget(doc);
            boolean acquired = budget.tryAcquire(windows, now);
            writeBack(budget, doc);
            try {
                repository.save(doc);
                return acquired;
            } catch (OptimisticLockingFailureException | DuplicateKeyException e) {
                if (attempt >= MAX_CONFLICT_RETRIES) {
                    throw e;
                }
                log.debug("Budget update conflict for {} (attempt {}), replaying", providerId, attempt);
            }
        }
    }

    @Override
    public Optional<ProviderBudget> find(String providerId) {
        return repository.findById(providerId).map(MongoProviderBudgetStore::toBudget);
    }

    private static ProviderBudgetDocument newDocument(String providerId) {
        ProviderBudgetDocument doc = new ProviderBudgetDocument();
        doc.setId(providerId);
        return doc;
    }

    static ProviderBudget toBudget(ProviderBudgetDocument doc) {
        List<WindowCounter> counters = new ArrayList<>();
        for (ProviderBudgetDocument.Window w : doc.getWindows()) {
            counters.add(new WindowCounter(WindowKind.valueOf(w.getKind()), w.getLimit(), w.getCount(), w.getWindowResetAt()));
        }
        return new ProviderBudget(doc.getId(), counters);
    }

    private static void writeBack(ProviderBudget budget, ProviderBudgetDocument doc) {
        List<ProviderBudgetDocument.Window> windows = new ArrayList<>();
        for (WindowCounter c : budget.getCounters()) {
            ProviderBudgetDocument.Window w = new ProviderBudgetDocument.Window();
            w.setKind(c.getKind().name());
            w.setLimit(c.getLimit());
            w.setCount(c.getCount());
            w.setWindowResetAt(c.getWindowResetAt());
            windows.add(w);
        }
        doc.setWindows(windows);
    }
}
