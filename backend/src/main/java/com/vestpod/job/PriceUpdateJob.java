package com.vestpod.job;

import com.vestpod.config.AsyncConfig;
import com.vestpod.priceupdate.BatchPriceFetcher;
import com.vestpod.priceupdate.PriceUpdateProperties;
import com.vestpod.priceupdate.UpdateEligibilityGate;
import com.vestpod.priceupdate.UserPriceRefreshResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Price update tick: selects due users and refreshes them in parallel on price-update-executor.
 * One user's failure is counted and logged; the others carry on.
 */
@Component
@Slf4j
public class PriceUpdateJob {

    private final UpdateEligibilityGate eligibilityGate;
    private final BatchPriceFetcher batchPriceFetcher;
    private final PriceUpdateProperties properties;
    private final AsyncTaskExecutor priceUpdateExecutor;
    private final Clock clock;

    public PriceUpdateJob(UpdateEligibilityGate eligibilityGate,
                          BatchPriceFetcher batchPriceFetcher,
                          PriceUpdateProperties properties,
                          @Qualifier(AsyncConfig.PRICE_UPDATE_EXECUTOR) AsyncTaskExecutor priceUpdateExecutor,
                          Clock clock) {
        this.eligibilityGate = eligibilityGate;
        this.batchPriceFetcher = batchPriceFetcher;
        this.properties = properties;
        this.priceUpdateExecutor = priceUpdateExecutor;
        this.clock = clock;
    }

    @Scheduled(cron = "${vestpod.price-update.cron:0 */5 * * * *}")
    public void runScheduled() {
        if (!properties.isEnabled()) {
            return;
        }
        try {
            run();
        } catch (RuntimeException e) {
            log.error("Price update run failed", e);
        }
    }

    public RunSummary run() {
        Instant startedAt = clock.instant();
        List<String> users = eligibilityGate.selectEligibleUsers(startedAt);

        List<Future<UserPriceRefreshResult>> futures = new ArrayList<>(users.size());
        for (String ownerId : users) {
            futures.add(priceUpdateExecutor.submit(() -> batchPriceFetcher.refreshUser(ownerId)));
        }

        int processed = 0;
        int usersFailed = 0;
        int assetsUpdated = 0;
        int assetsFailed = 0;
        for (int i = 0; i < futures.size(); i++) {
            String ownerId = users.get(i);
            try {
                UserPriceRefreshResult result = futures.get(i).get();
                processed++;
                assetsUpdated += result.assetsUpdated();
                assetsFailed += result.assetsFailed();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(true));
                throw new CancellationException("Price update run interrupted after " + processed + " user(s)");
            } catch (ExecutionException e) {
                usersFailed++;
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.warn("Price refresh failed for user {}: {}", ownerId, cause.getMessage(), cause);
            }
        }

        RunSummary summary = RunSummary.priceUpdate(startedAt, clock.instant(), processed, usersFailed,
                assetsUpdated, assetsFailed);
        log.info("Price update completed: {}", summary);
        return summary;
    }
}
