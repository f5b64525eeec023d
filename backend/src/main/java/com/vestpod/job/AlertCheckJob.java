package com.vestpod.job;

import com.vestpod.alert.AlertCheckOutcome;
import com.vestpod.alert.AlertEvaluator;
import com.vestpod.alert.AlertProperties;
import com.vestpod.config.AsyncConfig;
import com.vestpod.domain.Alert;
import com.vestpod.domain.AlertRepository;
import com.vestpod.domain.AlertState;
import com.vestpod.domain.Asset;
import com.vestpod.domain.AssetRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Alert check tick: every ACTIVE alert is evaluated against the stored prices. Alerts of one user run in
 * order on one thread; users run in parallel on alert-check-executor.
 */
@Component
@Slf4j
public class AlertCheckJob {

    private final AlertRepository alertRepository;
    private final AssetRepository assetRepository;
    private final AlertEvaluator alertEvaluator;
    private final AlertProperties properties;
    private final AsyncTaskExecutor alertCheckExecutor;
    private final Clock clock;

    public AlertCheckJob(AlertRepository alertRepository,
                         AssetRepository assetRepository,
                         AlertEvaluator alertEvaluator,
                         AlertProperties properties,
                         @Qualifier(AsyncConfig.ALERT_CHECK_EXECUTOR) AsyncTaskExecutor alertCheckExecutor,
                         Clock clock) {
        this.alertRepository = alertRepository;
        this.assetRepository = assetRepository;
        this.alertEvaluator = alertEvaluator;
        this.properties = properties;
        this.alertCheckExecutor = alertCheckExecutor;
        this.clock = clock;
    }

    @Scheduled(cron = "${vestpod.alerts.cron:0 */5 * * * *}")
    public void runScheduled() {
        if (!properties.isEnabled()) {
            return;
        }
        try {
            run();
        } catch (RuntimeException e) {
            log.error("Alert check run failed", e);
        }
    }

    public RunSummary run() {
        Instant startedAt = clock.instant();
        List<Alert> active = alertRepository.findByState(AlertState.ACTIVE);
        Map<String, List<Alert>> byOwner = new LinkedHashMap<>();
        for (Alert alert : active) {
            byOwner.computeIfAbsent(Objects.requireNonNullElse(alert.getOwnerId(), ""), k -> new ArrayList<>()).add(alert);
        }
        log.info("Checking {} active alert(s) of {} user(s)", active.size(), byOwner.size());

        List<String> owners = new ArrayList<>(byOwner.keySet());
        List<Future<UserTally>> futures = new ArrayList<>(owners.size());
        for (String ownerId : owners) {
            List<Alert> alerts = byOwner.get(ownerId);
            futures.add(alertCheckExecutor.submit(() -> checkUser(ownerId, alerts)));
        }

        int processed = 0;
        int usersFailed = 0;
        int checked = 0;
        int triggered = 0;
        int sent = 0;
        int errors = 0;
        for (int i = 0; i < futures.size(); i++) {
            try {
                UserTally tally = futures.get(i).get();
                processed++;
                checked += tally.checked();
                triggered += tally.triggered();
                sent += tally.sent();
                errors += tally.errors();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(true));
                throw new CancellationException("Alert check run interrupted after " + processed + " user(s)");
            } catch (ExecutionException e) {
                usersFailed++;
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.warn("Alert check failed for user {}: {}", owners.get(i), cause.getMessage(), cause);
            }
        }

        RunSummary summary = RunSummary.alertCheck(startedAt, clock.instant(), processed, usersFailed,
                checked, triggered, sent, errors);
        log.info("Alert check completed: {}", summary);
        return summary;
    }

    UserTally checkUser(String ownerId, List<Alert> alerts) {
        Set<String> assetIds = new LinkedHashSet<>();
        for (Alert alert : alerts) {
            if (alert.getAssetId() != null) {
                assetIds.add(alert.getAssetId());
            }
        }
        Map<String, Asset> assets = new HashMap<>();
        for (Asset asset : assetRepository.findAllById(assetIds)) {
            assets.put(asset.getId(), asset);
        }

        int checked = 0;
        int triggered = 0;
        int sent = 0;
        int errors = 0;
        for (Alert alert : alerts) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("Alert check for user " + ownerId + " cancelled");
            }
            Asset asset = alert.getAssetId() != null ? assets.get(alert.getAssetId()) : null;
            if (asset == null) {
                errors++;
                log.warn("Alert {} of user {} has no associated asset {}", alert.getId(), ownerId, alert.getAssetId());
                continue;
            }
            try {
                AlertCheckOutcome outcome = alertEvaluator.check(alert, asset);
                checked++;
                if (outcome.isTriggered()) {
                    triggered++;
                    if (outcome.notificationSent()) {
                        sent++;
                    }
                }
            } catch (RuntimeException e) {
                errors++;
                log.warn("Alert {} of user {} could not be checked: {}", alert.getId(), ownerId, e.getMessage());
            }
        }
        return new UserTally(checked, triggered, sent, errors);
    }

    record UserTally(int checked, int triggered, int sent, int errors) {
    }
}
