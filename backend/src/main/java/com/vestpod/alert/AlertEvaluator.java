package com.vestpod.alert;

import com.vestpod.alert.notification.NotificationSender;
import com.vestpod.domain.Alert;
import com.vestpod.domain.AlertRepository;
import com.vestpod.domain.Asset;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Runs one alert through its lifecycle. An ACTIVE alert is stamped as checked and saved before its
 * condition is evaluated; when the condition holds the user is notified and the alert becomes TRIGGERED.
 * A TRIGGERED alert is left alone, so it never notifies twice.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AlertEvaluator {

    static final String PRICE_ALERT_TITLE = "Price Alert Triggered";
    static final String FALLBACK_BODY = "Your alert condition has been met";

    private final AlertRepository alertRepository;
    private final AlertConditionEvaluator conditionEvaluator;
    private final NotificationSender notificationSender;
    private final Clock clock;

    /**
     * @throws org.springframework.dao.DataAccessException when the alert cannot be saved
     */
    public AlertCheckOutcome check(Alert alert, Asset asset) {
        if (!alert.isActive()) {
            return AlertCheckOutcome.skipped(alert.getId());
        }
        Instant now = clock.instant();
        alert.markChecked(now);
        alertRepository.save(alert);

        ConditionResult condition = conditionEvaluator.evaluate(alert, asset, now);
        if (!condition.triggered()) {
            return AlertCheckOutcome.notTriggered(alert.getId());
        }

        String body = condition.reason() != null ? condition.reason() : FALLBACK_BODY;
        boolean sent = notify(alert, body);
        alert.trigger(now, body);
        alertRepository.save(alert);
        log.info("Alert {} of user {} triggered: {}", alert.getId(), alert.getOwnerId(), body);
        return AlertCheckOutcome.triggered(alert.getId(), body, sent);
    }

    private boolean notify(Alert alert, String body) {
        try {
            boolean sent = notificationSender.send(alert.getOwnerId(), PRICE_ALERT_TITLE, body, alert.getId());
            if (!sent) {
                log.warn("Notification for alert {} was not delivered", alert.getId());
            }
            return sent;
        } catch (RuntimeException e) {
            log.warn("Notification for alert {} failed: {}", alert.getId(), e.getMessage());
            return false;
        }
    }
}
