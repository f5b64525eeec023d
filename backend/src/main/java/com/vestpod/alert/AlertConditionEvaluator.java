package com.vestpod.alert;

import com.vestpod.domain.Alert;
import com.vestpod.domain.AlertOperator;
import com.vestpod.domain.Asset;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Pure condition checks. Missing inputs (price, threshold, operator, purchase price, maturity date)
 * mean "not triggered", never an error.
 */
@Slf4j
public class AlertConditionEvaluator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final int PERCENT_SCALE = 8;

    private final ZoneId maturityZone;

    public AlertConditionEvaluator(ZoneId maturityZone) {
        this.maturityZone = maturityZone;
    }

    public ConditionResult evaluate(Alert alert, Asset asset, Instant now) {
        if (alert.getKind() == null) {
            return ConditionResult.notTriggered();
        }
        return switch (alert.getKind()) {
            case PRICE_TARGET -> priceTarget(alert.getOperator(), alert.getThresholdValue(), asset);
            case PERCENTAGE_CHANGE -> percentageChange(alert.getOperator(), alert.getThresholdValue(), asset);
            case MATURITY_REMINDER -> maturityReminder(alert.getReminderDaysBefore(), asset, now);
        };
    }

    /**
     * ABOVE: price &gt;= threshold. BELOW: price &lt;= threshold. Both bounds inclusive.
     */
    ConditionResult priceTarget(AlertOperator operator, BigDecimal threshold, Asset asset) {
        BigDecimal price = asset.getCurrentPrice();
        if (price == null || threshold == null || operator == null) {
            return ConditionResult.notTriggered();
        }
        if (operator == AlertOperator.ABOVE && price.compareTo(threshold) >= 0) {
            return ConditionResult.triggered(asset.displayName() + " reached " + money(price)
                    + ", above target of " + money(threshold));
        }
        if (operator == AlertOperator.BELOW && price.compareTo(threshold) <= 0) {
            return ConditionResult.triggered(asset.displayName() + " dropped to " + money(price)
                    + ", below target of " + money(threshold));
        }
        return ConditionResult.notTriggered();
    }

    /**
     * Change against the purchase price, not against the previous check.
     */
    ConditionResult percentageChange(AlertOperator operator, BigDecimal threshold, Asset asset) {
        BigDecimal price = asset.getCurrentPrice();
        BigDecimal purchase = asset.getPurchasePrice();
        if (price == null || threshold == null || operator == null || purchase == null || purchase.signum() == 0) {
            return ConditionResult.notTriggered();
        }
        BigDecimal change = price.subtract(purchase)
                .multiply(HUNDRED)
                .divide(purchase, PERCENT_SCALE, RoundingMode.HALF_UP);
        if (operator == AlertOperator.CHANGE_UP && change.compareTo(threshold) >= 0) {
            return ConditionResult.triggered(asset.displayName() + " increased by " + percent(change)
                    + ", exceeding target of " + percent(threshold));
        }
        if (operator == AlertOperator.CHANGE_DOWN && change.compareTo(threshold.negate()) <= 0) {
            return ConditionResult.triggered(asset.displayName() + " decreased by " + percent(change.abs())
                    + ", exceeding target of " + percent(threshold));
        }
        return ConditionResult.notTriggered();
    }

    /**
     * Fires in [maturity - daysBefore, maturity), day starts taken in the maturity zone.
     */
    ConditionResult maturityReminder(Integer daysBefore, Asset asset, Instant now) {
        LocalDate maturityDate = asset.getMaturityDate();
        if (maturityDate == null || daysBefore == null || daysBefore < 0) {
            return ConditionResult.notTriggered();
        }
        Instant maturity = maturityDate.atStartOfDay(maturityZone).toInstant();
        Instant reminderFrom = maturityDate.minusDays(daysBefore).atStartOfDay(maturityZone).toInstant();
        if (now.isBefore(reminderFrom) || !now.isBefore(maturity)) {
            return ConditionResult.notTriggered();
        }
        long millisLeft = Duration.between(now, maturity).toMillis();
        long days = (millisLeft + Duration.ofDays(1).toMillis() - 1) / Duration.ofDays(1).toMillis();
        String label = asset.getName() != null && !asset.getName().isBlank() ? asset.getName() : asset.displayName();
        return ConditionResult.triggered(label + " will mature in " + days + (days == 1 ? " day" : " days")
                + " on " + maturityDate.format(DateTimeFormatter.ISO_LOCAL_DATE));
    }

    private static String money(BigDecimal value) {
        return "$" + value.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    private static String percent(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP).toPlainString() + "%";
    }
}
