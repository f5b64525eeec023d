package com.vestpod.job;

import java.time.Duration;
import java.time.Instant;

/**
 * Counts reported by one job run. Failures are counted, not thrown: a run with errors still completed.
 *
 * @param usersFailed users whose refresh or alert pass aborted
 * @param errors      alerts that could not be evaluated (missing asset, write failure)
 */
public record RunSummary(
        String job,
        Instant startedAt,
        Instant finishedAt,
        int usersProcessed,
        int usersFailed,
        int assetsUpdated,
        int assetsFailed,
        int alertsChecked,
        int alertsTriggered,
        int notificationsSent,
        int errors) {

    public static RunSummary priceUpdate(Instant startedAt, Instant finishedAt, int usersProcessed, int usersFailed,
                                         int assetsUpdated, int assetsFailed) {
        return new RunSummary("price-update", startedAt, finishedAt, usersProcessed, usersFailed,
                assetsUpdated, assetsFailed, 0, 0, 0, 0);
    }

    public static RunSummary alertCheck(Instant startedAt, Instant finishedAt, int usersProcessed, int usersFailed,
                                        int alertsChecked, int alertsTriggered, int notificationsSent, int errors) {
        return new RunSummary("alert-check", startedAt, finishedAt, usersProcessed, usersFailed,
                0, 0, alertsChecked, alertsTriggered, notificationsSent, errors);
    }

    /**
     * Combined counts of two runs executed back to back.
     */
    public RunSummary plus(RunSummary other) {
        return new RunSummary(
                job + "+" + other.job,
                startedAt.isBefore(other.startedAt) ? startedAt : other.startedAt,
                finishedAt.isAfter(other.finishedAt) ? finishedAt : other.finishedAt,
                usersProcessed + other.usersProcessed,
                usersFailed + other.usersFailed,
                assetsUpdated + other.assetsUpdated,
                assetsFailed + other.assetsFailed,
                alertsChecked + other.alertsChecked,
                alertsTriggered + other.alertsTriggered,
                notificationsSent + other.notificationsSent,
                errors + other.errors);
    }

    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }

    @Override
    public String toString() {
        return job + " in " + duration().toMillis() + "ms: usersProcessed=" + usersProcessed
                + ", usersFailed=" + usersFailed
                + ", assetsUpdated=" + assetsUpdated
                + ", assetsFailed=" + assetsFailed
                + ", alertsChecked=" + alertsChecked
                + ", alertsTriggered=" + alertsTriggered
                + ", notificationsSent=" + notificationsSent
                + ", errors=" + errors;
    }
}
