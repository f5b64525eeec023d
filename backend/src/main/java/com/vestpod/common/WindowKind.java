package com.vestpod.common;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Rate-limit window sizes. Boundaries are UTC calendar boundaries.
 */
public enum WindowKind {
    MINUTE,
    DAY,
    MONTH;

    /**
     * First boundary strictly after {@code now}.
     */
    public Instant nextBoundary(Instant now) {
        return switch (this) {
            case MINUTE -> now.truncatedTo(ChronoUnit.MINUTES).plus(1, ChronoUnit.MINUTES);
            case DAY -> now.truncatedTo(ChronoUnit.DAYS).plus(1, ChronoUnit.DAYS);
            case MONTH -> ZonedDateTime.ofInstant(now, ZoneOffset.UTC)
                    .withDayOfMonth(1)
                    .truncatedTo(ChronoUnit.DAYS)
                    .plusMonths(1)
                    .toInstant();
        };
    }
}
