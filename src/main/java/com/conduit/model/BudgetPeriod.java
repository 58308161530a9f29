package com.conduit.model;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;

/**
 * Accounting period of a budget. Boundaries are computed in UTC.
 */
public enum BudgetPeriod {
    HOURLY,
    DAILY,
    WEEKLY,
    MONTHLY,
    NONE;

    /**
     * Start of the period containing {@code now}.
     */
    public Instant periodStart(Instant now) {
        ZonedDateTime utc = now.atZone(ZoneOffset.UTC);
        return switch (this) {
            case HOURLY -> utc.truncatedTo(ChronoUnit.HOURS).toInstant();
            case DAILY -> utc.truncatedTo(ChronoUnit.DAYS).toInstant();
            case WEEKLY -> utc.truncatedTo(ChronoUnit.DAYS)
                    .with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY))
                    .toInstant();
            case MONTHLY -> utc.truncatedTo(ChronoUnit.DAYS)
                    .with(TemporalAdjusters.firstDayOfMonth())
                    .toInstant();
            case NONE -> Instant.EPOCH;
        };
    }
}
