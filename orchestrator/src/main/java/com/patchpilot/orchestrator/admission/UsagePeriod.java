package com.patchpilot.orchestrator.admission;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Calendar periods the admission counters are kept for. Bounds are computed
 * in the configured zone so "today" means the operator's day, not UTC's.
 */
public enum UsagePeriod {
    DAY,
    MONTH;

    /** Half-open [start, end) window of this period containing {@code now}. */
    public Window windowAt(Instant now, ZoneId zone) {
        LocalDate date = now.atZone(zone).toLocalDate();
        LocalDate first = switch (this) {
            case DAY   -> date;
            case MONTH -> date.withDayOfMonth(1);
        };
        LocalDate next = switch (this) {
            case DAY   -> first.plusDays(1);
            case MONTH -> first.plusMonths(1);
        };
        ZonedDateTime start = first.atStartOfDay(zone);
        ZonedDateTime end   = next.atStartOfDay(zone);
        return new Window(start.toInstant(), end.toInstant());
    }

    public record Window(Instant start, Instant end) {}
}
