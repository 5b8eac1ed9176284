package com.finvolv.lease.model;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;

/**
 * Closed date interval [start, end]. A span with a missing bound, or whose end precedes its start, is empty.
 */
public record DateSpan(LocalDate start, LocalDate end) {

    public static DateSpan of(LocalDate start, LocalDate end) {
        return new DateSpan(start, end);
    }

    public static DateSpan ofMonth(YearMonth month) {
        return new DateSpan(month.atDay(1), month.atEndOfMonth());
    }

    public boolean isEmpty() {
        return start == null || end == null || start.isAfter(end);
    }

    /** Inclusive day count; 0 when empty. */
    public long days() {
        return isEmpty() ? 0 : ChronoUnit.DAYS.between(start, end) + 1;
    }

    public DateSpan intersect(DateSpan other) {
        if (isEmpty() || other.isEmpty()) {
            return new DateSpan(null, null);
        }
        LocalDate from = start.isAfter(other.start) ? start : other.start;
        LocalDate to = end.isBefore(other.end) ? end : other.end;
        return new DateSpan(from, to);
    }

    public long overlapDays(DateSpan other) {
        return intersect(other).days();
    }

    public boolean contains(LocalDate date) {
        return !isEmpty() && date != null && !date.isBefore(start) && !date.isAfter(end);
    }
}
