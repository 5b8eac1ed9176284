package com.finvolv.lease.model;

import com.finvolv.lease.exception.InvalidReportingWindowException;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Month-granular reporting window, both ends inclusive. Expands to
 * first day of the start month through last day of the end month.
 */
public record ReportingWindow(YearMonth startMonth, YearMonth endMonth) {

    public ReportingWindow {
        if (startMonth == null || endMonth == null) {
            throw new InvalidReportingWindowException("Both start and end month are required");
        }
        if (startMonth.isAfter(endMonth)) {
            throw new InvalidReportingWindowException(
                "Start month " + startMonth + " is after end month " + endMonth);
        }
    }

    public static ReportingWindow of(YearMonth startMonth, YearMonth endMonth) {
        return new ReportingWindow(startMonth, endMonth);
    }

    /**
     * Accepts {@code yyyy-MM} or {@code yyyy-MM-dd}; the day part is ignored.
     */
    public static ReportingWindow parse(String start, String end) {
        return new ReportingWindow(parseMonth(start, "start"), parseMonth(end, "end"));
    }

    static YearMonth parseMonth(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new InvalidReportingWindowException("Missing " + fieldName + " month (expected yyyy-MM or yyyy-MM-dd)");
        }
        String trimmed = value.trim();
        try {
            if (trimmed.length() > 7) {
                return YearMonth.from(LocalDate.parse(trimmed));
            }
            return YearMonth.parse(trimmed);
        } catch (DateTimeParseException e) {
            throw new InvalidReportingWindowException(
                "Invalid " + fieldName + " month '" + value + "' (expected yyyy-MM or yyyy-MM-dd)", e);
        }
    }

    public LocalDate startDate() {
        return startMonth.atDay(1);
    }

    public LocalDate endDate() {
        return endMonth.atEndOfMonth();
    }

    public DateSpan span() {
        return DateSpan.of(startDate(), endDate());
    }

    public List<YearMonth> months() {
        List<YearMonth> months = new ArrayList<>();
        for (YearMonth month = startMonth; !month.isAfter(endMonth); month = month.plusMonths(1)) {
            months.add(month);
        }
        return months;
    }
}
