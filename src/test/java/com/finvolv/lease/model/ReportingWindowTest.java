package com.finvolv.lease.model;

import com.finvolv.lease.exception.InvalidReportingWindowException;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ReportingWindow and DateSpan
 */
class ReportingWindowTest {

    @Test
    void testParse_MonthAndDateForms() {
        ReportingWindow window = ReportingWindow.parse("2025-08", "2025-12-01");

        assertEquals(YearMonth.of(2025, 8), window.startMonth());
        assertEquals(YearMonth.of(2025, 12), window.endMonth());
        assertEquals(LocalDate.of(2025, 8, 1), window.startDate());
        assertEquals(LocalDate.of(2025, 12, 31), window.endDate());
        assertEquals(5, window.months().size());
    }

    @Test
    void testParse_DayPartIgnored() {
        ReportingWindow window = ReportingWindow.parse("2024-02-15", "2024-02-03");

        assertEquals(List.of(YearMonth.of(2024, 2)), window.months());
        assertEquals(LocalDate.of(2024, 2, 29), window.endDate());
        assertEquals(29, window.span().days());
    }

    @Test
    void testParse_InvertedWindowRejected() {
        InvalidReportingWindowException error = assertThrows(InvalidReportingWindowException.class,
            () -> ReportingWindow.parse("2025-12", "2025-08"));
        assertTrue(error.getMessage().contains("2025-12"));
    }

    @Test
    void testParse_MissingOrGarbageRejected() {
        assertThrows(InvalidReportingWindowException.class, () -> ReportingWindow.parse("", "2025-08"));
        assertThrows(InvalidReportingWindowException.class, () -> ReportingWindow.parse("2025-08", null));
        assertThrows(InvalidReportingWindowException.class, () -> ReportingWindow.parse("August", "2025-09"));
        assertThrows(InvalidReportingWindowException.class, () -> ReportingWindow.parse("2025-13", "2025-12"));
    }

    @Test
    void testDateSpan_InclusiveDaysAndOverlap() {
        DateSpan lease = DateSpan.of(LocalDate.of(2025, 1, 15), LocalDate.of(2025, 3, 10));

        assertEquals(55, lease.days());
        assertEquals(17, lease.overlapDays(DateSpan.ofMonth(YearMonth.of(2025, 1))));
        assertEquals(28, lease.overlapDays(DateSpan.ofMonth(YearMonth.of(2025, 2))));
        assertEquals(10, lease.overlapDays(DateSpan.ofMonth(YearMonth.of(2025, 3))));
        assertEquals(0, lease.overlapDays(DateSpan.ofMonth(YearMonth.of(2025, 4))));
    }

    @Test
    void testDateSpan_EmptySpans() {
        assertTrue(DateSpan.of(LocalDate.of(2025, 2, 1), LocalDate.of(2025, 1, 31)).isEmpty());
        assertTrue(DateSpan.of(null, LocalDate.of(2025, 1, 31)).isEmpty());
        assertEquals(0, DateSpan.of(LocalDate.of(2025, 1, 1), null).days());
        assertFalse(DateSpan.of(LocalDate.of(2025, 1, 1), null).contains(LocalDate.of(2025, 1, 1)));
    }
}
