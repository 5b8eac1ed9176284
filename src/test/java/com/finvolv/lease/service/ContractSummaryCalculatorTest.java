package com.finvolv.lease.service;

import com.finvolv.lease.model.BankTransaction;
import com.finvolv.lease.model.Contract;
import com.finvolv.lease.model.ContractSummary;
import com.finvolv.lease.model.Invoice;
import com.finvolv.lease.model.MonthlyAllocation;
import com.finvolv.lease.model.MonthlyIncome;
import com.finvolv.lease.model.RentTiers;
import com.finvolv.lease.model.ReportingWindow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ContractSummaryCalculator
 */
class ContractSummaryCalculatorTest {

    private static final double DELTA = 1e-6;

    private ContractSummaryCalculator calculator;
    private ReconciliationMatcher noSettlements;

    @BeforeEach
    void setUp() {
        calculator = new ContractSummaryCalculator(new ProrationEngine());
        noSettlements = new ReconciliationMatcher(Collections.emptyList(), Collections.emptyList());
    }

    private static Contract oneYearContract(int freeDays) {
        return Contract.builder()
            .customerName("广州YY商贸有限公司")
            .merchantId("G3-07")
            .deliveryDate(LocalDate.of(2025, 1, 1))
            .leaseEndDate(LocalDate.of(2025, 12, 31))
            .freeRentDays(freeDays)
            .rentTiers(RentTiers.of(12000.0))
            .build();
    }

    private static ReportingWindow window(int startYear, int startMonth, int endYear, int endMonth) {
        return ReportingWindow.of(YearMonth.of(startYear, startMonth), YearMonth.of(endYear, endMonth));
    }

    @Test
    void testSummarize_SingleMonthScenario() {
        ContractSummary summary = calculator.summarize(oneYearContract(0), window(2025, 1, 2025, 1), noSettlements);

        assertEquals(12000.0, summary.getTotalReceivable(), DELTA);
        assertEquals(144000.0, summary.getTotalContractReceivable(), DELTA);
        assertEquals(365, summary.getTotalContractDays());
        assertEquals(394.52, summary.getDailyIncomeRate(), 0.005);
        assertEquals(31, summary.getDaysInPeriod());
        assertEquals(12230.14, summary.getTotalIncome(), 0.005);
        assertTrue(summary.getNotes().isEmpty());
    }

    @Test
    void testSummarize_IncomeEqualsLifetimeReceivableOverWholeLease() {
        Contract contract = Contract.builder()
            .customerName("北京lbcy餐饮管理有限公司")
            .merchantId("B1-01c")
            .deliveryDate(LocalDate.of(2025, 5, 12))
            .leaseEndDate(LocalDate.of(2027, 5, 11))
            .freeRentDays(30)
            .rentTiers(RentTiers.of(26496.0, 27820.8))
            .build();

        ContractSummary summary = calculator.summarize(contract, window(2025, 5, 2027, 5), noSettlements);

        assertEquals(summary.getTotalContractReceivable(), summary.getTotalIncome(), DELTA);
        assertEquals(summary.getTotalContractReceivable(), summary.getTotalReceivable(), DELTA);
        assertEquals(730, summary.getTotalContractDays());
    }

    @Test
    void testSummarize_WindowOutsideLeaseIsZero() {
        ContractSummary summary = calculator.summarize(oneYearContract(0), window(2023, 1, 2023, 6), noSettlements);

        assertEquals(0.0, summary.getTotalReceivable(), DELTA);
        assertEquals(0.0, summary.getTotalIncome(), DELTA);
        assertEquals(0, summary.getDaysInPeriod());
        assertEquals(144000.0, summary.getTotalContractReceivable(), DELTA);
    }

    @Test
    void testSummarize_MissingDeliveryDateGivesZeroSummary() {
        Contract contract = oneYearContract(0).toBuilder().deliveryDate(null).build();

        ContractSummary summary = calculator.summarize(contract, window(2025, 1, 2025, 12), noSettlements);

        assertEquals(0.0, summary.getTotalReceivable(), DELTA);
        assertEquals(0.0, summary.getTotalIncome(), DELTA);
        assertEquals(0.0, summary.getBankMatched(), DELTA);
        assertTrue(summary.getNotes().isEmpty());
        assertTrue(calculator.monthlyReceivables(contract, window(2025, 1, 2025, 12), false).isEmpty());
        assertTrue(calculator.monthlyIncome(contract, window(2025, 1, 2025, 12), 10.0).isEmpty());
    }

    @Test
    void testSummarize_MissingLeaseEndGivesZeroSummaryWithNote() {
        Contract contract = oneYearContract(0).toBuilder().leaseEndDate(null).build();

        ContractSummary summary = calculator.summarize(contract, window(2025, 1, 2025, 12), noSettlements);

        assertEquals(0.0, summary.getTotalReceivable(), DELTA);
        assertEquals(1, summary.getNotes().size());
        assertTrue(summary.getNotes().get(0).startsWith("[Missing data]"));
        assertTrue(calculator.monthlyReceivables(contract, window(2025, 1, 2025, 12), true).isEmpty());
    }

    @Test
    void testSummarize_MatchesSettlementsInWindow() {
        ReconciliationMatcher matcher = new ReconciliationMatcher(
            List.of(BankTransaction.builder()
                .counterpartyName("广州YY商贸有限公司")
                .transactionDate(LocalDate.of(2025, 1, 20))
                .creditedAmount(12000.0)
                .build()),
            List.of(Invoice.builder()
                .buyerName("广州YY商贸有限公司")
                .invoiceDate(LocalDate.of(2025, 2, 1))
                .totalAmount(13560.0)
                .build()));

        ContractSummary summary = calculator.summarize(oneYearContract(0), window(2025, 1, 2025, 1), matcher);

        assertEquals(12000.0, summary.getBankMatched(), DELTA);
        assertEquals(0.0, summary.getInvoiceMatched(), DELTA);
    }

    @Test
    void testValidate_TierCountConflictIsAdvisory() {
        Contract contract = oneYearContract(0).toBuilder().rentTiers(RentTiers.of(12000.0, 12600.0)).build();

        List<String> notes = calculator.validate(contract);
        ContractSummary summary = calculator.summarize(contract, window(2025, 1, 2025, 1), noSettlements);

        assertEquals(1, notes.size());
        assertTrue(notes.get(0).startsWith("[Data conflict]"));
        assertTrue(notes.get(0).contains("2025-12-31"));
        assertEquals(12000.0, summary.getTotalReceivable(), DELTA);
        assertEquals(notes, summary.getNotes());
    }

    @Test
    void testActualLeaseYears_PartialYearCountsAsYear() {
        assertEquals(1, ContractSummaryCalculator.actualLeaseYears(LocalDate.of(2025, 1, 1), LocalDate.of(2025, 12, 31)));
        assertEquals(2, ContractSummaryCalculator.actualLeaseYears(LocalDate.of(2025, 5, 12), LocalDate.of(2027, 5, 11)));
        assertEquals(5, ContractSummaryCalculator.actualLeaseYears(LocalDate.of(2024, 1, 1), LocalDate.of(2028, 12, 31)));
        assertEquals(2, ContractSummaryCalculator.actualLeaseYears(LocalDate.of(2025, 1, 1), LocalDate.of(2026, 3, 31)));
    }

    @Test
    void testMonthlyReceivables_SumMatchesSummaryAndDetailIsOptional() {
        Contract contract = oneYearContract(30);
        ReportingWindow window = window(2024, 11, 2025, 3);

        List<MonthlyAllocation> withDetail = calculator.monthlyReceivables(contract, window, true);
        List<MonthlyAllocation> withoutDetail = calculator.monthlyReceivables(contract, window, false);
        ContractSummary summary = calculator.summarize(contract, window, noSettlements);

        assertEquals(5, withDetail.size());
        assertEquals(YearMonth.of(2024, 11), withDetail.get(0).getMonth());
        assertNotNull(withDetail.get(2).getDetail());
        assertNull(withoutDetail.get(2).getDetail());
        assertEquals(summary.getTotalReceivable(),
            withDetail.stream().mapToDouble(MonthlyAllocation::getAmount).sum(), DELTA);
        assertEquals(0.0, withDetail.get(0).getAmount(), DELTA);
    }

    @Test
    void testMonthlyIncome_SumMatchesSummaryIncome() {
        Contract contract = oneYearContract(30);
        ReportingWindow window = window(2025, 2, 2026, 2);

        ContractSummary summary = calculator.summarize(contract, window, noSettlements);
        List<MonthlyIncome> rows = calculator.monthlyIncome(contract, window, summary.getDailyIncomeRate());

        assertEquals(13, rows.size());
        assertEquals(28, rows.get(0).getContractDaysInMonth());
        assertEquals(0, rows.get(12).getContractDaysInMonth());
        assertEquals(summary.getTotalIncome(), rows.stream().mapToDouble(MonthlyIncome::getAmount).sum(), DELTA);
    }
}
