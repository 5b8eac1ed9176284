package com.finvolv.lease.service;

import com.finvolv.lease.model.CalculationTrace;
import com.finvolv.lease.model.Contract;
import com.finvolv.lease.model.ContractSummary;
import com.finvolv.lease.model.DateSpan;
import com.finvolv.lease.model.MonthlyAllocation;
import com.finvolv.lease.model.MonthlyIncome;
import com.finvolv.lease.model.ReportingWindow;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.Period;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-contract totals for a reporting window.
 *
 * <p>Receivable is the sum of the engine's monthly figures for the months of the window.
 * Income is smoothed: the contract's lifetime receivable is spread evenly over every
 * lease day and the window collects {@code dailyIncomeRate × leaseDaysInWindow}.
 */
@Service
@RequiredArgsConstructor
public class ContractSummaryCalculator {

    private static final Logger logger = LoggerFactory.getLogger(ContractSummaryCalculator.class);

    private final ProrationEngine prorationEngine;

    public ContractSummary summarize(Contract contract, ReportingWindow window, ReconciliationMatcher matcher) {
        return summarize(contract, window, matcher, CalculationTrace.disabled());
    }

    public ContractSummary summarize(Contract contract,
                                     ReportingWindow window,
                                     ReconciliationMatcher matcher,
                                     CalculationTrace trace) {
        List<String> notes = validate(contract);

        trace.section("Contract " + contract.displayName());
        trace.record("Delivery date: {}, lease end: {}, free rent days: {}",
            contract.getDeliveryDate(), contract.getLeaseEndDate(), contract.getFreeRentDays());

        LocalDate deliveryDate = contract.getDeliveryDate();
        LocalDate leaseEndDate = contract.getLeaseEndDate();
        if (deliveryDate == null) {
            trace.record("No delivery date, all figures are 0");
            return ContractSummary.zero(contract, notes);
        }
        if (leaseEndDate == null) {
            List<String> withMissingEnd = new ArrayList<>(notes);
            withMissingEnd.add("[Missing data] " + contract.displayName() + ": no lease end date, all figures are 0.");
            trace.record("No lease end date, all figures are 0");
            return ContractSummary.zero(contract, withMissingEnd);
        }

        trace.record("Reporting period: {} to {}", window.startDate(), window.endDate());
        trace.section("Receivable");
        double totalReceivable = 0.0;
        for (YearMonth month : window.months()) {
            int offset = ProrationEngine.monthOffset(deliveryDate, month);
            totalReceivable += prorationEngine.allocate(contract, offset, trace).getAmount();
        }
        trace.record("Total receivable: {}", String.format("%.2f", totalReceivable));

        int lifetimeMonths = lifetimeMonthCount(deliveryDate, leaseEndDate);
        double totalContractReceivable = 0.0;
        for (int offset = 0; offset < lifetimeMonths; offset++) {
            totalContractReceivable += prorationEngine.monthlyRent(contract, offset);
        }

        DateSpan leaseSpan = DateSpan.of(deliveryDate, leaseEndDate);
        long totalContractDays = leaseSpan.days();
        double dailyIncomeRate = totalContractDays > 0 ? totalContractReceivable / totalContractDays : 0.0;
        long daysInPeriod = leaseSpan.overlapDays(window.span());
        double totalIncome = dailyIncomeRate * daysInPeriod;

        trace.section("Income");
        trace.record("Lifetime receivable {} over {} day(s), daily income rate {}",
            String.format("%.2f", totalContractReceivable), totalContractDays, String.format("%.4f", dailyIncomeRate));
        trace.record("Lease days in period: {}, total income: {}", daysInPeriod, String.format("%.2f", totalIncome));

        double bankMatched = matcher.matchBank(contract.getCustomerName(), window);
        double invoiceMatched = matcher.matchInvoice(contract.getCustomerName(), window);
        trace.section("Reconciliation");
        trace.record("Bank statements: {}, invoices: {}", String.format("%.2f", bankMatched), String.format("%.2f", invoiceMatched));

        return ContractSummary.builder()
            .contract(contract)
            .totalReceivable(totalReceivable)
            .totalIncome(totalIncome)
            .bankMatched(bankMatched)
            .invoiceMatched(invoiceMatched)
            .totalContractReceivable(totalContractReceivable)
            .totalContractDays(totalContractDays)
            .dailyIncomeRate(dailyIncomeRate)
            .daysInPeriod(daysInPeriod)
            .notes(notes)
            .build();
    }

    /**
     * Compares the lease length implied by the lease end date with the number of rent tiers
     * actually filled in. A mismatch is advisory; the lease end date stays authoritative.
     */
    public List<String> validate(Contract contract) {
        LocalDate deliveryDate = contract.getDeliveryDate();
        LocalDate leaseEndDate = contract.getLeaseEndDate();
        if (deliveryDate == null || leaseEndDate == null) {
            return Collections.emptyList();
        }

        int actualLeaseYears = actualLeaseYears(deliveryDate, leaseEndDate);
        int filledTiers = contract.getRentTiers() == null ? 0 : contract.getRentTiers().presentCount();
        if (filledTiers == actualLeaseYears) {
            return Collections.emptyList();
        }

        String note = String.format(
            "[Data conflict] %s: the lease end date implies about %d lease year(s), "
                + "but %d year(s) of base rent were provided. Calculation follows the lease end date (%s).",
            contract.displayName(), actualLeaseYears, filledTiers, leaseEndDate);
        logger.debug("Validation note for {}: {}", contract.displayName(), note);
        return List.of(note);
    }

    public List<MonthlyAllocation> monthlyReceivables(Contract contract, ReportingWindow window, boolean withDetail) {
        if (!contract.hasDeliveryDate() || contract.getLeaseEndDate() == null) {
            return Collections.emptyList();
        }
        List<MonthlyAllocation> rows = new ArrayList<>();
        for (YearMonth month : window.months()) {
            int offset = ProrationEngine.monthOffset(contract.getDeliveryDate(), month);
            MonthlyAllocation allocation = prorationEngine.allocate(contract, offset, CalculationTrace.disabled());
            rows.add(withDetail ? allocation : allocation.toBuilder().detail(null).build());
        }
        return rows;
    }

    public List<MonthlyIncome> monthlyIncome(Contract contract, ReportingWindow window, double dailyIncomeRate) {
        if (!contract.hasDeliveryDate() || contract.getLeaseEndDate() == null) {
            return Collections.emptyList();
        }
        DateSpan leaseSpan = DateSpan.of(contract.getDeliveryDate(), contract.getLeaseEndDate());
        List<MonthlyIncome> rows = new ArrayList<>();
        for (YearMonth month : window.months()) {
            long days = leaseSpan.overlapDays(DateSpan.ofMonth(month));
            rows.add(MonthlyIncome.builder()
                .contract(contract)
                .month(month)
                .dailyIncomeRate(dailyIncomeRate)
                .contractDaysInMonth(days)
                .amount(dailyIncomeRate * days)
                .build());
        }
        return rows;
    }

    /**
     * Whole years between delivery and the day after lease end, any remainder counting as a year.
     */
    static int actualLeaseYears(LocalDate deliveryDate, LocalDate leaseEndDate) {
        Period period = Period.between(deliveryDate, leaseEndDate.plusDays(1));
        return period.getYears() + (period.getMonths() > 0 || period.getDays() > 0 ? 1 : 0);
    }

    /** Calendar months from the delivery month through the lease-end month, inclusive. */
    static int lifetimeMonthCount(LocalDate deliveryDate, LocalDate leaseEndDate) {
        return (leaseEndDate.getYear() - deliveryDate.getYear()) * 12
            + (leaseEndDate.getMonthValue() - deliveryDate.getMonthValue()) + 1;
    }
}
