package com.finvolv.lease.service;

import com.finvolv.lease.model.CalculationTrace;
import com.finvolv.lease.model.Contract;
import com.finvolv.lease.model.ContractRegistry;
import com.finvolv.lease.model.ContractSummary;
import com.finvolv.lease.model.LeaseReport;
import com.finvolv.lease.model.MonthlyAllocation;
import com.finvolv.lease.model.MonthlyIncome;
import com.finvolv.lease.model.ReportOptions;
import com.finvolv.lease.model.ReportingWindow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs every contract of a registry through the calculator and collects the summary,
 * monthly receivable and monthly income tables in registry order.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReportAggregator {

    private final ContractSummaryCalculator contractSummaryCalculator;

    public LeaseReport aggregate(ContractRegistry registry, ReportingWindow window, ReportOptions options) {
        CalculationTrace trace = options.traceOrDisabled();
        ReconciliationMatcher matcher = ReconciliationMatcher.forRegistry(registry);

        log.info("Calculating {} contract(s) for {} to {}, tiers: {}, diagnostics: {}",
            registry.size(), window.startMonth(), window.endMonth(), registry.getTierCount(), options.includeDiagnostics());
        trace.record("Lease calculation for {} to {}", window.startMonth(), window.endMonth());

        List<ContractSummary> summaries = new ArrayList<>(registry.size());
        List<MonthlyAllocation> monthlyReceivables = new ArrayList<>();
        List<MonthlyIncome> monthlyIncomes = new ArrayList<>();

        int index = 0;
        for (Contract contract : registry.getContracts()) {
            index++;
            log.debug("Processing contract {}/{}: {}", index, registry.size(), contract.displayName());

            ContractSummary summary = contractSummaryCalculator.summarize(contract, window, matcher, trace);
            for (String note : summary.getNotes()) {
                log.warn(note);
                trace.record(note);
            }

            summaries.add(summary);
            monthlyReceivables.addAll(
                contractSummaryCalculator.monthlyReceivables(contract, window, options.includeDiagnostics()));
            monthlyIncomes.addAll(
                contractSummaryCalculator.monthlyIncome(contract, window, summary.getDailyIncomeRate()));

            log.debug("Contract {} - receivable: {}, income: {}, bank: {}, invoice: {}",
                contract.displayName(), summary.getTotalReceivable(), summary.getTotalIncome(),
                summary.getBankMatched(), summary.getInvoiceMatched());
        }

        LeaseReport report = LeaseReport.builder()
            .window(window)
            .summaries(List.copyOf(summaries))
            .monthlyReceivables(List.copyOf(monthlyReceivables))
            .monthlyIncomes(List.copyOf(monthlyIncomes))
            .diagnostics(options.includeDiagnostics())
            .build();

        log.info("Calculated {} contract(s) - total receivable: {}, total income: {}",
            report.contractCount(), String.format("%.2f", report.totalReceivable()), String.format("%.2f", report.totalIncome()));
        return report;
    }
}
