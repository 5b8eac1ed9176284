package com.finvolv.lease.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * The three output tables of one batch, in registry order.
 */
@Value
@Builder
public class LeaseReport {

    ReportingWindow window;
    List<ContractSummary> summaries;
    List<MonthlyAllocation> monthlyReceivables;
    List<MonthlyIncome> monthlyIncomes;
    boolean diagnostics;

    public int contractCount() {
        return summaries.size();
    }

    public double totalReceivable() {
        return summaries.stream().mapToDouble(ContractSummary::getTotalReceivable).sum();
    }

    public double totalIncome() {
        return summaries.stream().mapToDouble(ContractSummary::getTotalIncome).sum();
    }

    public double totalBankMatched() {
        return summaries.stream().mapToDouble(ContractSummary::getBankMatched).sum();
    }

    public double totalInvoiceMatched() {
        return summaries.stream().mapToDouble(ContractSummary::getInvoiceMatched).sum();
    }
}
