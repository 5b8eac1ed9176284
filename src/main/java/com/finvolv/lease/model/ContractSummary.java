package com.finvolv.lease.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Per-contract totals for one reporting window. Amounts are unrounded;
 * rounding happens when the summary is written out.
 */
@Value
@Builder
public class ContractSummary {

    Contract contract;

    double totalReceivable;
    double totalIncome;
    double bankMatched;
    double invoiceMatched;

    double totalContractReceivable;
    long totalContractDays;
    double dailyIncomeRate;
    long daysInPeriod;

    @Singular
    List<String> notes;

    public static ContractSummary zero(Contract contract, List<String> notes) {
        return ContractSummary.builder()
            .contract(contract)
            .notes(notes)
            .build();
    }

    public String validationNote() {
        return String.join(" | ", notes);
    }

    public String incomeFormula() {
        return String.format("%.2f / %d × %d = %.2f",
            totalContractReceivable, totalContractDays, daysInPeriod, totalIncome);
    }
}
