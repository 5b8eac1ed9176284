package com.finvolv.lease.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.finvolv.lease.model.LeaseCalculationResult;
import com.finvolv.lease.model.LeaseReport;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.Base64;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Body of a calculation response. A failed request only carries {@code error}, plus
 * {@code detail} for unexpected failures.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LeaseCalculationResponse {

    @JsonProperty("contract_count")
    private Integer contractCount;

    @JsonProperty("total_receivable")
    private BigDecimal totalReceivable;

    @JsonProperty("total_income")
    private BigDecimal totalIncome;

    @JsonProperty("total_bank_matched")
    private BigDecimal totalBankMatched;

    @JsonProperty("total_invoice_matched")
    private BigDecimal totalInvoiceMatched;

    private List<ContractSummaryRow> summary;
    private OutputFiles files;

    private String error;
    private String detail;

    /**
     * Totals are the sums of the rounded per-contract figures, so they agree with {@code summary}.
     */
    public static LeaseCalculationResponse from(LeaseCalculationResult result) {
        LeaseReport report = result.getReport();
        List<ContractSummaryRow> rows = report.getSummaries().stream()
            .map(ContractSummaryRow::from)
            .collect(Collectors.toList());

        Base64.Encoder encoder = Base64.getEncoder();
        return LeaseCalculationResponse.builder()
            .contractCount(rows.size())
            .totalReceivable(sum(rows, ContractSummaryRow::getReceivable))
            .totalIncome(sum(rows, ContractSummaryRow::getIncome))
            .totalBankMatched(sum(rows, ContractSummaryRow::getBankMatched))
            .totalInvoiceMatched(sum(rows, ContractSummaryRow::getInvoiceMatched))
            .summary(rows)
            .files(OutputFiles.builder()
                .lease(encoder.encodeToString(result.getLeaseWorkbook()))
                .single(encoder.encodeToString(result.getSingleWorkbook()))
                .income(encoder.encodeToString(result.getIncomeWorkbook()))
                .build())
            .build();
    }

    public static LeaseCalculationResponse error(String error) {
        return LeaseCalculationResponse.builder().error(error).build();
    }

    public static LeaseCalculationResponse error(String error, String detail) {
        return LeaseCalculationResponse.builder().error(error).detail(detail).build();
    }

    private static BigDecimal sum(List<ContractSummaryRow> rows, java.util.function.Function<ContractSummaryRow, BigDecimal> getter) {
        return rows.stream().map(getter).reduce(ContractSummaryRow.money(0.0), BigDecimal::add);
    }
}
