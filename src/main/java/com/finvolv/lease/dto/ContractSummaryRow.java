package com.finvolv.lease.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.finvolv.lease.model.ContractSummary;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContractSummaryRow {

    private String customer;

    @JsonProperty("merchant_id")
    private String merchantId;

    private BigDecimal receivable;
    private BigDecimal income;

    @JsonProperty("bank_matched")
    private BigDecimal bankMatched;

    @JsonProperty("invoice_matched")
    private BigDecimal invoiceMatched;

    private String notes;

    public static ContractSummaryRow from(ContractSummary summary) {
        return ContractSummaryRow.builder()
            .customer(nullToEmpty(summary.getContract().getCustomerName()))
            .merchantId(nullToEmpty(summary.getContract().getMerchantId()))
            .receivable(money(summary.getTotalReceivable()))
            .income(money(summary.getTotalIncome()))
            .bankMatched(money(summary.getBankMatched()))
            .invoiceMatched(money(summary.getInvoiceMatched()))
            .notes(summary.validationNote())
            .build();
    }

    static BigDecimal money(double value) {
        return new BigDecimal(value).setScale(2, RoundingMode.HALF_EVEN);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
