package com.finvolv.lease.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class Invoice implements SettlementRecord {

    String buyerName;
    LocalDate invoiceDate;
    String rawInvoiceDate;
    /** Tax-inclusive total. */
    Double totalAmount;

    @Override
    public String getPartyName() {
        return buyerName;
    }

    @Override
    public LocalDate getRecordDate() {
        return invoiceDate;
    }

    @Override
    public String getRawRecordDate() {
        return rawInvoiceDate;
    }

    @Override
    public Double getAmount() {
        return totalAmount;
    }
}
