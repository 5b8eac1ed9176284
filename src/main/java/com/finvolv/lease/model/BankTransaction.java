package com.finvolv.lease.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class BankTransaction implements SettlementRecord {

    String counterpartyName;
    LocalDate transactionDate;
    String rawTransactionDate;
    Double creditedAmount;

    @Override
    public String getPartyName() {
        return counterpartyName;
    }

    @Override
    public LocalDate getRecordDate() {
        return transactionDate;
    }

    @Override
    public String getRawRecordDate() {
        return rawTransactionDate;
    }

    @Override
    public Double getAmount() {
        return creditedAmount;
    }
}
