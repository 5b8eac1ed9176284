package com.finvolv.lease.model;

import com.finvolv.lease.exception.MalformedRecordException;

import java.time.LocalDate;

/**
 * A dated, counterparty-named amount that can be reconciled against a contract.
 */
public interface SettlementRecord {

    String getPartyName();

    LocalDate getRecordDate();

    /** Original cell text, kept only when it could not be read as a date. */
    String getRawRecordDate();

    Double getAmount();

    /**
     * @return the record date, or null when the row carries no date at all
     * @throws MalformedRecordException when a date was supplied but could not be read
     */
    default LocalDate resolveDate() {
        if (getRecordDate() == null && getRawRecordDate() != null && !getRawRecordDate().isBlank()) {
            throw new MalformedRecordException("Unreadable date '" + getRawRecordDate() + "' for " + getPartyName());
        }
        return getRecordDate();
    }

    default double amountOrZero() {
        return getAmount() == null ? 0.0 : getAmount();
    }
}
