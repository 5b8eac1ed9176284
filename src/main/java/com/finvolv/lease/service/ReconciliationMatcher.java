package com.finvolv.lease.service;

import com.finvolv.lease.exception.MalformedRecordException;
import com.finvolv.lease.model.BankTransaction;
import com.finvolv.lease.model.ContractRegistry;
import com.finvolv.lease.model.DateSpan;
import com.finvolv.lease.model.Invoice;
import com.finvolv.lease.model.ReportingWindow;
import com.finvolv.lease.model.SettlementRecord;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.List;

/**
 * Sums bank credits and invoice totals for a counterparty inside a reporting window.
 * Built per batch over the registry's read-only record tables.
 */
@Slf4j
public class ReconciliationMatcher {

    private final List<BankTransaction> bankTransactions;
    private final List<Invoice> invoices;

    public ReconciliationMatcher(List<BankTransaction> bankTransactions, List<Invoice> invoices) {
        this.bankTransactions = bankTransactions;
        this.invoices = invoices;
    }

    public static ReconciliationMatcher forRegistry(ContractRegistry registry) {
        return new ReconciliationMatcher(registry.getBankTransactions(), registry.getInvoices());
    }

    public double matchBank(String customerName, ReportingWindow window) {
        return match("bank statements", bankTransactions, customerName, window);
    }

    public double matchInvoice(String customerName, ReportingWindow window) {
        return match("invoices", invoices, customerName, window);
    }

    /**
     * A malformed record makes the whole source contribute 0 for this customer.
     */
    private double match(String source, List<? extends SettlementRecord> records, String customerName, ReportingWindow window) {
        if (customerName == null) {
            return 0.0;
        }
        DateSpan span = window.span();
        try {
            double total = 0.0;
            for (SettlementRecord record : records) {
                LocalDate date = record.resolveDate();
                if (customerName.equals(record.getPartyName()) && span.contains(date)) {
                    total += record.amountOrZero();
                }
            }
            return total;
        } catch (MalformedRecordException e) {
            log.warn("Matching {} failed for customer {}, contributing 0: {}", source, customerName, e.getMessage());
            return 0.0;
        }
    }
}
