package com.finvolv.lease.model;

import lombok.Builder;
import lombok.Value;

import java.time.YearMonth;

/**
 * Receivable attributed to one calendar month of one contract.
 */
@Value
@Builder(toBuilder = true)
public class MonthlyAllocation {

    Contract contract;
    YearMonth month;
    double amount;
    /** Populated only when diagnostics were requested. */
    AllocationDetail detail;
}
