package com.finvolv.lease.model;

import lombok.Builder;
import lombok.Value;

/**
 * A calculated report together with its rendered output workbooks.
 */
@Value
@Builder
public class LeaseCalculationResult {

    LeaseReport report;

    byte[] leaseWorkbook;
    byte[] singleWorkbook;
    byte[] incomeWorkbook;

    /** Disabled unless the caller asked for a trace. */
    CalculationTrace trace;
}
