package com.finvolv.lease.model;

/**
 * @param includeDiagnostics append intermediate values to the output tables
 * @param trace              receives the calculation walk-through; may be null
 */
public record ReportOptions(boolean includeDiagnostics, CalculationTrace trace) {

    public static ReportOptions defaults() {
        return new ReportOptions(false, null);
    }

    public CalculationTrace traceOrDisabled() {
        return CalculationTrace.orDisabled(trace);
    }
}
