package com.finvolv.lease.service;

import com.finvolv.lease.model.ContractRegistry;
import com.finvolv.lease.model.LeaseCalculationResult;
import com.finvolv.lease.model.LeaseReport;
import com.finvolv.lease.model.ReportOptions;
import com.finvolv.lease.model.ReportingWindow;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point shared by the HTTP and command-line adapters: load the workbook, run the
 * batch and render the three output workbooks. Holds no state between calls.
 */
@Service
@RequiredArgsConstructor
public class LeaseCalculationService {

    private static final Logger logger = LoggerFactory.getLogger(LeaseCalculationService.class);

    private final ContractWorkbookReader contractWorkbookReader;
    private final ReportAggregator reportAggregator;
    private final ReportWorkbookWriter reportWorkbookWriter;

    public LeaseCalculationResult calculate(byte[] workbookBytes, ReportingWindow window, ReportOptions options) {
        ContractRegistry registry = contractWorkbookReader.read(workbookBytes);
        return calculate(registry, window, options);
    }

    public LeaseCalculationResult calculate(ContractRegistry registry, ReportingWindow window, ReportOptions options) {
        long started = System.currentTimeMillis();
        LeaseReport report = reportAggregator.aggregate(registry, window, options);

        LeaseCalculationResult result = LeaseCalculationResult.builder()
            .report(report)
            .leaseWorkbook(reportWorkbookWriter.writeSummary(report))
            .singleWorkbook(reportWorkbookWriter.writeMonthlyReceivables(report))
            .incomeWorkbook(reportWorkbookWriter.writeMonthlyIncome(report))
            .trace(options.traceOrDisabled())
            .build();

        logger.info("Lease calculation for {} to {} finished in {} ms - contracts: {}, bank matched: {}, invoice matched: {}",
            window.startMonth(), window.endMonth(), System.currentTimeMillis() - started, report.contractCount(),
            String.format("%.2f", report.totalBankMatched()), String.format("%.2f", report.totalInvoiceMatched()));
        return result;
    }
}
