package com.finvolv.lease;

import com.finvolv.lease.config.LeaseWorkbookProperties;
import com.finvolv.lease.model.CalculationTrace;
import com.finvolv.lease.model.ContractSummary;
import com.finvolv.lease.model.LeaseCalculationResult;
import com.finvolv.lease.model.LeaseReport;
import com.finvolv.lease.model.ReportOptions;
import com.finvolv.lease.model.ReportingWindow;
import com.finvolv.lease.service.ContractSummaryCalculator;
import com.finvolv.lease.service.ContractWorkbookReader;
import com.finvolv.lease.service.LeaseCalculationService;
import com.finvolv.lease.service.ProrationEngine;
import com.finvolv.lease.service.ReportAggregator;
import com.finvolv.lease.service.ReportWorkbookWriter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Command-line runner for a lease calculation, without starting the web application.
 *
 * Usage: java LeaseCalculator <contractFile> --start <yyyy-MM[-dd]> --end <yyyy-MM[-dd]>
 *        [--output-dir <dir>] [--log <file>] [--aux-columns]
 * Example: java LeaseCalculator contracts.xlsx --start 2025-08 --end 2025-12 --output-dir out --aux-columns
 *
 * Writes {@code <timestamp>-lease.xlsx}, {@code <timestamp>-single.xlsx} and {@code <timestamp>-income.xlsx}.
 */
public class LeaseCalculator {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    public static void main(String[] args) {
        Arguments arguments;
        try {
            arguments = Arguments.parse(args);
        } catch (IllegalArgumentException e) {
            System.out.println(e.getMessage());
            printUsage();
            System.exit(1);
            return;
        }

        System.out.println("=== Lease Receivable Calculator ===");
        System.out.println("Contract file: " + arguments.contractFile());
        System.out.println("Period: " + arguments.start() + " to " + arguments.end());
        System.out.println("Output directory: " + arguments.outputDir());
        System.out.println();

        try {
            List<Path> outputs = run(arguments);
            System.out.println("Calculation completed successfully");
            outputs.forEach(path -> System.out.println("Saved: " + path));
        } catch (Exception e) {
            System.err.println("Error during lease calculation: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    static List<Path> run(Arguments arguments) throws IOException {
        ReportingWindow window = ReportingWindow.parse(arguments.start(), arguments.end());
        CalculationTrace trace = arguments.logFile() != null ? CalculationTrace.enabled() : null;

        LeaseCalculationService service = createService();
        byte[] workbook = Files.readAllBytes(arguments.contractFile());
        LeaseCalculationResult result = service.calculate(workbook, window, new ReportOptions(arguments.auxColumns(), trace));

        printSummary(result.getReport());

        Files.createDirectories(arguments.outputDir());
        String ts = LocalDateTime.now().format(TIMESTAMP);
        Path leaseFile = Files.write(arguments.outputDir().resolve(ts + "-lease.xlsx"), result.getLeaseWorkbook());
        Path singleFile = Files.write(arguments.outputDir().resolve(ts + "-single.xlsx"), result.getSingleWorkbook());
        Path incomeFile = Files.write(arguments.outputDir().resolve(ts + "-income.xlsx"), result.getIncomeWorkbook());

        if (trace != null) {
            Files.write(arguments.logFile(), trace.getLines(), StandardCharsets.UTF_8);
            System.out.println("Calculation log saved to: " + arguments.logFile());
        }
        return List.of(leaseFile, singleFile, incomeFile);
    }

    static LeaseCalculationService createService() {
        ContractSummaryCalculator calculator = new ContractSummaryCalculator(new ProrationEngine());
        return new LeaseCalculationService(
            new ContractWorkbookReader(new LeaseWorkbookProperties()),
            new ReportAggregator(calculator),
            new ReportWorkbookWriter());
    }

    private static void printSummary(LeaseReport report) {
        for (ContractSummary summary : report.getSummaries()) {
            System.out.println(summary.getContract().displayName());
            System.out.printf("  Receivable: %.2f%n", summary.getTotalReceivable());
            System.out.printf("  Income: %.2f%n", summary.getTotalIncome());
            System.out.printf("  Bank statements: %.2f%n", summary.getBankMatched());
            System.out.printf("  Invoices: %.2f%n", summary.getInvoiceMatched());
        }
        System.out.println();
        System.out.printf("Contracts: %d, total receivable: %.2f, total income: %.2f%n",
            report.contractCount(), report.totalReceivable(), report.totalIncome());
        System.out.printf("Bank statements matched: %.2f, invoices matched: %.2f%n",
            report.totalBankMatched(), report.totalInvoiceMatched());
    }

    private static void printUsage() {
        System.out.println("Usage: java LeaseCalculator <contractFile> --start <yyyy-MM[-dd]> --end <yyyy-MM[-dd]> "
            + "[--output-dir <dir>] [--log <file>] [--aux-columns]");
        System.out.println("Example: java LeaseCalculator contracts.xlsx --start 2025-08 --end 2025-12 --aux-columns");
    }

    record Arguments(Path contractFile, String start, String end, Path outputDir, Path logFile, boolean auxColumns) {

        static Arguments parse(String[] args) {
            Path contractFile = null;
            String start = null;
            String end = null;
            Path outputDir = Paths.get(".");
            Path logFile = null;
            boolean auxColumns = false;

            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if ("--start".equals(arg)) {
                    start = valueAfter(args, ++i, arg);
                } else if ("--end".equals(arg)) {
                    end = valueAfter(args, ++i, arg);
                } else if ("--output-dir".equals(arg)) {
                    outputDir = Paths.get(valueAfter(args, ++i, arg));
                } else if ("--log".equals(arg)) {
                    logFile = Paths.get(valueAfter(args, ++i, arg));
                } else if ("--aux-columns".equals(arg)) {
                    auxColumns = true;
                } else if (arg.startsWith("--")) {
                    throw new IllegalArgumentException("Unknown option: " + arg);
                } else if (contractFile != null) {
                    throw new IllegalArgumentException("Unexpected argument: " + arg);
                } else {
                    contractFile = Paths.get(arg);
                }
            }

            if (contractFile == null) {
                throw new IllegalArgumentException("Missing contract file");
            }
            if (start == null || end == null) {
                throw new IllegalArgumentException("Both --start and --end are required");
            }
            return new Arguments(contractFile, start, end, outputDir, logFile, auxColumns);
        }

        private static String valueAfter(String[] args, int index, String option) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for " + option);
            }
            return args[index];
        }
    }
}
