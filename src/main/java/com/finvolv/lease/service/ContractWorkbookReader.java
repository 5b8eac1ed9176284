package com.finvolv.lease.service;

import com.finvolv.lease.config.LeaseWorkbookProperties;
import com.finvolv.lease.exception.WorkbookLoadException;
import com.finvolv.lease.mapper.CellValueMapper;
import com.finvolv.lease.mapper.CellValueMapper.ParsedDate;
import com.finvolv.lease.model.BankTransaction;
import com.finvolv.lease.model.Contract;
import com.finvolv.lease.model.ContractRegistry;
import com.finvolv.lease.model.Invoice;
import com.finvolv.lease.model.RentTiers;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads the contract, bank statement and invoice sheets of an uploaded workbook into a
 * {@link ContractRegistry}. The first row of each sheet is its header row.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContractWorkbookReader {

    private final LeaseWorkbookProperties properties;

    public ContractRegistry read(byte[] workbookBytes) {
        if (workbookBytes == null || workbookBytes.length == 0) {
            throw new WorkbookLoadException("The uploaded workbook is empty");
        }
        return read(new ByteArrayInputStream(workbookBytes));
    }

    public ContractRegistry read(Path path) {
        try (InputStream inputStream = Files.newInputStream(path)) {
            return read(inputStream);
        } catch (IOException e) {
            throw new WorkbookLoadException("Failed to open workbook " + path + ": " + e.getMessage(), e);
        }
    }

    public ContractRegistry read(InputStream inputStream) {
        try (Workbook workbook = new XSSFWorkbook(inputStream)) {
            return read(workbook);
        } catch (IOException | RuntimeException e) {
            if (e instanceof WorkbookLoadException) {
                throw (WorkbookLoadException) e;
            }
            throw new WorkbookLoadException("Failed to read workbook: " + e.getMessage(), e);
        }
    }

    public ContractRegistry read(Workbook workbook) {
        LeaseWorkbookProperties.ContractSheet contractLayout = properties.getContracts();
        Sheet contractSheet = requireSheet(workbook, contractLayout.getSheetName());
        Map<String, Integer> contractColumns = headerIndex(contractSheet);
        int tierCount = ContractRegistry.detectTierCount(contractColumns.keySet(), contractLayout.compiledTierPattern());
        log.info("Detected {} lease year tier(s) in sheet '{}'", tierCount, contractLayout.getSheetName());

        List<Contract> contracts = readContracts(contractSheet, contractColumns, tierCount);
        List<BankTransaction> bankTransactions = readBankTransactions(workbook);
        List<Invoice> invoices = readInvoices(workbook);

        log.info("Loaded {} contract(s), {} bank statement(s), {} invoice(s)",
            contracts.size(), bankTransactions.size(), invoices.size());
        return new ContractRegistry(contracts, bankTransactions, invoices, tierCount);
    }

    private List<Contract> readContracts(Sheet sheet, Map<String, Integer> columns, int tierCount) {
        LeaseWorkbookProperties.ContractSheet layout = properties.getContracts();
        String sheetName = layout.getSheetName();
        int customerCol = requireColumn(columns, sheetName, layout.getCustomerName());
        int merchantCol = requireColumn(columns, sheetName, layout.getMerchantId());
        int deliveryCol = requireColumn(columns, sheetName, layout.getDeliveryDate());
        int leaseEndCol = requireColumn(columns, sheetName, layout.getLeaseEndDate());
        int freeDaysCol = requireColumn(columns, sheetName, layout.getFreeRentDays());

        // tier 1 is mandatory, later tiers may be missing from the sheet entirely
        List<Integer> tierCols = new ArrayList<>(tierCount);
        tierCols.add(requireColumn(columns, sheetName, layout.tierHeader(1)));
        for (int year = 2; year <= tierCount; year++) {
            tierCols.add(columns.getOrDefault(layout.tierHeader(year), -1));
        }

        List<Contract> contracts = new ArrayList<>();
        for (int rowIndex = sheet.getFirstRowNum() + 1; rowIndex <= sheet.getLastRowNum(); rowIndex++) {
            Row row = sheet.getRow(rowIndex);
            if (CellValueMapper.isBlankRow(row)) {
                continue;
            }

            List<Double> tiers = new ArrayList<>(tierCount);
            for (int year = 1; year <= tierCols.size(); year++) {
                int tierCol = tierCols.get(year - 1);
                tiers.add(tierCol < 0 ? null : readAmount(row.getCell(tierCol), sheetName, rowIndex, layout.tierHeader(year)));
            }

            Contract contract = Contract.builder()
                .customerName(CellValueMapper.asString(row.getCell(customerCol)))
                .merchantId(CellValueMapper.asString(row.getCell(merchantCol)))
                .deliveryDate(readContractDate(row.getCell(deliveryCol), rowIndex, layout.getDeliveryDate()))
                .leaseEndDate(readContractDate(row.getCell(leaseEndCol), rowIndex, layout.getLeaseEndDate()))
                .freeRentDays(CellValueMapper.asInteger(row.getCell(freeDaysCol)))
                .rentTiers(RentTiers.of(tiers))
                .build();
            contracts.add(contract);
        }
        return contracts;
    }

    private List<BankTransaction> readBankTransactions(Workbook workbook) {
        LeaseWorkbookProperties.BankSheet layout = properties.getBank();
        Sheet sheet = requireSheet(workbook, layout.getSheetName());
        Map<String, Integer> columns = headerIndex(sheet);
        int dateCol = requireColumn(columns, layout.getSheetName(), layout.getTransactionDate());
        int amountCol = requireColumn(columns, layout.getSheetName(), layout.getCreditedAmount());
        int nameCol = requireColumn(columns, layout.getSheetName(), layout.getCounterpartyName());

        List<BankTransaction> transactions = new ArrayList<>();
        for (int rowIndex = sheet.getFirstRowNum() + 1; rowIndex <= sheet.getLastRowNum(); rowIndex++) {
            Row row = sheet.getRow(rowIndex);
            if (CellValueMapper.isBlankRow(row)) {
                continue;
            }
            ParsedDate date = CellValueMapper.asDate(row.getCell(dateCol));
            transactions.add(BankTransaction.builder()
                .counterpartyName(CellValueMapper.asString(row.getCell(nameCol)))
                .transactionDate(date.date())
                .rawTransactionDate(date.raw())
                .creditedAmount(readAmount(row.getCell(amountCol), layout.getSheetName(), rowIndex, layout.getCreditedAmount()))
                .build());
        }
        return transactions;
    }

    private List<Invoice> readInvoices(Workbook workbook) {
        LeaseWorkbookProperties.InvoiceSheet layout = properties.getInvoices();
        Sheet sheet = requireSheet(workbook, layout.getSheetName());
        Map<String, Integer> columns = headerIndex(sheet);
        int nameCol = requireColumn(columns, layout.getSheetName(), layout.getBuyerName());
        int dateCol = requireColumn(columns, layout.getSheetName(), layout.getInvoiceDate());
        int amountCol = requireColumn(columns, layout.getSheetName(), layout.getTotalAmount());

        List<Invoice> invoices = new ArrayList<>();
        for (int rowIndex = sheet.getFirstRowNum() + 1; rowIndex <= sheet.getLastRowNum(); rowIndex++) {
            Row row = sheet.getRow(rowIndex);
            if (CellValueMapper.isBlankRow(row)) {
                continue;
            }
            ParsedDate date = CellValueMapper.asDate(row.getCell(dateCol));
            invoices.add(Invoice.builder()
                .buyerName(CellValueMapper.asString(row.getCell(nameCol)))
                .invoiceDate(date.date())
                .rawInvoiceDate(date.raw())
                .totalAmount(readAmount(row.getCell(amountCol), layout.getSheetName(), rowIndex, layout.getTotalAmount()))
                .build());
        }
        return invoices;
    }

    private LocalDate readContractDate(Cell cell, int rowIndex, String columnName) {
        ParsedDate parsed = CellValueMapper.asDate(cell);
        if (parsed.isMalformed()) {
            throw WorkbookLoadException.unreadableValue(properties.getContracts().getSheetName(), rowIndex + 1,
                columnName, parsed.raw());
        }
        return parsed.date();
    }

    /**
     * Non-numeric text in an amount cell is read as absent and logged.
     */
    private static Double readAmount(Cell cell, String sheetName, int rowIndex, String columnName) {
        Double value = CellValueMapper.asDouble(cell);
        if (value == null) {
            String raw = CellValueMapper.asString(cell);
            if (raw != null) {
                log.warn("Unreadable {} '{}' in sheet '{}', row {}, treated as absent",
                    columnName, raw, sheetName, rowIndex + 1);
            }
        }
        return value;
    }

    private static Sheet requireSheet(Workbook workbook, String sheetName) {
        Sheet sheet = workbook.getSheet(sheetName);
        if (sheet == null) {
            throw WorkbookLoadException.missingSheet(sheetName);
        }
        return sheet;
    }

    private static int requireColumn(Map<String, Integer> columns, String sheetName, String columnName) {
        Integer index = columns.get(columnName);
        if (index == null) {
            throw WorkbookLoadException.missingColumn(sheetName, columnName);
        }
        return index;
    }

    /**
     * Header text to column index, first occurrence wins.
     */
    private static Map<String, Integer> headerIndex(Sheet sheet) {
        Map<String, Integer> columns = new LinkedHashMap<>();
        Row headerRow = sheet.getRow(sheet.getFirstRowNum());
        if (headerRow == null) {
            return columns;
        }
        for (Cell cell : headerRow) {
            String header = CellValueMapper.asString(cell);
            if (header != null) {
                columns.putIfAbsent(header, cell.getColumnIndex());
            }
        }
        return columns;
    }
}
