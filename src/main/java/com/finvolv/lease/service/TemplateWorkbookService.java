package com.finvolv.lease.service;

import com.finvolv.lease.config.LeaseWorkbookProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.IndexedColors;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFCellStyle;
import org.apache.poi.xssf.usermodel.XSSFFont;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the blank input workbook handed out to staff: the contract, bank statement and
 * invoice sheets with their headers and a couple of example rows that may be overwritten.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TemplateWorkbookService {

    static final int TEMPLATE_TIER_COUNT = 7;

    private final LeaseWorkbookProperties properties;

    public byte[] buildTemplate() {
        try (XSSFWorkbook workbook = new XSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            XSSFFont boldFont = workbook.createFont();
            boldFont.setBold(true);

            XSSFCellStyle headerStyle = workbook.createCellStyle();
            headerStyle.setFillForegroundColor(IndexedColors.GREY_25_PERCENT.getIndex());
            headerStyle.setFillPattern(FillPatternType.SOLID_FOREGROUND);
            headerStyle.setFont(boldFont);

            CellStyle dateStyle = workbook.createCellStyle();
            dateStyle.setDataFormat(workbook.getCreationHelper().createDataFormat().getFormat("yyyy-mm-dd"));

            LeaseWorkbookProperties.ContractSheet contracts = properties.getContracts();
            List<String> contractHeaders = new ArrayList<>(List.of(
                contracts.getCustomerName(),
                contracts.getMerchantId(),
                contracts.getDeliveryDate(),
                contracts.getLeaseEndDate(),
                contracts.getFreeRentDays()));
            for (int year = 1; year <= TEMPLATE_TIER_COUNT; year++) {
                contractHeaders.add(contracts.tierHeader(year));
            }
            writeSheet(workbook, contracts.getSheetName(), contractHeaders, List.of(
                new Object[]{"北京lbcy餐饮管理有限公司", "B1-01c", LocalDate.of(2025, 5, 12), LocalDate.of(2027, 5, 11),
                    30, 26496.00, 27820.80},
                new Object[]{"上海XX贸易有限公司", "C2-03a", LocalDate.of(2024, 1, 1), LocalDate.of(2028, 12, 31),
                    60, 120000.00, 126000.00, 132300.00, 138915.00}
            ), headerStyle, dateStyle);

            LeaseWorkbookProperties.BankSheet bank = properties.getBank();
            writeSheet(workbook, bank.getSheetName(),
                List.of(bank.getTransactionDate(), bank.getCreditedAmount(), bank.getCounterpartyName()),
                List.of(
                    new Object[]{LocalDate.of(2025, 8, 5), 26496.00, "北京lbcy餐饮管理有限公司"},
                    new Object[]{LocalDate.of(2025, 9, 3), 26496.00, "北京lbcy餐饮管理有限公司"}
                ), headerStyle, dateStyle);

            LeaseWorkbookProperties.InvoiceSheet invoices = properties.getInvoices();
            writeSheet(workbook, invoices.getSheetName(),
                List.of(invoices.getBuyerName(), invoices.getInvoiceDate(), invoices.getTotalAmount()),
                List.of(
                    new Object[]{"北京lbcy餐饮管理有限公司", LocalDate.of(2025, 8, 10), 29920.48},
                    new Object[]{"北京lbcy餐饮管理有限公司", LocalDate.of(2025, 9, 10), 29920.48}
                ), headerStyle, dateStyle);

            workbook.write(out);
            log.debug("Built input template with {} tier column(s)", TEMPLATE_TIER_COUNT);
            return out.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to build input template", e);
        }
    }

    private void writeSheet(XSSFWorkbook workbook,
                            String sheetName,
                            List<String> headers,
                            List<Object[]> examples,
                            CellStyle headerStyle,
                            CellStyle dateStyle) {
        Sheet sheet = workbook.createSheet(sheetName);
        Row header = sheet.createRow(0);
        for (int i = 0; i < headers.size(); i++) {
            Cell cell = header.createCell(i);
            cell.setCellValue(headers.get(i));
            cell.setCellStyle(headerStyle);
            sheet.setColumnWidth(i, Math.max(14, ReportWorkbookWriter.displayWidth(headers.get(i)) + 4) * 256);
        }

        int rowIdx = 1;
        for (Object[] values : examples) {
            Row row = sheet.createRow(rowIdx++);
            for (int c = 0; c < values.length; c++) {
                Cell cell = row.createCell(c);
                Object value = values[c];
                if (value instanceof LocalDate) {
                    cell.setCellValue((LocalDate) value);
                    cell.setCellStyle(dateStyle);
                } else if (value instanceof Number) {
                    cell.setCellValue(((Number) value).doubleValue());
                } else {
                    cell.setCellValue(String.valueOf(value));
                }
            }
        }
    }
}
