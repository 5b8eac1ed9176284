package com.finvolv.lease.service;

import com.finvolv.lease.model.AllocationDetail;
import com.finvolv.lease.model.ContractSummary;
import com.finvolv.lease.model.LeaseReport;
import com.finvolv.lease.model.MonthlyAllocation;
import com.finvolv.lease.model.MonthlyIncome;
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
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Renders a {@link LeaseReport} as the three output workbooks: the per-contract summary
 * ({@code lease}), the monthly receivable breakdown ({@code single}) and the monthly income
 * breakdown ({@code income}). Amounts are rounded to two decimals here and nowhere else.
 */
@Service
public class ReportWorkbookWriter {

    static final String SUMMARY_SHEET = "汇总";
    static final String RECEIVABLE_SHEET = "应收明细";
    static final String INCOME_SHEET = "收入明细";

    public byte[] writeSummary(LeaseReport report) {
        return buildWorkbook(SUMMARY_SHEET, summaryColumns(report.isDiagnostics()), report.getSummaries());
    }

    public byte[] writeMonthlyReceivables(LeaseReport report) {
        return buildWorkbook(RECEIVABLE_SHEET, receivableColumns(report.isDiagnostics()), report.getMonthlyReceivables());
    }

    public byte[] writeMonthlyIncome(LeaseReport report) {
        return buildWorkbook(INCOME_SHEET, incomeColumns(report.isDiagnostics()), report.getMonthlyIncomes());
    }

    private <T> byte[] buildWorkbook(String sheetName, Map<String, Function<T, Object>> columns, List<T> rows) {
        try (XSSFWorkbook workbook = new XSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            Sheet sheet = workbook.createSheet(sheetName);

            XSSFFont boldFont = workbook.createFont();
            boldFont.setBold(true);

            XSSFCellStyle headerStyle = workbook.createCellStyle();
            headerStyle.setFillForegroundColor(IndexedColors.GREY_25_PERCENT.getIndex());
            headerStyle.setFillPattern(FillPatternType.SOLID_FOREGROUND);
            headerStyle.setFont(boldFont);

            CellStyle dateStyle = workbook.createCellStyle();
            dateStyle.setDataFormat(workbook.getCreationHelper().createDataFormat().getFormat("yyyy-mm-dd"));

            Row header = sheet.createRow(0);
            int colIdx = 0;
            for (String headerName : columns.keySet()) {
                Cell cell = header.createCell(colIdx++);
                cell.setCellValue(headerName);
                cell.setCellStyle(headerStyle);
            }

            int[] widths = columns.keySet().stream().mapToInt(ReportWorkbookWriter::displayWidth).toArray();
            int rowIdx = 1;
            for (T item : rows) {
                Row row = sheet.createRow(rowIdx++);
                int c = 0;
                for (Function<T, Object> getter : columns.values()) {
                    Object value = getter.apply(item);
                    setCellValue(row.createCell(c), value, dateStyle);
                    widths[c] = Math.max(widths[c], displayWidth(value));
                    c++;
                }
            }

            // Sheet.autoSizeColumn needs AWT font metrics, unavailable on headless hosts without fonts
            for (int i = 0; i < widths.length; i++) {
                sheet.setColumnWidth(i, Math.min(255, widths[i] + 2) * 256);
            }

            workbook.write(out);
            return out.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to build Excel file " + sheetName, e);
        }
    }

    private Map<String, Function<ContractSummary, Object>> summaryColumns(boolean diagnostics) {
        Map<String, Function<ContractSummary, Object>> cols = new LinkedHashMap<>();
        cols.put("客户名称", s -> s.getContract().getCustomerName());
        cols.put("商户编号", s -> s.getContract().getMerchantId());
        cols.put("交付日", s -> s.getContract().getDeliveryDate());
        cols.put("租期届满日", s -> s.getContract().getLeaseEndDate());
        cols.put("免租期", s -> s.getContract().getFreeRentDays());
        cols.put("应收总额", s -> round(s.getTotalReceivable(), 2));
        cols.put("收入总额", s -> round(s.getTotalIncome(), 2));
        cols.put("银行对账单", s -> round(s.getBankMatched(), 2));
        cols.put("发票对账", s -> round(s.getInvoiceMatched(), 2));
        cols.put("数据备注", ContractSummary::validationNote);

        if (diagnostics) {
            cols.put("合同总天数", ContractSummary::getTotalContractDays);
            cols.put("合同总应收", s -> round(s.getTotalContractReceivable(), 2));
            cols.put("日收入率", s -> round(s.getDailyIncomeRate(), 4));
            cols.put("查询期天数", ContractSummary::getDaysInPeriod);
            cols.put("收入计算公式", ContractSummary::incomeFormula);
        }
        return cols;
    }

    private Map<String, Function<MonthlyAllocation, Object>> receivableColumns(boolean diagnostics) {
        Map<String, Function<MonthlyAllocation, Object>> cols = new LinkedHashMap<>();
        cols.put("客户名称", m -> m.getContract().getCustomerName());
        cols.put("商户编号", m -> m.getContract().getMerchantId());
        cols.put("月份", m -> m.getMonth() == null ? null : m.getMonth().toString());
        cols.put("应收金额", m -> round(m.getAmount(), 2));

        if (diagnostics) {
            cols.put("免租天数", m -> detail(m, AllocationDetail::getFreeDays));
            cols.put("有效天数", m -> detail(m, AllocationDetail::getEffectiveDays));
            cols.put("应付天数", m -> detail(m, AllocationDetail::getPayableDays));
            cols.put("月天数", m -> detail(m, AllocationDetail::getDaysInMonth));
            cols.put("租赁年度", m -> detail(m, d -> "-".equals(d.leaseYearLabel()) ? "-" : "第" + d.leaseYearLabel() + "年"));
            cols.put("年租金", m -> detail(m, AllocationDetail::tierAmountLabel));
            cols.put("日租金", m -> detail(m, AllocationDetail::dailyRentLabel));
            cols.put("是否跨年度", m -> detail(m, d -> d.isSplitYear() ? "是" : "否"));
            cols.put("计算公式", m -> detail(m, AllocationDetail::getFormula));
        }
        return cols;
    }

    private Map<String, Function<MonthlyIncome, Object>> incomeColumns(boolean diagnostics) {
        Map<String, Function<MonthlyIncome, Object>> cols = new LinkedHashMap<>();
        cols.put("客户名称", m -> m.getContract().getCustomerName());
        cols.put("商户编号", m -> m.getContract().getMerchantId());
        cols.put("月份", m -> m.getMonth().toString());
        cols.put("收入金额", m -> round(m.getAmount(), 2));

        if (diagnostics) {
            cols.put("日收入率", m -> round(m.getDailyIncomeRate(), 4));
            cols.put("本月合同天数", MonthlyIncome::getContractDaysInMonth);
            cols.put("计算公式", MonthlyIncome::formula);
        }
        return cols;
    }

    private static Object detail(MonthlyAllocation allocation, Function<AllocationDetail, Object> getter) {
        return allocation.getDetail() == null ? null : getter.apply(allocation.getDetail());
    }

    /**
     * Approximate rendered width in characters; CJK glyphs count double.
     */
    static int displayWidth(Object value) {
        if (value == null) {
            return 0;
        }
        String text = value instanceof BigDecimal ? ((BigDecimal) value).toPlainString() : String.valueOf(value);
        int width = 0;
        for (int i = 0; i < text.length(); i++) {
            width += text.charAt(i) > 0x2E7F ? 2 : 1;
        }
        return width;
    }

    /**
     * Rounds the exact binary value half-even, so 2.675 (stored as 2.67499...) gives 2.67.
     */
    static BigDecimal round(double value, int scale) {
        return new BigDecimal(value).setScale(scale, RoundingMode.HALF_EVEN);
    }

    private void setCellValue(Cell cell, Object value, CellStyle dateStyle) {
        if (value == null) {
            cell.setBlank();
            return;
        }
        if (value instanceof Number) {
            cell.setCellValue(((Number) value).doubleValue());
        } else if (value instanceof LocalDate) {
            cell.setCellValue((LocalDate) value);
            cell.setCellStyle(dateStyle);
        } else {
            cell.setCellValue(String.valueOf(value));
        }
    }
}
