package com.finvolv.lease.mapper;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Converts POI cells into the typed values the calculation works on. Dates may arrive as
 * date-formatted cells, bare Excel serials or text; all become {@link LocalDate} here.
 */
public final class CellValueMapper {

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
        DateTimeFormatter.ofPattern("yyyy/M/d H:mm:ss"),
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss")
    );

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
        DateTimeFormatter.ISO_LOCAL_DATE,
        DateTimeFormatter.ofPattern("yyyy/M/d"),
        DateTimeFormatter.ofPattern("yyyy-M-d"),
        DateTimeFormatter.ofPattern("yyyy.M.d"),
        DateTimeFormatter.ofPattern("yyyy年M月d日")
    );

    private CellValueMapper() {
    }

    /**
     * A date read from a cell. {@code raw} holds the original text only when it was not blank.
     */
    public record ParsedDate(LocalDate date, String raw) {

        static final ParsedDate BLANK = new ParsedDate(null, null);

        public boolean isMalformed() {
            return date == null && raw != null;
        }
    }

    public static String asString(Cell cell) {
        if (cell == null) return null;

        CellType type = effectiveType(cell);
        switch (type) {
            case STRING: {
                String value = cell.getStringCellValue().trim();
                return value.isEmpty() ? null : value;
            }
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return cell.getLocalDateTimeCellValue().toLocalDate().toString();
                }
                return BigDecimal.valueOf(cell.getNumericCellValue()).stripTrailingZeros().toPlainString();
            case BOOLEAN:
                return String.valueOf(cell.getBooleanCellValue());
            default:
                return null;
        }
    }

    /**
     * @return the numeric value, or null when the cell is blank or holds non-numeric text
     */
    public static Double asDouble(Cell cell) {
        if (cell == null) return null;

        CellType type = effectiveType(cell);
        switch (type) {
            case NUMERIC:
                return cell.getNumericCellValue();
            case STRING: {
                String text = cell.getStringCellValue().replace(",", "").trim();
                if (text.isEmpty()) {
                    return null;
                }
                try {
                    return Double.parseDouble(text);
                } catch (NumberFormatException e) {
                    return null;
                }
            }
            default:
                return null;
        }
    }

    /**
     * Fractional values are truncated toward zero.
     */
    public static Integer asInteger(Cell cell) {
        Double value = asDouble(cell);
        return value == null ? null : value.intValue();
    }

    public static ParsedDate asDate(Cell cell) {
        if (cell == null) return ParsedDate.BLANK;

        CellType type = effectiveType(cell);
        switch (type) {
            case NUMERIC: {
                if (DateUtil.isCellDateFormatted(cell)) {
                    return new ParsedDate(cell.getLocalDateTimeCellValue().toLocalDate(), null);
                }
                double serial = cell.getNumericCellValue();
                if (DateUtil.isValidExcelDate(serial)) {
                    return new ParsedDate(DateUtil.getLocalDateTime(serial).toLocalDate(), null);
                }
                return new ParsedDate(null, String.valueOf(serial));
            }
            case STRING: {
                String text = cell.getStringCellValue().trim();
                if (text.isEmpty()) {
                    return ParsedDate.BLANK;
                }
                LocalDate date = parseDateText(text);
                return new ParsedDate(date, date == null ? text : null);
            }
            case BLANK:
                return ParsedDate.BLANK;
            default: {
                String raw = asString(cell);
                return raw == null ? ParsedDate.BLANK : new ParsedDate(null, raw);
            }
        }
    }

    /**
     * @return the parsed date, or null when no supported format matches
     */
    public static LocalDate parseDateText(String text) {
        String value = text.trim();
        for (DateTimeFormatter format : DATE_TIME_FORMATS) {
            LocalDate date = tryParseDateTime(value, format);
            if (date != null) {
                return date;
            }
        }
        for (DateTimeFormatter format : DATE_FORMATS) {
            LocalDate date = tryParseDate(value, format);
            if (date != null) {
                return date;
            }
        }
        return null;
    }

    private static LocalDate tryParseDateTime(String value, DateTimeFormatter format) {
        try {
            return LocalDateTime.parse(value, format).toLocalDate();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static LocalDate tryParseDate(String value, DateTimeFormatter format) {
        try {
            return LocalDate.parse(value, format);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    public static boolean isBlankRow(Row row) {
        if (row == null) return true;
        for (Cell cell : row) {
            if (effectiveType(cell) == CellType.STRING) {
                if (!cell.getStringCellValue().trim().isEmpty()) {
                    return false;
                }
            } else if (effectiveType(cell) != CellType.BLANK) {
                return false;
            }
        }
        return true;
    }

    private static CellType effectiveType(Cell cell) {
        CellType type = cell.getCellType();
        return type == CellType.FORMULA ? cell.getCachedFormulaResultType() : type;
    }
}
