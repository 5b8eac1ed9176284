package com.finvolv.lease.exception;

public class WorkbookLoadException extends RuntimeException {
    public WorkbookLoadException(String message) {
        super(message);
    }

    public WorkbookLoadException(String message, Throwable cause) {
        super(message, cause);
    }

    public static WorkbookLoadException missingSheet(String sheetName) {
        return new WorkbookLoadException("Sheet '" + sheetName + "' not found in the workbook");
    }

    public static WorkbookLoadException missingColumn(String sheetName, String columnName) {
        return new WorkbookLoadException("Column '" + columnName + "' not found in sheet '" + sheetName + "'");
    }

    public static WorkbookLoadException unreadableValue(String sheetName, int rowNumber, String columnName, String raw) {
        return new WorkbookLoadException("Unreadable " + columnName + " '" + raw + "' in sheet '" + sheetName
            + "', row " + rowNumber);
    }
}
