package com.finvolv.lease.exception;

public class InvalidReportingWindowException extends RuntimeException {
    public InvalidReportingWindowException(String message) {
        super(message);
    }

    public InvalidReportingWindowException(String message, Throwable cause) {
        super(message, cause);
    }
}
