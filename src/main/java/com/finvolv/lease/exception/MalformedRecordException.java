package com.finvolv.lease.exception;

/**
 * Raised when a bank or invoice row carries a value that cannot be interpreted.
 * Always absorbed by the reconciliation step.
 */
public class MalformedRecordException extends RuntimeException {
    public MalformedRecordException(String message) {
        super(message);
    }
}
