package com.flagship.bridge_ledger.error;

/**
 * Thrown for malformed input. Never retried.
 */
public class ValidationException extends LedgerException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }

    public ValidationException(String message, Throwable cause) {
        super(ErrorKind.VALIDATION, message, cause);
    }
}
