package com.flagship.bridge_ledger.error;

/**
 * Thrown when the ledger database is temporarily unreachable.
 */
public class TransientStoreException extends LedgerException {

    public TransientStoreException(String message, Throwable cause) {
        super(ErrorKind.TRANSIENT_STORE, message, cause);
    }
}
