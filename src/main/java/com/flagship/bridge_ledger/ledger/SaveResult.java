package com.flagship.bridge_ledger.ledger;

/**
 * Outcome of {@link LedgerStore#save}. A duplicate is a successful no-op.
 */
public enum SaveResult {
    SAVED,
    DUPLICATE
}
