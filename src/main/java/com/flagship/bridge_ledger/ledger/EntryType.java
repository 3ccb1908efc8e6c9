package com.flagship.bridge_ledger.ledger;

/**
 * Side of a ledger entry a leg sits on.
 */
public enum EntryType {
    DEBIT,
    CREDIT
}
