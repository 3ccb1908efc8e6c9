package com.flagship.bridge_ledger.ledger;

import lombok.Value;

/**
 * Ledger-wide sums used by the sanity checks.
 */
@Value
public class LedgerTotals {
    long entryCount;
    long debitMsats;
    long creditMsats;
}
