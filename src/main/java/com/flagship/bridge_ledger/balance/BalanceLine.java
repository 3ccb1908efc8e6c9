package com.flagship.bridge_ledger.balance;

import com.flagship.bridge_ledger.conversion.Currency;
import com.flagship.bridge_ledger.ledger.EntryType;
import com.flagship.bridge_ledger.ledger.LedgerType;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One leg touching the account, with the account's running total in that
 * leg's unit after the leg is applied.
 */
@Value
public class BalanceLine {
    Instant timestamp;
    String groupId;
    LedgerType ledgerType;
    String description;
    EntryType side;
    Currency unit;
    BigDecimal signedAmount;
    BigDecimal runningTotal;
    long signedMsats;
    long runningMsats;
}
