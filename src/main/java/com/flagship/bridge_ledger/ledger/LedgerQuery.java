package com.flagship.bridge_ledger.ledger;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Set;

/**
 * Selection of entries touching one account. Null bounds and filters are open.
 */
@Value
@Builder
public class LedgerQuery {
    Account account;
    String custId;
    @Singular
    Set<LedgerType> ledgerTypes;
    Instant from;
    Instant to;

    public boolean matches(LedgerEntry entry) {
        if (!entry.touches(account)) {
            return false;
        }
        if (custId != null && !custId.equals(entry.getCustId())) {
            return false;
        }
        if (!ledgerTypes.isEmpty() && !ledgerTypes.contains(entry.getLedgerType())) {
            return false;
        }
        if (from != null && entry.getTimestamp().isBefore(from)) {
            return false;
        }
        return to == null || !entry.getTimestamp().isAfter(to);
    }
}
