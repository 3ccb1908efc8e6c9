package com.flagship.bridge_ledger.balance;

import com.flagship.bridge_ledger.conversion.Currency;
import com.flagship.bridge_ledger.ledger.Account;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class AccountBalance {
    Account account;
    Instant asOf;
    /** Start of the age window, or null when the whole history was read. */
    Instant from;
    Map<Currency, BigDecimal> totals;
    ConvertedTotals converted;
    /** Empty unless line items were requested. */
    List<BalanceLine> lines;
    int entryCount;

    public BigDecimal total(Currency unit) {
        return totals.getOrDefault(unit, BigDecimal.ZERO);
    }
}
