package com.flagship.bridge_ledger.support;

import com.flagship.bridge_ledger.conversion.Quote;

import java.math.BigDecimal;
import java.time.Instant;

public final class TestQuotes {

    public static final Instant FETCHED_AT = Instant.parse("2025-06-01T12:00:00Z");

    private TestQuotes() {
    }

    /**
     * BTC at 100,000 USD and HIVE at 0.2539118 USD: 253.9118 sats per HIVE.
     */
    public static Quote standard() {
        return quote("0.2539118", "1.00", "100000");
    }

    public static Quote quote(String hiveUsd, String hbdUsd, String btcUsd) {
        BigDecimal hive = new BigDecimal(hiveUsd);
        BigDecimal hbd = new BigDecimal(hbdUsd);
        return new Quote(hive, hbd, new BigDecimal(btcUsd),
            hive.divide(hbd, 6, java.math.RoundingMode.HALF_UP), FETCHED_AT, "test");
    }
}
