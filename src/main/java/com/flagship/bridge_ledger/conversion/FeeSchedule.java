package com.flagship.bridge_ledger.conversion;

import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Conversion fee: a percentage (plus market spread) of the converted amount and a flat fee.
 */
@Value
public class FeeSchedule {
    BigDecimal feePercent;
    BigDecimal marginSpread;
    long flatFeeSats;

    /**
     * Fee charged for converting {@code msats}, rounded to whole msats.
     */
    public long msatsFee(long msats) {
        return feePercent.add(marginSpread)
            .multiply(BigDecimal.valueOf(msats))
            .add(BigDecimal.valueOf(flatFeeSats * 1000L))
            .setScale(0, RoundingMode.HALF_UP)
            .longValueExact();
    }

    public BigDecimal effectivePercent() {
        return feePercent.add(marginSpread);
    }
}
