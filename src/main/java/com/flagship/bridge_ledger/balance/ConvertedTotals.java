package com.flagship.bridge_ledger.balance;

import com.flagship.bridge_ledger.conversion.ConversionSnapshot;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Sum of signed snapshots, i.e. the balance valued at the rates each entry was booked at.
 */
@Value
public class ConvertedTotals {

    public static final ConvertedTotals ZERO =
        new ConvertedTotals(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, 0L, 0L);

    BigDecimal hive;
    BigDecimal hbd;
    BigDecimal usd;
    long sats;
    long msats;

    public ConvertedTotals plus(ConversionSnapshot conv, int sign) {
        BigDecimal factor = BigDecimal.valueOf(sign);
        return new ConvertedTotals(
            hive.add(conv.getHive().multiply(factor)),
            hbd.add(conv.getHbd().multiply(factor)),
            usd.add(conv.getUsd().multiply(factor)),
            sats + sign * conv.getSats(),
            msats + sign * conv.getMsats());
    }
}
