package com.flagship.bridge_ledger.conversion;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Instant;

/**
 * An amount priced once and frozen: the same value expressed in every supported unit,
 * together with the rates and fee components that applied at pricing time.
 *
 * Snapshots are stored with each ledger leg and are never re-priced, so
 * historical entries stay auditable after market rates move.
 */
@Value
@Builder
@Jacksonized
public class ConversionSnapshot {

    private static final int SNAPSHOT_SCALE = 6;
    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000);

    BigDecimal hive;
    BigDecimal hbd;
    BigDecimal usd;
    long sats;
    long msats;
    BigDecimal satsPerHive;
    BigDecimal satsPerHbd;
    Currency convertedFrom;
    BigDecimal value;
    BigDecimal feePercent;
    long feeFlatSats;
    String source;
    Instant fetchedAt;

    /**
     * Prices {@code amount} of {@code from} at {@code quote}, with no fee components.
     */
    public static ConversionSnapshot of(BigDecimal amount, Currency from, Quote quote) {
        return of(amount, from, quote, null);
    }

    public static ConversionSnapshot of(BigDecimal amount, Currency from, Quote quote, FeeSchedule fees) {
        long msats = toMsats(amount, from, quote);
        return fromMsats(msats, from, amount, quote, fees);
    }

    public static ConversionSnapshot ofMsats(long msats, Quote quote, FeeSchedule fees) {
        return fromMsats(msats, Currency.MSATS, BigDecimal.valueOf(msats), quote, fees);
    }

    /**
     * Converts to whole msats, truncating toward zero.
     */
    public static long toMsats(BigDecimal amount, Currency from, Quote quote) {
        return amount.multiply(quote.satsPer(from))
            .multiply(THOUSAND)
            .setScale(0, RoundingMode.DOWN)
            .longValueExact();
    }

    private static ConversionSnapshot fromMsats(long msats, Currency from, BigDecimal value,
                                                Quote quote, FeeSchedule fees) {
        BigDecimal satsPerHive = quote.satsPerHive();
        BigDecimal satsPerHbd = quote.satsPerHbd();
        BigDecimal msatsValue = BigDecimal.valueOf(msats);
        return ConversionSnapshot.builder()
            .msats(msats)
            .sats(msatsValue.divide(THOUSAND, 0, RoundingMode.HALF_UP).longValueExact())
            .hive(perUnit(msatsValue, satsPerHive))
            .hbd(perUnit(msatsValue, satsPerHbd))
            .usd(perUnit(msatsValue, quote.satsPerUsd()))
            .satsPerHive(satsPerHive)
            .satsPerHbd(satsPerHbd)
            .convertedFrom(from)
            .value(value)
            .feePercent(fees != null ? fees.effectivePercent() : BigDecimal.ZERO)
            .feeFlatSats(fees != null ? fees.getFlatFeeSats() : 0L)
            .source(quote.getSource())
            .fetchedAt(quote.getFetchedAt())
            .build();
    }

    private static BigDecimal perUnit(BigDecimal msats, BigDecimal satsPerUnit) {
        return msats.divide(satsPerUnit.multiply(THOUSAND), MathContext.DECIMAL128)
            .setScale(SNAPSHOT_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * The frozen value expressed in {@code currency}.
     */
    public BigDecimal valueIn(Currency currency) {
        return switch (currency) {
            case HIVE -> hive;
            case HBD -> hbd;
            case USD -> usd;
            case SATS -> BigDecimal.valueOf(sats);
            case MSATS -> BigDecimal.valueOf(msats);
        };
    }

    /**
     * Msats equivalent of {@code amount} of {@code unit}, priced at this snapshot's rates.
     */
    public long msatsFor(BigDecimal amount, Currency unit) {
        BigDecimal rate = switch (unit) {
            case HIVE -> satsPerHive;
            case HBD -> satsPerHbd;
            case USD -> usd.signum() == 0 ? BigDecimal.ZERO
                : BigDecimal.valueOf(msats).divide(THOUSAND).divide(usd, MathContext.DECIMAL128);
            case SATS -> BigDecimal.ONE;
            case MSATS -> new BigDecimal("0.001");
        };
        return amount.multiply(rate).multiply(THOUSAND).setScale(0, RoundingMode.HALF_UP).longValueExact();
    }
}
