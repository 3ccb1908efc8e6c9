package com.flagship.bridge_ledger.conversion;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.flagship.bridge_ledger.error.ExchangeRateUnavailableException;
import lombok.Value;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;

/**
 * Exchange rates across the supported currencies at one point in time.
 *
 * Rates are USD prices; sats-per-unit values are derived from the BTC price
 * and rounded to 4 decimal places.
 */
@Value
public class Quote {

    private static final BigDecimal SATS_PER_BTC = new BigDecimal("100000000");
    private static final int RATE_SCALE = 4;

    BigDecimal hiveUsd;
    BigDecimal hbdUsd;
    BigDecimal btcUsd;
    BigDecimal hiveHbd;
    Instant fetchedAt;
    String source;

    public BigDecimal satsPerHive() {
        return satsPerUsdPriced(requireRate(hiveUsd, "hive_usd"));
    }

    public BigDecimal satsPerHbd() {
        return satsPerUsdPriced(requireRate(hbdUsd, "hbd_usd"));
    }

    public BigDecimal satsPerUsd() {
        return satsPerUsdPriced(BigDecimal.ONE);
    }

    /**
     * Sats per one whole unit of the given currency.
     */
    public BigDecimal satsPer(Currency currency) {
        return switch (currency) {
            case HIVE -> satsPerHive();
            case HBD -> satsPerHbd();
            case USD -> satsPerUsd();
            case SATS -> BigDecimal.ONE;
            case MSATS -> new BigDecimal("0.001");
        };
    }

    /**
     * Fails with {@link ExchangeRateUnavailableException} unless every rate is present and positive.
     */
    public Quote validate() {
        requireRate(btcUsd, "btc_usd");
        requireRate(hiveUsd, "hive_usd");
        requireRate(hbdUsd, "hbd_usd");
        return this;
    }

    @JsonIgnore
    public boolean isUsable() {
        return isPositive(btcUsd) && isPositive(hiveUsd) && isPositive(hbdUsd);
    }

    public Duration ageAt(Instant instant) {
        if (fetchedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(fetchedAt, instant).abs();
    }

    private BigDecimal satsPerUsdPriced(BigDecimal usdPrice) {
        BigDecimal btc = requireRate(btcUsd, "btc_usd");
        return SATS_PER_BTC.divide(btc, MathContext.DECIMAL128)
            .multiply(usdPrice)
            .setScale(RATE_SCALE, RoundingMode.HALF_UP);
    }

    private BigDecimal requireRate(BigDecimal rate, String name) {
        if (!isPositive(rate)) {
            throw new ExchangeRateUnavailableException(
                "Quote from " + source + " has no usable " + name + " rate: " + rate);
        }
        return rate;
    }

    private static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }
}
