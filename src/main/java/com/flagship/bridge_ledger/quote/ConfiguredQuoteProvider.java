package com.flagship.bridge_ledger.quote;

import com.flagship.bridge_ledger.conversion.Quote;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;

/**
 * Quote provider serving rates from configuration.
 *
 * Used in development and tests. A deployment that talks to a live rate
 * service registers its own {@link QuoteProvider} bean instead.
 */
@Component
@ConditionalOnProperty(name = "quote.provider", havingValue = "fixed", matchIfMissing = true)
@Slf4j
public class ConfiguredQuoteProvider implements QuoteProvider {

    private static final String PROVIDER_NAME = "fixed";

    private final BigDecimal hiveUsd;
    private final BigDecimal hbdUsd;
    private final BigDecimal btcUsd;
    private final Clock clock;

    @Autowired
    public ConfiguredQuoteProvider(@Value("${quote.fixed.hive-usd:0.25}") BigDecimal hiveUsd,
                                   @Value("${quote.fixed.hbd-usd:1.00}") BigDecimal hbdUsd,
                                   @Value("${quote.fixed.btc-usd:100000}") BigDecimal btcUsd) {
        this(hiveUsd, hbdUsd, btcUsd, Clock.systemUTC());
    }

    ConfiguredQuoteProvider(BigDecimal hiveUsd, BigDecimal hbdUsd, BigDecimal btcUsd, Clock clock) {
        this.hiveUsd = hiveUsd;
        this.hbdUsd = hbdUsd;
        this.btcUsd = btcUsd;
        this.clock = clock;
        log.info("Using configured quote: hive_usd={}, hbd_usd={}, btc_usd={}", hiveUsd, hbdUsd, btcUsd);
    }

    @Override
    public Quote latestQuote() {
        return quoteAt(clock.instant());
    }

    @Override
    public Quote quoteNearest(Instant timestamp) {
        return quoteAt(timestamp);
    }

    @Override
    public String getProviderName() {
        return PROVIDER_NAME;
    }

    private Quote quoteAt(Instant fetchedAt) {
        BigDecimal hiveHbd = hiveUsd.divide(hbdUsd, 6, RoundingMode.HALF_UP);
        return new Quote(hiveUsd, hbdUsd, btcUsd, hiveHbd, fetchedAt, PROVIDER_NAME);
    }
}
