package com.flagship.bridge_ledger.quote;

import com.flagship.bridge_ledger.conversion.Quote;

import java.time.Instant;

/**
 * Source of exchange rate quotes.
 *
 * Implementations may call a remote rate service; callers must expect
 * {@link com.flagship.bridge_ledger.error.ExchangeRateUnavailableException}
 * or any runtime failure from the transport.
 */
public interface QuoteProvider {

    /**
     * Most recent quote available.
     */
    Quote latestQuote();

    /**
     * Quote whose fetch time is closest to {@code timestamp}.
     */
    Quote quoteNearest(Instant timestamp);

    /**
     * Provider identifier (e.g., "coingecko", "fixed").
     */
    String getProviderName();
}
