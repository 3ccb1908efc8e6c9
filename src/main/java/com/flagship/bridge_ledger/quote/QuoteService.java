package com.flagship.bridge_ledger.quote;

import com.flagship.bridge_ledger.conversion.Quote;
import com.flagship.bridge_ledger.error.ExchangeRateUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Picks the quote used to price an event.
 *
 * Events close to now are priced at the latest quote; older events (replays,
 * recovery) are priced at the quote nearest their own timestamp. When the
 * provider fails, the last good quote seen by this instance is returned and
 * the lookup is flagged as degraded.
 */
@Service
@Slf4j
public class QuoteService {

    private final QuoteProvider provider;
    private final Duration staleAfter;
    private final Clock clock;
    private final AtomicReference<Quote> lastKnown = new AtomicReference<>();

    @Autowired
    public QuoteService(QuoteProvider provider,
                        @Value("${quote.stale-after:PT5M}") Duration staleAfter) {
        this(provider, staleAfter, Clock.systemUTC());
    }

    public QuoteService(QuoteProvider provider, Duration staleAfter, Clock clock) {
        this.provider = provider;
        this.staleAfter = staleAfter;
        this.clock = clock;
    }

    /**
     * Quote for an event that happened at {@code eventTime}.
     *
     * @throws ExchangeRateUnavailableException if the provider fails and no quote was ever obtained
     */
    public QuoteLookup quoteFor(Instant eventTime) {
        Instant now = clock.instant();
        boolean historic = eventTime != null && Duration.between(eventTime, now).compareTo(staleAfter) > 0;
        try {
            Quote quote = historic ? provider.quoteNearest(eventTime) : provider.latestQuote();
            if (quote == null || !quote.isUsable()) {
                throw new ExchangeRateUnavailableException(
                    "Provider " + provider.getProviderName() + " returned an unusable quote: " + quote);
            }
            lastKnown.set(quote);
            return QuoteLookup.live(quote);
        } catch (RuntimeException e) {
            Quote fallback = lastKnown.get();
            if (fallback == null) {
                if (e instanceof ExchangeRateUnavailableException) {
                    throw e;
                }
                throw new ExchangeRateUnavailableException(
                    "Quote provider " + provider.getProviderName() + " failed and no previous quote is known", e);
            }
            log.warn("Quote provider {} failed ({}), using last known quote fetched at {}",
                provider.getProviderName(), e.getMessage(), fallback.getFetchedAt());
            return QuoteLookup.fallback(fallback);
        }
    }

    public Optional<Quote> lastKnownQuote() {
        return Optional.ofNullable(lastKnown.get());
    }
}
