package com.flagship.bridge_ledger.quote;

import com.flagship.bridge_ledger.conversion.Quote;
import com.flagship.bridge_ledger.error.ExchangeRateUnavailableException;
import com.flagship.bridge_ledger.support.TestQuotes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class QuoteServiceTest {

    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

    @Mock
    private QuoteProvider provider;

    private QuoteService quoteService;

    @BeforeEach
    void setUp() {
        lenient().when(provider.getProviderName()).thenReturn("mock");
        quoteService = new QuoteService(provider, Duration.ofMinutes(5), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @Test
    @DisplayName("Recent events are priced at the latest quote")
    void testRecentEventUsesLatest() {
        printTestHeader("Latest Quote");

        when(provider.latestQuote()).thenReturn(TestQuotes.standard());

        QuoteLookup lookup = quoteService.quoteFor(NOW.minusSeconds(30));

        assertFalse(lookup.isDegraded());
        assertEquals(0, new BigDecimal("253.9118").compareTo(lookup.getQuote().satsPerHive()));
        verify(provider, never()).quoteNearest(any());
        printSuccess("Live quote used");
    }

    @Test
    @DisplayName("Old events are priced at the quote nearest their timestamp")
    void testHistoricEventUsesNearest() {
        printTestHeader("Historic Quote");

        Instant eventTime = NOW.minus(Duration.ofHours(2));
        when(provider.quoteNearest(eventTime)).thenReturn(TestQuotes.quote("0.30", "1.00", "100000"));

        QuoteLookup lookup = quoteService.quoteFor(eventTime);

        assertFalse(lookup.isDegraded());
        assertEquals(0, new BigDecimal("300.0000").compareTo(lookup.getQuote().satsPerHive()));
        verify(provider, never()).latestQuote();
        printSuccess("Historic quote used");
    }

    @Test
    @DisplayName("A provider failure falls back to the last known quote and flags it")
    void testFallbackToLastKnown() {
        printTestHeader("Degraded Fallback");

        Quote good = TestQuotes.standard();
        when(provider.latestQuote())
            .thenReturn(good)
            .thenThrow(new IllegalStateException("rate service down"));

        quoteService.quoteFor(NOW);
        QuoteLookup lookup = quoteService.quoteFor(NOW);

        assertTrue(lookup.isDegraded());
        assertSame(good, lookup.getQuote());
        assertSame(good, quoteService.lastKnownQuote().orElseThrow());
        printSuccess("Last known quote returned as degraded");
    }

    @Test
    @DisplayName("Without any previous quote a provider failure is ExchangeRateUnavailable")
    void testNoQuoteAvailable() {
        printTestHeader("No Quote Available");

        when(provider.latestQuote()).thenThrow(new IllegalStateException("rate service down"));

        ExchangeRateUnavailableException e = assertThrows(ExchangeRateUnavailableException.class,
            () -> quoteService.quoteFor(NOW));
        assertTrue(e.isRetryable());
        assertTrue(quoteService.lastKnownQuote().isEmpty());
        printSuccess("Retryable exchange rate failure");
    }

    @Test
    @DisplayName("An unusable quote from the provider is not cached")
    void testUnusableQuoteRejected() {
        printTestHeader("Unusable Quote");

        when(provider.latestQuote()).thenReturn(TestQuotes.quote("0.25", "1.00", "0"));

        assertThrows(ExchangeRateUnavailableException.class, () -> quoteService.quoteFor(NOW));
        assertTrue(quoteService.lastKnownQuote().isEmpty());
        printSuccess("Zero BTC price refused");
    }

    @Test
    @DisplayName("The configured provider serves its fixed rates at the requested time")
    void testConfiguredProvider() {
        printTestHeader("Configured Provider");

        ConfiguredQuoteProvider fixed = new ConfiguredQuoteProvider(
            new BigDecimal("0.2539118"), new BigDecimal("1.00"), new BigDecimal("100000"),
            Clock.fixed(NOW, ZoneOffset.UTC));

        assertEquals(NOW, fixed.latestQuote().getFetchedAt());
        Instant earlier = NOW.minus(Duration.ofDays(1));
        assertEquals(earlier, fixed.quoteNearest(earlier).getFetchedAt());
        assertEquals("fixed", fixed.getProviderName());
        assertTrue(fixed.latestQuote().isUsable());
        printSuccess("Fixed rates served");
    }
}
