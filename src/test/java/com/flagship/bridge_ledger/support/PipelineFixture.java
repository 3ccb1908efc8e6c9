package com.flagship.bridge_ledger.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.bridge_ledger.balance.BalanceAggregator;
import com.flagship.bridge_ledger.balance.ConversionLimitService;
import com.flagship.bridge_ledger.config.JacksonConfig;
import com.flagship.bridge_ledger.conversion.ConversionCalculator;
import com.flagship.bridge_ledger.conversion.FeeSchedule;
import com.flagship.bridge_ledger.ledger.ChartOfAccounts;
import com.flagship.bridge_ledger.lock.LockCoordinator;
import com.flagship.bridge_ledger.lock.LockWaitRegistry;
import com.flagship.bridge_ledger.observability.LedgerMetrics;
import com.flagship.bridge_ledger.pipeline.EventDispatcher;
import com.flagship.bridge_ledger.pipeline.RetryPolicy;
import com.flagship.bridge_ledger.pipeline.TrackedEventProcessor;
import com.flagship.bridge_ledger.pipeline.handler.ChainNotificationHandler;
import com.flagship.bridge_ledger.pipeline.handler.ChainOrderFillHandler;
import com.flagship.bridge_ledger.pipeline.handler.ChainTransferHandler;
import com.flagship.bridge_ledger.pipeline.handler.ForwardedEventHandler;
import com.flagship.bridge_ledger.pipeline.handler.NetworkInvoiceHandler;
import com.flagship.bridge_ledger.pipeline.handler.NetworkPaymentHandler;
import com.flagship.bridge_ledger.pipeline.tracking.TrackedEventLog;
import com.flagship.bridge_ledger.quote.QuoteService;
import com.flagship.bridge_ledger.sanity.SanityChecker;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;

/**
 * The whole pipeline wired by hand on in-memory stores.
 *
 * Fees are 1.5% plus 50 sats, quotes come from a {@link StubQuoteProvider}
 * at 253.9118 sats per HIVE, and the clock is fixed at {@link TestQuotes#FETCHED_AT}.
 */
public class PipelineFixture {

    public final ChartOfAccounts chart = new ChartOfAccounts("v4vapp", "v4vapp.tre", "umbrel");
    public final InMemoryLedgerStore ledgerStore = new InMemoryLedgerStore();
    public final InMemoryLockBackend lockBackend = new InMemoryLockBackend();
    public final StubQuoteProvider quoteProvider = new StubQuoteProvider();
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final ObjectMapper objectMapper = JacksonConfig.configure(new ObjectMapper());
    public final Clock clock = Clock.fixed(TestQuotes.FETCHED_AT, ZoneOffset.UTC);

    public final ConversionCalculator calculator =
        new ConversionCalculator(new FeeSchedule(new BigDecimal("0.015"), BigDecimal.ZERO, 50), 250);
    public final BalanceAggregator aggregator = new BalanceAggregator(ledgerStore);
    public final ConversionLimitService limits =
        new ConversionLimitService(aggregator, chart, "4:400000,72:800000,168:1200000");

    public final ChainTransferHandler chainTransferHandler = new ChainTransferHandler(chart, calculator, limits);
    public final ChainOrderFillHandler chainOrderFillHandler = new ChainOrderFillHandler(chart);
    public final ChainNotificationHandler chainNotificationHandler = new ChainNotificationHandler(chart, aggregator);
    public final NetworkInvoiceHandler networkInvoiceHandler = new NetworkInvoiceHandler(chart, calculator, limits);
    public final NetworkPaymentHandler networkPaymentHandler = new NetworkPaymentHandler(chart, ledgerStore);
    public final ForwardedEventHandler forwardedEventHandler = new ForwardedEventHandler(chart);
    public final EventDispatcher dispatcher = new EventDispatcher(chainTransferHandler, chainOrderFillHandler,
        chainNotificationHandler, networkInvoiceHandler, networkPaymentHandler, forwardedEventHandler);

    public final QuoteService quoteService = new QuoteService(quoteProvider, Duration.ofMinutes(5), clock);
    public final SanityChecker sanityChecker = new SanityChecker(ledgerStore);
    public final LedgerMetrics metrics = new LedgerMetrics(meterRegistry);

    public final LockCoordinator lockCoordinator;
    public final TrackedEventLog eventLog;
    public final TrackedEventProcessor processor;

    public PipelineFixture() {
        this(new InMemoryTrackedEventLog(), Duration.ofSeconds(5));
    }

    public PipelineFixture(TrackedEventLog eventLog, Duration lockTimeout) {
        this.eventLog = eventLog;
        this.lockCoordinator = new LockCoordinator(lockBackend, new LockWaitRegistry(),
            Duration.ofSeconds(30), lockTimeout, Duration.ofMillis(100));
        this.processor = new TrackedEventProcessor(eventLog, ledgerStore, lockCoordinator, quoteService,
            dispatcher, new RetryPolicy(3, Duration.ofMillis(1)), sanityChecker, metrics, objectMapper, clock);
    }
}
