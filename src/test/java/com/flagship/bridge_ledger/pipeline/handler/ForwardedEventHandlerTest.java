package com.flagship.bridge_ledger.pipeline.handler;

import com.flagship.bridge_ledger.conversion.Currency;
import com.flagship.bridge_ledger.ledger.LedgerType;
import com.flagship.bridge_ledger.pipeline.HandlerResult;
import com.flagship.bridge_ledger.pipeline.event.ForwardedEvent;
import com.flagship.bridge_ledger.support.PipelineFixture;
import com.flagship.bridge_ledger.support.TestQuotes;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class ForwardedEventHandlerTest {

    private final PipelineFixture fixture = new PipelineFixture();

    private ForwardedEvent forward(long feeMsats) {
        return ForwardedEvent.builder()
            .groupId("fwd-1")
            .timestamp(TestQuotes.FETCHED_AT)
            .amount(BigDecimal.valueOf(2_000_000))
            .unit(Currency.MSATS)
            .feeMsats(feeMsats)
            .incomingChannel("chan-in")
            .outgoingChannel("chan-out")
            .build();
    }

    @Test
    @DisplayName("A forward earning a fee books routing fee income")
    void testRoutingFee() {
        HandlerResult result = fixture.forwardedEventHandler.handle(forward(1_200), TestQuotes.standard());
        result.getEntries().forEach(fixture.ledgerStore::save);

        assertEquals(LedgerType.ROUTING_FEE, result.getEntries().get(0).getLedgerType());
        BigDecimal income = fixture.aggregator
            .balance(fixture.chart.routingFeeIncome(), TestQuotes.FETCHED_AT).total(Currency.MSATS);
        assertEquals(0, BigDecimal.valueOf(1_200).compareTo(income));
    }

    @Test
    @DisplayName("A forward without a fee is skipped")
    void testNoFee() {
        assertEquals(HandlerResult.Status.SKIPPED,
            fixture.forwardedEventHandler.handle(forward(0), TestQuotes.standard()).getStatus());
    }
}
