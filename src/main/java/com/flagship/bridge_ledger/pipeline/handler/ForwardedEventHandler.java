package com.flagship.bridge_ledger.pipeline.handler;

import com.flagship.bridge_ledger.conversion.ConversionSnapshot;
import com.flagship.bridge_ledger.conversion.Quote;
import com.flagship.bridge_ledger.ledger.ChartOfAccounts;
import com.flagship.bridge_ledger.ledger.LedgerType;
import com.flagship.bridge_ledger.pipeline.HandlerResult;
import com.flagship.bridge_ledger.pipeline.event.ForwardedEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import static com.flagship.bridge_ledger.pipeline.handler.EntryBuilder.msatsLeg;

@Component
@RequiredArgsConstructor
public class ForwardedEventHandler implements EventHandler<ForwardedEvent> {

    private final ChartOfAccounts chart;

    @Override
    public HandlerResult handle(ForwardedEvent forward, Quote quote) {
        if (forward.getFeeMsats() <= 0) {
            return HandlerResult.skipped("forward earned no fee");
        }
        ConversionSnapshot fee = ConversionSnapshot.ofMsats(forward.getFeeMsats(), quote, null);
        return HandlerResult.posted(new EntryBuilder(forward)
            .add(LedgerType.ROUTING_FEE,
                "Routing fee " + forward.getFeeMsats() + " msats " + forward.getIncomingChannel()
                    + " -> " + forward.getOutgoingChannel(),
                msatsLeg(chart.treasuryLightning(), fee),
                msatsLeg(chart.routingFeeIncome(), fee))
            .build());
    }
}
