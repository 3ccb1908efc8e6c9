package com.flagship.bridge_ledger.pipeline.handler;

import com.flagship.bridge_ledger.conversion.ConversionSnapshot;
import com.flagship.bridge_ledger.conversion.Quote;
import com.flagship.bridge_ledger.error.ErrorKind;
import com.flagship.bridge_ledger.ledger.ChartOfAccounts;
import com.flagship.bridge_ledger.ledger.LedgerStore;
import com.flagship.bridge_ledger.ledger.LedgerType;
import com.flagship.bridge_ledger.pipeline.HandlerResult;
import com.flagship.bridge_ledger.pipeline.event.NetworkPayment;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import static com.flagship.bridge_ledger.pipeline.handler.EntryBuilder.msatsLeg;

/**
 * Books outgoing payments once they have succeeded. A payment started by a
 * chain event waits until that event's entries are in the ledger.
 */
@Component
@RequiredArgsConstructor
public class NetworkPaymentHandler implements EventHandler<NetworkPayment> {

    private final ChartOfAccounts chart;
    private final LedgerStore ledgerStore;

    @Override
    public HandlerResult handle(NetworkPayment payment, Quote quote) {
        EventChecks.requirePositiveAmount(payment);
        EventChecks.requireSettlement(payment);
        if (payment.getStatus() != NetworkPayment.Status.SUCCEEDED) {
            return HandlerResult.skipped("payment " + payment.getStatus());
        }
        EventChecks.requireCustomer(payment);

        String initiating = payment.getInitiatingGroupId();
        if (initiating != null && ledgerStore.findBySourceGroupId(initiating).isEmpty()) {
            return HandlerResult.retryable(ErrorKind.PENDING_DEPENDENCY,
                "initiating event " + initiating + " not yet in the ledger");
        }

        ConversionSnapshot paid = EntryBuilder.priced(payment, quote);
        EntryBuilder entries = new EntryBuilder(payment)
            .add(LedgerType.WITHDRAW_LIGHTNING,
                "Paid " + paid.getSats() + " sats for " + payment.getCustId(),
                msatsLeg(chart.customerLiability(payment.getCustId()), paid),
                msatsLeg(chart.treasuryLightning(), paid));
        if (payment.getFeeMsats() > 0) {
            ConversionSnapshot fee = ConversionSnapshot.ofMsats(payment.getFeeMsats(), quote, null);
            entries.add(LedgerType.FEE_EXPENSE,
                "Routing fee paid " + payment.getFeeMsats() + " msats",
                msatsLeg(chart.lightningNetworkFees(), fee),
                msatsLeg(chart.treasuryLightning(), fee));
        }
        return HandlerResult.posted(entries.build());
    }
}
