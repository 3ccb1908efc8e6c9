package com.flagship.bridge_ledger.pipeline.handler;

import com.flagship.bridge_ledger.conversion.ConversionSnapshot;
import com.flagship.bridge_ledger.conversion.Currency;
import com.flagship.bridge_ledger.conversion.Quote;
import com.flagship.bridge_ledger.error.ValidationException;
import com.flagship.bridge_ledger.ledger.ChartOfAccounts;
import com.flagship.bridge_ledger.ledger.LedgerType;
import com.flagship.bridge_ledger.pipeline.HandlerResult;
import com.flagship.bridge_ledger.pipeline.event.ChainOrderFill;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import static com.flagship.bridge_ledger.pipeline.handler.EntryBuilder.leg;
import static com.flagship.bridge_ledger.pipeline.handler.EventChecks.amountText;

/**
 * Books an internal-market fill as a sell of the paid token and a buy of the
 * received one, both routed through the exchange offset account.
 */
@Component
@RequiredArgsConstructor
public class ChainOrderFillHandler implements EventHandler<ChainOrderFill> {

    private final ChartOfAccounts chart;

    @Override
    public HandlerResult handle(ChainOrderFill fill, Quote quote) {
        EventChecks.requirePositiveAmount(fill);
        EventChecks.requireChainToken(fill);
        Currency receivedUnit = fill.getReceivedUnit();
        if (receivedUnit == null || !receivedUnit.isChainToken() || receivedUnit == fill.getUnit()) {
            throw new ValidationException("Order fill " + fill.getGroupId() + " must receive the other chain token, got " + receivedUnit);
        }
        if (fill.getReceivedAmount() == null || fill.getReceivedAmount().signum() <= 0) {
            throw new ValidationException("Order fill " + fill.getGroupId() + " has no received amount");
        }

        ConversionSnapshot paid = EntryBuilder.priced(fill, quote);
        ConversionSnapshot received = ConversionSnapshot.of(fill.getReceivedAmount(), receivedUnit, quote);
        String custId = fill.getCustId() != null ? fill.getCustId() : chart.getServerAccount();

        return HandlerResult.posted(new EntryBuilder(fill)
            .add(LedgerType.FILL_ORDER_SELL, custId,
                "Order " + fill.getOrderId() + " sold " + amountText(fill.getAmount(), fill.getUnit()),
                leg(chart.exchangeConversionOffset(), fill.getUnit(), fill.getAmount(), paid),
                leg(chart.customerDepositsHive(), fill.getUnit(), fill.getAmount(), paid))
            .add(LedgerType.FILL_ORDER_BUY, custId,
                "Order " + fill.getOrderId() + " bought " + amountText(fill.getReceivedAmount(), receivedUnit),
                leg(chart.customerDepositsHive(), receivedUnit, fill.getReceivedAmount(), received),
                leg(chart.exchangeConversionOffset(), receivedUnit, fill.getReceivedAmount(), received))
            .build());
    }
}
