package com.flagship.bridge_ledger.pipeline.handler;

import com.flagship.bridge_ledger.balance.BalanceAggregator;
import com.flagship.bridge_ledger.conversion.ConversionSnapshot;
import com.flagship.bridge_ledger.conversion.Currency;
import com.flagship.bridge_ledger.conversion.Quote;
import com.flagship.bridge_ledger.error.InsufficientAmountException;
import com.flagship.bridge_ledger.error.ValidationException;
import com.flagship.bridge_ledger.ledger.Account;
import com.flagship.bridge_ledger.ledger.ChartOfAccounts;
import com.flagship.bridge_ledger.ledger.LedgerType;
import com.flagship.bridge_ledger.pipeline.HandlerResult;
import com.flagship.bridge_ledger.pipeline.event.ChainNotification;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

import static com.flagship.bridge_ledger.pipeline.handler.EntryBuilder.msatsLeg;

/**
 * Custom JSON operations on the chain. Plain notifications carry no value;
 * keepsats transfers move msats between two customers' liability accounts.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChainNotificationHandler implements EventHandler<ChainNotification> {

    private final ChartOfAccounts chart;
    private final BalanceAggregator aggregator;

    @Override
    public HandlerResult handle(ChainNotification notification, Quote quote) {
        if (notification.getPurpose() == null) {
            throw new ValidationException("Notification " + notification.getGroupId() + " has no purpose");
        }
        return switch (notification.getPurpose()) {
            case NOTIFICATION -> HandlerResult.skipped("notification carries no value");
            case KEEPSATS_TRANSFER -> transfer(notification, quote);
        };
    }

    private HandlerResult transfer(ChainNotification notification, Quote quote) {
        EventChecks.requirePositiveAmount(notification);
        EventChecks.requireSettlement(notification);
        EventChecks.requireCustomer(notification);
        String from = notification.getCustId();
        String to = notification.getToCustId();
        if (to == null || to.isBlank() || to.equals(from)) {
            throw new ValidationException("Keepsats transfer " + notification.getGroupId() + " has no distinct recipient");
        }

        ConversionSnapshot conv = EntryBuilder.priced(notification, quote);
        Account sender = chart.customerLiability(from);
        BigDecimal available = aggregator.balance(sender, notification.getTimestamp()).total(Currency.MSATS);
        if (available.compareTo(BigDecimal.valueOf(conv.getMsats())) < 0) {
            throw new InsufficientAmountException("Customer " + from + " holds " + available.toPlainString()
                + " msats, transfer needs " + conv.getMsats());
        }
        log.debug("Keepsats transfer {} -> {}: {} msats", from, to, conv.getMsats());

        return HandlerResult.posted(new EntryBuilder(notification)
            .add(LedgerType.CUSTOM_JSON_TRANSFER,
                "Transfer " + conv.getMsats() + " msats from " + from + " to " + to,
                msatsLeg(sender, conv),
                msatsLeg(chart.customerLiability(to), conv))
            .build());
    }
}
