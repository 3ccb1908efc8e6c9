package com.flagship.bridge_ledger.pipeline.handler;

import com.flagship.bridge_ledger.balance.ConversionLimitService;
import com.flagship.bridge_ledger.conversion.ConversionCalculator;
import com.flagship.bridge_ledger.conversion.ConversionResult;
import com.flagship.bridge_ledger.conversion.ConversionSnapshot;
import com.flagship.bridge_ledger.conversion.Currency;
import com.flagship.bridge_ledger.conversion.Quote;
import com.flagship.bridge_ledger.error.ValidationException;
import com.flagship.bridge_ledger.ledger.Account;
import com.flagship.bridge_ledger.ledger.ChartOfAccounts;
import com.flagship.bridge_ledger.ledger.LedgerType;
import com.flagship.bridge_ledger.pipeline.HandlerResult;
import com.flagship.bridge_ledger.pipeline.event.NetworkInvoice;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

import static com.flagship.bridge_ledger.pipeline.handler.EntryBuilder.leg;
import static com.flagship.bridge_ledger.pipeline.handler.EntryBuilder.msatsLeg;

/**
 * Books invoices paid to the node.
 *
 * Funding invoices are owner loans. Otherwise the sats are credited to the
 * customer, and if the customer asked for a chain token they are converted
 * right away (receipt, conversion, offset, fee, notification fee).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NetworkInvoiceHandler implements EventHandler<NetworkInvoice> {

    private final ChartOfAccounts chart;
    private final ConversionCalculator calculator;
    private final ConversionLimitService limits;

    @Override
    public HandlerResult handle(NetworkInvoice invoice, Quote quote) {
        EventChecks.requirePositiveAmount(invoice);
        EventChecks.requireSettlement(invoice);
        if (!invoice.isSettled()) {
            return HandlerResult.skipped("invoice not settled");
        }

        ConversionSnapshot received = EntryBuilder.priced(invoice, quote);
        if (invoice.isFunding()) {
            return HandlerResult.posted(new EntryBuilder(invoice)
                .add(LedgerType.FUNDING,
                    "Funding " + received.getSats() + " sats to " + chart.getNodeName(),
                    msatsLeg(chart.treasuryLightning(), received),
                    msatsLeg(chart.ownerLoanPayable(), received))
                .build());
        }

        EventChecks.requireCustomer(invoice);
        Account liability = chart.customerLiability(invoice.getCustId());
        Currency target = invoice.getTargetUnit() != null ? invoice.getTargetUnit() : Currency.MSATS;
        EntryBuilder entries = new EntryBuilder(invoice)
            .add(LedgerType.RECEIVE_LIGHTNING,
                "Received " + received.getSats() + " sats for " + invoice.getCustId(),
                msatsLeg(chart.treasuryLightning(), received),
                msatsLeg(liability, received));

        if (target.isSettlement()) {
            return HandlerResult.posted(entries.build());
        }
        if (!target.isChainToken()) {
            throw new ValidationException("Invoice " + invoice.getGroupId() + " has unsupported target " + target);
        }

        ConversionResult result = calculator.convertForward(
            BigDecimal.valueOf(received.getMsats()), Currency.MSATS, target, quote);
        ConversionLimitService.LimitCheckResult limitCheck =
            limits.check(invoice.getCustId(), invoice.getGroupId(), result.getToConvertConv().getSats(), invoice.getTimestamp());
        if (!limitCheck.isAllowed()) {
            throw new ValidationException("Conversion limit exceeded for " + invoice.getCustId() + ": " + limitCheck);
        }
        log.info("Converting for {}: {}", invoice.getCustId(), result);

        ConversionSnapshot net = result.getNetConv();
        BigDecimal netTokens = result.netToReceiveIn(target);
        Account offset = chart.convertedKeepsatsOffset();
        entries
            .add(LedgerType.CONV_KEEPSATS_TO_HIVE,
                "Convert " + net.getMsats() + " msats to " + netTokens.toPlainString() + " " + target,
                msatsLeg(liability, net),
                leg(liability, target, netTokens, net))
            .add(LedgerType.CONTRA_KEEPSATS_TO_HIVE,
                "Offset " + net.getMsats() + " msats converted to " + target,
                leg(offset, target, netTokens, net),
                msatsLeg(offset, net))
            .add(LedgerType.FEE_INCOME,
                "Conversion fee " + result.getFeeConv().getMsats() + " msats",
                msatsLeg(liability, result.getFeeConv()),
                msatsLeg(chart.lightningFeeIncome(), result.getFeeConv()));

        if (result.getNotificationFeeConv().getMsats() > 0) {
            entries.add(LedgerType.CUSTOM_JSON_FEE,
                "Notification fee " + result.getNotificationFeeConv().getMsats() + " msats",
                msatsLeg(liability, result.getNotificationFeeConv()),
                msatsLeg(chart.lightningFeeIncome(), result.getNotificationFeeConv()));
        }
        return HandlerResult.posted(entries.build());
    }
}
