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
import com.flagship.bridge_ledger.pipeline.event.ChainTransfer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import static com.flagship.bridge_ledger.pipeline.handler.EntryBuilder.leg;
import static com.flagship.bridge_ledger.pipeline.handler.EntryBuilder.msatsLeg;
import static com.flagship.bridge_ledger.pipeline.handler.EventChecks.amountText;

/**
 * Books chain token transfers between customers and the server.
 *
 * A transfer marked for conversion is priced forward into msats and posts four
 * entries: the deposit, the conversion of the customer's balance, the offset
 * reclass and the conversion fee.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChainTransferHandler implements EventHandler<ChainTransfer> {

    private final ChartOfAccounts chart;
    private final ConversionCalculator calculator;
    private final ConversionLimitService limits;

    @Override
    public HandlerResult handle(ChainTransfer transfer, Quote quote) {
        EventChecks.requirePositiveAmount(transfer);
        EventChecks.requireChainToken(transfer);
        if (transfer.getIntent() == null) {
            throw new ValidationException("Chain transfer " + transfer.getGroupId() + " has no intent");
        }
        return switch (transfer.getIntent()) {
            case DEPOSIT -> deposit(transfer, quote);
            case WITHDRAWAL -> withdrawal(transfer, quote);
            case TREASURY_SWEEP -> treasurySweep(transfer, quote);
            case CONVERT_TO_KEEPSATS -> convertToKeepsats(transfer, quote);
        };
    }

    private HandlerResult deposit(ChainTransfer transfer, Quote quote) {
        EventChecks.requireCustomer(transfer);
        ConversionSnapshot conv = EntryBuilder.priced(transfer, quote);
        Currency unit = transfer.getUnit();
        return HandlerResult.posted(new EntryBuilder(transfer)
            .add(LedgerType.CUSTOMER_HIVE_IN,
                "Deposit " + amountText(transfer.getAmount(), unit) + " from " + transfer.getFrom(),
                leg(chart.customerDepositsHive(), unit, transfer.getAmount(), conv),
                leg(chart.customerLiability(transfer.getCustId()), unit, transfer.getAmount(), conv))
            .build());
    }

    private HandlerResult withdrawal(ChainTransfer transfer, Quote quote) {
        EventChecks.requireCustomer(transfer);
        ConversionSnapshot conv = EntryBuilder.priced(transfer, quote);
        Currency unit = transfer.getUnit();
        return HandlerResult.posted(new EntryBuilder(transfer)
            .add(LedgerType.CUSTOMER_HIVE_OUT,
                "Withdraw " + amountText(transfer.getAmount(), unit) + " to " + transfer.getTo(),
                leg(chart.customerLiability(transfer.getCustId()), unit, transfer.getAmount(), conv),
                leg(chart.customerDepositsHive(), unit, transfer.getAmount(), conv))
            .build());
    }

    private HandlerResult treasurySweep(ChainTransfer transfer, Quote quote) {
        ConversionSnapshot conv = EntryBuilder.priced(transfer, quote);
        Currency unit = transfer.getUnit();
        return HandlerResult.posted(new EntryBuilder(transfer)
            .add(LedgerType.SERVER_TO_TREASURY,
                "Move " + amountText(transfer.getAmount(), unit) + " to " + chart.getTreasuryAccount(),
                leg(chart.treasuryHive(), unit, transfer.getAmount(), conv),
                leg(chart.customerDepositsHive(), unit, transfer.getAmount(), conv))
            .build());
    }

    private HandlerResult convertToKeepsats(ChainTransfer transfer, Quote quote) {
        EventChecks.requireCustomer(transfer);
        String custId = transfer.getCustId();
        Currency unit = transfer.getUnit();

        ConversionResult result = calculator.convertForward(transfer.getAmount(), unit, Currency.MSATS, quote);
        ConversionLimitService.LimitCheckResult limitCheck =
            limits.check(custId, transfer.getGroupId(), result.getToConvertConv().getSats(), transfer.getTimestamp());
        if (!limitCheck.isAllowed()) {
            throw new ValidationException("Conversion limit exceeded for " + custId + ": " + limitCheck);
        }
        log.info("Converting for {}: {}", custId, result);

        Account liability = chart.customerLiability(custId);
        Account offset = chart.convertedKeepsatsOffset();
        ConversionSnapshot original = result.getOriginalConv();
        ConversionSnapshot toConvert = result.getToConvertConv();

        return HandlerResult.posted(new EntryBuilder(transfer)
            .add(LedgerType.CUSTOMER_HIVE_IN,
                "Deposit " + amountText(result.getOriginal(), unit) + " from " + transfer.getFrom() + " for conversion",
                leg(chart.customerDepositsHive(), unit, result.getOriginal(), original),
                leg(liability, unit, result.getOriginal(), original))
            .add(LedgerType.CONV_HIVE_TO_KEEPSATS,
                "Convert " + amountText(result.getToConvert(), unit) + " to " + toConvert.getMsats() + " msats",
                leg(liability, unit, result.getToConvert(), toConvert),
                msatsLeg(liability, toConvert))
            .add(LedgerType.CONTRA_HIVE_TO_KEEPSATS,
                "Offset " + amountText(result.getToConvert(), unit) + " converted to keepsats",
                msatsLeg(offset, toConvert),
                leg(offset, unit, result.getToConvert(), toConvert))
            .add(LedgerType.FEE_INCOME,
                "Conversion fee " + result.getFeeConv().getMsats() + " msats",
                msatsLeg(liability, result.getFeeConv()),
                msatsLeg(chart.keepsatsFeeIncome(), result.getFeeConv()))
            .build());
    }
}
