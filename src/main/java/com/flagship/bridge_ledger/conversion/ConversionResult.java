package com.flagship.bridge_ledger.conversion;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Breakdown of one conversion. Amounts are in the source unit; each part
 * carries its own snapshot so entries can be built from any of them.
 */
@Value
@Builder
public class ConversionResult {
    Currency from;
    Currency to;

    BigDecimal original;
    ConversionSnapshot originalConv;

    BigDecimal toConvert;
    ConversionSnapshot toConvertConv;

    BigDecimal netToReceive;
    ConversionSnapshot netConv;

    BigDecimal fee;
    ConversionSnapshot feeConv;

    BigDecimal change;
    ConversionSnapshot changeConv;

    BigDecimal notificationFee;
    ConversionSnapshot notificationFeeConv;

    /**
     * Net amount the recipient gets, in the target unit.
     */
    public BigDecimal netToReceiveIn(Currency currency) {
        return currency.round(netConv.valueIn(currency));
    }

    /**
     * Sum of all parts in the source unit; equals the original amount.
     */
    public BigDecimal balance() {
        return change.add(fee).add(netToReceive).add(notificationFee);
    }

    @Override
    public String toString() {
        return String.format(
            "%s %s -> %s: to_convert=%s (%d sats), fee=%s (%d sats), net=%s (%d sats), change=%s, notification=%s",
            original.toPlainString(), from, to,
            toConvert.toPlainString(), toConvertConv.getSats(),
            fee.toPlainString(), feeConv.getSats(),
            netToReceive.toPlainString(), netConv.getSats(),
            change.toPlainString(), notificationFee.toPlainString());
    }
}
