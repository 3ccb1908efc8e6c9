package com.flagship.bridge_ledger.ledger;

import com.flagship.bridge_ledger.conversion.ConversionSnapshot;
import com.flagship.bridge_ledger.conversion.Currency;
import com.flagship.bridge_ledger.error.ValidationException;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One side of a ledger entry: an amount of one unit booked against one account,
 * with the snapshot it was priced at.
 */
@Value
public class LedgerLeg {
    Account account;
    Currency unit;
    BigDecimal amount;
    ConversionSnapshot conv;

    private LedgerLeg(Account account, Currency unit, BigDecimal amount, ConversionSnapshot conv) {
        this.account = Objects.requireNonNull(account, "account");
        this.unit = Objects.requireNonNull(unit, "unit");
        this.amount = Objects.requireNonNull(amount, "amount");
        this.conv = Objects.requireNonNull(conv, "conv");
        if (amount.signum() < 0) {
            throw new ValidationException("Leg amount must not be negative: " + amount + " " + unit);
        }
    }

    public static LedgerLeg of(Account account, Currency unit, BigDecimal amount, ConversionSnapshot conv) {
        return new LedgerLeg(account, unit, amount, conv);
    }

    /**
     * Value of this leg's own amount in msats, at its snapshot's rates.
     */
    public long msats() {
        return conv.msatsFor(amount, unit);
    }

    /**
     * The unit tolerance of this leg expressed in msats.
     */
    public long toleranceMsats() {
        if (unit == Currency.MSATS) {
            return unit.getTolerance().longValueExact();
        }
        return conv.msatsFor(unit.getTolerance(), unit);
    }
}
