package com.flagship.bridge_ledger.pipeline.handler;

import com.flagship.bridge_ledger.conversion.Currency;
import com.flagship.bridge_ledger.error.ValidationException;
import com.flagship.bridge_ledger.pipeline.event.TrackedEvent;

import java.math.BigDecimal;

final class EventChecks {

    private EventChecks() {
    }

    static void requirePositiveAmount(TrackedEvent event) {
        BigDecimal amount = event.getAmount();
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException(event.kind() + " " + event.getGroupId() + " has no positive amount: " + amount);
        }
    }

    static void requireChainToken(TrackedEvent event) {
        Currency unit = event.getUnit();
        if (unit == null || !unit.isChainToken()) {
            throw new ValidationException(event.kind() + " " + event.getGroupId() + " must be in HIVE or HBD, got " + unit);
        }
    }

    static void requireSettlement(TrackedEvent event) {
        Currency unit = event.getUnit();
        if (unit == null || !unit.isSettlement()) {
            throw new ValidationException(event.kind() + " " + event.getGroupId() + " must be in SATS or MSATS, got " + unit);
        }
    }

    static void requireCustomer(TrackedEvent event) {
        if (event.getCustId() == null || event.getCustId().isBlank()) {
            throw new ValidationException(event.kind() + " " + event.getGroupId() + " has no customer");
        }
    }

    static String amountText(BigDecimal amount, Currency unit) {
        return amount.toPlainString() + " " + unit;
    }
}
