package com.flagship.bridge_ledger.error;

import java.math.BigDecimal;

/**
 * Thrown when fees consume the whole amount offered for conversion.
 */
public class InsufficientAmountException extends LedgerException {

    private final long netMsats;

    public InsufficientAmountException(BigDecimal amount, String unit, long feeMsats, long netMsats) {
        super(ErrorKind.INSUFFICIENT_AMOUNT, String.format(
            "Insufficient amount to convert %s %s: fee %d msats leaves net %d msats",
            amount.toPlainString(), unit, feeMsats, netMsats));
        this.netMsats = netMsats;
    }

    public InsufficientAmountException(String message) {
        super(ErrorKind.INSUFFICIENT_AMOUNT, message);
        this.netMsats = 0;
    }

    public long getNetMsats() {
        return netMsats;
    }
}
