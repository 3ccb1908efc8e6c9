package com.flagship.bridge_ledger.error;

public class ExchangeRateUnavailableException extends LedgerException {

    public ExchangeRateUnavailableException(String message) {
        super(ErrorKind.EXCHANGE_RATE_UNAVAILABLE, message);
    }

    public ExchangeRateUnavailableException(String message, Throwable cause) {
        super(ErrorKind.EXCHANGE_RATE_UNAVAILABLE, message, cause);
    }
}
