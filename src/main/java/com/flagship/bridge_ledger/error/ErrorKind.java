package com.flagship.bridge_ledger.error;

/**
 * Classification of ledger failures.
 *
 * The retryable flag decides whether the pipeline reschedules the work or
 * surfaces it as terminal.
 */
public enum ErrorKind {
    VALIDATION(false),
    INSUFFICIENT_AMOUNT(false),
    IMBALANCED_ENTRY(false),
    LOCK_TIMEOUT(true),
    TRANSIENT_STORE(true),
    EXCHANGE_RATE_UNAVAILABLE(true),
    /** A related event this one depends on has not been booked yet. */
    PENDING_DEPENDENCY(true);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
