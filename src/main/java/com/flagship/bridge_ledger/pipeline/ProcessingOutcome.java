package com.flagship.bridge_ledger.pipeline;

/**
 * Terminal result of processing one tracked event.
 */
public enum ProcessingOutcome {
    /** Already processed; nothing was done. */
    DUPLICATE,
    LEDGER_CREATED,
    SKIPPED,
    /** Could not run now (e.g. lock timeout); redeliver later. */
    FAILED_RETRYABLE,
    /** Will not succeed; needs attention. */
    FAILED_TERMINAL;

    /**
     * True if the event needs no further processing.
     */
    public boolean isCompleted() {
        return this == LEDGER_CREATED || this == SKIPPED;
    }
}
