package com.flagship.bridge_ledger.pipeline;

import com.flagship.bridge_ledger.error.ErrorKind;
import com.flagship.bridge_ledger.error.LedgerException;
import com.flagship.bridge_ledger.ledger.LedgerEntry;
import lombok.Value;

import java.util.List;

/**
 * What a handler decided for one event.
 *
 * Handlers report failures as values; the processor's retry loop decides
 * what happens next from the status alone.
 */
@Value
public class HandlerResult {

    public enum Status {
        /** Entries were built and should be posted. */
        POSTED,
        /** Nothing to book for this event. */
        SKIPPED,
        /** Worth trying again after a delay. */
        RETRYABLE,
        /** Will never succeed as delivered. */
        FAILED
    }

    Status status;
    List<LedgerEntry> entries;
    ErrorKind errorKind;
    String reason;

    public static HandlerResult posted(List<LedgerEntry> entries) {
        return new HandlerResult(Status.POSTED, List.copyOf(entries), null, null);
    }

    public static HandlerResult skipped(String reason) {
        return new HandlerResult(Status.SKIPPED, List.of(), null, reason);
    }

    public static HandlerResult retryable(ErrorKind kind, String reason) {
        return new HandlerResult(Status.RETRYABLE, List.of(), kind, reason);
    }

    public static HandlerResult failed(ErrorKind kind, String reason) {
        return new HandlerResult(Status.FAILED, List.of(), kind, reason);
    }

    public static HandlerResult fromException(LedgerException e) {
        return e.isRetryable()
            ? retryable(e.getKind(), e.getMessage())
            : failed(e.getKind(), e.getMessage());
    }
}
