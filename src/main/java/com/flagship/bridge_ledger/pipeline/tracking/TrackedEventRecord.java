package com.flagship.bridge_ledger.pipeline.tracking;

import com.flagship.bridge_ledger.error.ErrorKind;
import com.flagship.bridge_ledger.pipeline.ProcessingOutcome;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Processing record kept for each tracked event.
 *
 * A record with a {@code receivedAt} but no {@code completedAt} belongs to an
 * invocation that never finished, usually because the process died.
 */
@Value
@Builder(toBuilder = true)
public class TrackedEventRecord {
    String groupId;
    String kind;
    String custId;
    Instant eventTimestamp;
    /** The event as received, JSON. */
    String payload;
    Instant receivedAt;
    Long processTimeMs;
    Instant completedAt;
    ProcessingOutcome outcome;
    int attempts;
    boolean degradedQuote;
    List<String> ledgerGroupIds;
    ErrorKind errorKind;
    String errorMessage;

    public boolean isStamped() {
        return completedAt != null;
    }

    /**
     * True if the event was fully handled and must not be processed again.
     */
    public boolean isCompleted() {
        return isStamped() && outcome != null && outcome.isCompleted();
    }
}
