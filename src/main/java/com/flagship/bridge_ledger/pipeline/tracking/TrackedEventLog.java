package com.flagship.bridge_ledger.pipeline.tracking;

import com.flagship.bridge_ledger.pipeline.ProcessingReport;
import com.flagship.bridge_ledger.pipeline.event.TrackedEvent;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable record of which tracked events were received and how each ended.
 */
public interface TrackedEventLog {

    Optional<TrackedEventRecord> find(String groupId);

    /**
     * Records that {@code event} arrived. An existing record keeps its history
     * but loses its completion stamp until the new invocation finishes.
     */
    void recordReceived(TrackedEvent event, String payload, Instant receivedAt);

    /**
     * Writes the completion stamp from {@code report}.
     */
    void stamp(ProcessingReport report, Instant completedAt);

    /**
     * Records received before {@code receivedBefore} that were never stamped, oldest first.
     */
    List<TrackedEventRecord> findIncomplete(Instant receivedBefore);
}
