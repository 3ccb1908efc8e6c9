package com.flagship.bridge_ledger.support;

import com.flagship.bridge_ledger.pipeline.ProcessingReport;
import com.flagship.bridge_ledger.pipeline.event.TrackedEvent;
import com.flagship.bridge_ledger.pipeline.tracking.TrackedEventLog;
import com.flagship.bridge_ledger.pipeline.tracking.TrackedEventRecord;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryTrackedEventLog implements TrackedEventLog {

    private final Map<String, TrackedEventRecord> records = new ConcurrentHashMap<>();

    @Override
    public Optional<TrackedEventRecord> find(String groupId) {
        return Optional.ofNullable(records.get(groupId));
    }

    @Override
    public void recordReceived(TrackedEvent event, String payload, Instant receivedAt) {
        records.compute(event.getGroupId(), (id, existing) -> existing != null
            ? existing.toBuilder().payload(payload).completedAt(null).processTimeMs(null).build()
            : TrackedEventRecord.builder()
                .groupId(id)
                .kind(event.kind())
                .custId(event.getCustId())
                .eventTimestamp(event.getTimestamp())
                .payload(payload)
                .receivedAt(receivedAt)
                .ledgerGroupIds(List.of())
                .build());
    }

    @Override
    public void stamp(ProcessingReport report, Instant completedAt) {
        records.computeIfPresent(report.getGroupId(), (id, existing) -> existing.toBuilder()
            .processTimeMs(report.getDuration().toMillis())
            .completedAt(completedAt)
            .outcome(report.getOutcome())
            .attempts(report.getAttempts())
            .degradedQuote(report.isDegradedQuote())
            .ledgerGroupIds(report.getEntryGroupIds())
            .errorKind(report.getErrorKind())
            .errorMessage(report.getErrorMessage())
            .build());
    }

    @Override
    public List<TrackedEventRecord> findIncomplete(Instant receivedBefore) {
        return records.values().stream()
            .filter(r -> !r.isStamped() && r.getReceivedAt().isBefore(receivedBefore))
            .sorted(Comparator.comparing(TrackedEventRecord::getReceivedAt))
            .toList();
    }

    /**
     * Stores a record as a crashed invocation would have left it.
     */
    public void put(TrackedEventRecord record) {
        records.put(record.getGroupId(), record);
    }
}
