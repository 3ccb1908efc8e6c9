package com.flagship.bridge_ledger.pipeline.tracking;

import com.flagship.bridge_ledger.pipeline.ProcessingReport;
import com.flagship.bridge_ledger.pipeline.event.TrackedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * {@link TrackedEventLog} on the tracked_events table.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaTrackedEventLog implements TrackedEventLog {

    private final TrackedEventRepository repository;

    @Override
    @Transactional(readOnly = true)
    public Optional<TrackedEventRecord> find(String groupId) {
        return repository.findById(groupId).map(TrackedEventEntity::toDomain);
    }

    @Override
    @Transactional
    public void recordReceived(TrackedEvent event, String payload, Instant receivedAt) {
        Optional<TrackedEventEntity> existing = repository.findById(event.getGroupId());
        if (existing.isPresent()) {
            TrackedEventEntity entity = existing.get();
            log.info("Tracked event {} seen before (outcome={}, completedAt={}), processing again",
                event.getGroupId(), entity.getOutcome(), entity.getCompletedAt());
            entity.setPayload(payload);
            entity.setCompletedAt(null);
            entity.setProcessTimeMs(null);
            repository.save(entity);
            return;
        }
        repository.save(TrackedEventEntity.fromDomain(TrackedEventRecord.builder()
            .groupId(event.getGroupId())
            .kind(event.kind())
            .custId(event.getCustId())
            .eventTimestamp(event.getTimestamp())
            .payload(payload)
            .receivedAt(receivedAt)
            .ledgerGroupIds(List.of())
            .build()));
    }

    @Override
    @Transactional
    public void stamp(ProcessingReport report, Instant completedAt) {
        TrackedEventEntity entity = repository.findById(report.getGroupId())
            .orElseThrow(() -> new IllegalStateException("No tracked event record for " + report.getGroupId()));
        entity.setProcessTimeMs(report.getDuration().toMillis());
        entity.setCompletedAt(completedAt);
        entity.setOutcome(report.getOutcome());
        entity.setAttempts(report.getAttempts());
        entity.setDegradedQuote(report.isDegradedQuote());
        entity.setLedgerGroupIds(TrackedEventEntity.joinIds(report.getEntryGroupIds()));
        entity.setErrorKind(report.getErrorKind());
        entity.setErrorMessage(report.getErrorMessage());
        repository.save(entity);
    }

    @Override
    @Transactional(readOnly = true)
    public List<TrackedEventRecord> findIncomplete(Instant receivedBefore) {
        return repository.findUnstampedReceivedBefore(receivedBefore).stream()
            .map(TrackedEventEntity::toDomain)
            .toList();
    }
}
