package com.flagship.bridge_ledger.pipeline.tracking;

import com.flagship.bridge_ledger.error.ErrorKind;
import com.flagship.bridge_ledger.pipeline.ProcessingOutcome;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * JPA entity for the tracked_events table.
 */
@Entity
@Table(name = "tracked_events")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class TrackedEventEntity {

    private static final String ID_SEPARATOR = ",";

    @Id
    @Column(name = "group_id", nullable = false, updatable = false, length = 200)
    private String groupId;

    @Column(name = "kind", nullable = false, length = 50)
    private String kind;

    @Column(name = "cust_id", length = 100)
    private String custId;

    @Column(name = "event_timestamp")
    private Instant eventTimestamp;

    @Column(name = "payload", columnDefinition = "TEXT")
    private String payload;

    @Column(name = "received_at", nullable = false)
    private Instant receivedAt;

    @Column(name = "process_time_ms")
    private Long processTimeMs;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", length = 30)
    private ProcessingOutcome outcome;

    @Column(name = "attempts", nullable = false)
    private int attempts;

    @Column(name = "degraded_quote", nullable = false)
    private boolean degradedQuote;

    @Column(name = "ledger_group_ids", columnDefinition = "TEXT")
    private String ledgerGroupIds;

    @Enumerated(EnumType.STRING)
    @Column(name = "error_kind", length = 50)
    private ErrorKind errorKind;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    public static TrackedEventEntity fromDomain(TrackedEventRecord record) {
        return new TrackedEventEntity(
            record.getGroupId(),
            record.getKind(),
            record.getCustId(),
            record.getEventTimestamp(),
            record.getPayload(),
            record.getReceivedAt(),
            record.getProcessTimeMs(),
            record.getCompletedAt(),
            record.getOutcome(),
            record.getAttempts(),
            record.isDegradedQuote(),
            joinIds(record.getLedgerGroupIds()),
            record.getErrorKind(),
            record.getErrorMessage()
        );
    }

    public TrackedEventRecord toDomain() {
        return TrackedEventRecord.builder()
            .groupId(groupId)
            .kind(kind)
            .custId(custId)
            .eventTimestamp(eventTimestamp)
            .payload(payload)
            .receivedAt(receivedAt)
            .processTimeMs(processTimeMs)
            .completedAt(completedAt)
            .outcome(outcome)
            .attempts(attempts)
            .degradedQuote(degradedQuote)
            .ledgerGroupIds(splitIds(ledgerGroupIds))
            .errorKind(errorKind)
            .errorMessage(errorMessage)
            .build();
    }

    static String joinIds(List<String> ids) {
        return ids == null || ids.isEmpty() ? null : String.join(ID_SEPARATOR, ids);
    }

    static List<String> splitIds(String joined) {
        return joined == null || joined.isBlank() ? List.of() : Arrays.asList(joined.split(ID_SEPARATOR));
    }
}
