package com.flagship.bridge_ledger.pipeline;

import com.flagship.bridge_ledger.error.ErrorKind;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * What happened to one tracked event: the completion record.
 */
@Value
@Builder
public class ProcessingReport {
    String groupId;
    String kind;
    ProcessingOutcome outcome;
    ProcessingState reachedState;
    /** group_ids of the entries this event produced, including ones already stored. */
    @Singular
    List<String> entryGroupIds;
    int duplicateEntries;
    Duration duration;
    int attempts;
    boolean degradedQuote;
    ErrorKind errorKind;
    String errorMessage;
}
