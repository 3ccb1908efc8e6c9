package com.flagship.bridge_ledger.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.bridge_ledger.error.ErrorKind;
import com.flagship.bridge_ledger.error.ImbalancedEntryException;
import com.flagship.bridge_ledger.error.LedgerException;
import com.flagship.bridge_ledger.error.LockTimeoutException;
import com.flagship.bridge_ledger.error.TransientStoreException;
import com.flagship.bridge_ledger.ledger.LedgerEntry;
import com.flagship.bridge_ledger.ledger.LedgerStore;
import com.flagship.bridge_ledger.ledger.SaveResult;
import com.flagship.bridge_ledger.lock.HeldLocks;
import com.flagship.bridge_ledger.lock.LockCoordinator;
import com.flagship.bridge_ledger.observability.CorrelationContext;
import com.flagship.bridge_ledger.observability.LedgerMetrics;
import com.flagship.bridge_ledger.pipeline.event.TrackedEvent;
import com.flagship.bridge_ledger.pipeline.tracking.TrackedEventLog;
import com.flagship.bridge_ledger.pipeline.tracking.TrackedEventRecord;
import com.flagship.bridge_ledger.quote.QuoteLookup;
import com.flagship.bridge_ledger.quote.QuoteService;
import com.flagship.bridge_ledger.sanity.SanityChecker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Turns tracked events into ledger entries, at most once per event.
 *
 * For each event:
 * <ol>
 *   <li>Dedup: a completed tracking record, or a stored entry under the
 *       event's group_id, makes the event a DUPLICATE. Nothing else happens.</li>
 *   <li>Lock the operation, then the customer, and dedup again.</li>
 *   <li>Record the event as received, price it, run its handler and post
 *       the entries. Retryable failures go round again under {@link RetryPolicy}.
 *       The tracking record is stamped before the locks are released.</li>
 *   <li>Finalize: run the sanity pass, write the completion log line and
 *       record metrics.</li>
 * </ol>
 *
 * Entries from one event are saved one by one. If the process dies between
 * saves the tracking record stays unstamped and the event is processed again;
 * entries already stored come back as duplicates.
 */
@Service
@Slf4j
public class TrackedEventProcessor {

    private final TrackedEventLog eventLog;
    private final LedgerStore ledgerStore;
    private final LockCoordinator lockCoordinator;
    private final QuoteService quoteService;
    private final EventDispatcher dispatcher;
    private final RetryPolicy retryPolicy;
    private final SanityChecker sanityChecker;
    private final LedgerMetrics metrics;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Autowired
    public TrackedEventProcessor(TrackedEventLog eventLog,
                                 LedgerStore ledgerStore,
                                 LockCoordinator lockCoordinator,
                                 QuoteService quoteService,
                                 EventDispatcher dispatcher,
                                 RetryPolicy retryPolicy,
                                 SanityChecker sanityChecker,
                                 LedgerMetrics metrics,
                                 ObjectMapper objectMapper) {
        this(eventLog, ledgerStore, lockCoordinator, quoteService, dispatcher, retryPolicy,
            sanityChecker, metrics, objectMapper, Clock.systemUTC());
    }

    public TrackedEventProcessor(TrackedEventLog eventLog,
                                 LedgerStore ledgerStore,
                                 LockCoordinator lockCoordinator,
                                 QuoteService quoteService,
                                 EventDispatcher dispatcher,
                                 RetryPolicy retryPolicy,
                                 SanityChecker sanityChecker,
                                 LedgerMetrics metrics,
                                 ObjectMapper objectMapper,
                                 Clock clock) {
        this.eventLog = eventLog;
        this.ledgerStore = ledgerStore;
        this.lockCoordinator = lockCoordinator;
        this.quoteService = quoteService;
        this.dispatcher = dispatcher;
        this.retryPolicy = retryPolicy;
        this.sanityChecker = sanityChecker;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Processes one tracked event. Safe to call concurrently and with redelivered events.
     *
     * @return the completion record; never null
     * @throws TransientStoreException if the tracking record could not be stamped
     */
    public ProcessingReport process(TrackedEvent event) {
        long startedNanos = System.nanoTime();
        Invocation invocation = new Invocation(event, startedNanos);
        try (CorrelationContext.Scope ignored = CorrelationContext.forEvent(event)) {
            if (event.getGroupId() == null || event.getGroupId().isBlank()) {
                return rejectMissingGroupId(event, invocation);
            }
            try {
                if (isDuplicate(event)) {
                    invocation.duplicate();
                } else {
                    runLocked(event, invocation);
                }
            } catch (LockTimeoutException e) {
                metrics.incrementLockTimeouts();
                log.warn("Lock not obtained for {}: {}", event.getGroupId(), e.getMessage());
                invocation.fail(ProcessingOutcome.FAILED_RETRYABLE, e.getKind(), e.getMessage());
            } catch (RuntimeException e) {
                recordFailure(event, invocation, e);
            } finally {
                invocation.finish();
            }
            return invocation.isDuplicate() ? reportDuplicate(invocation) : finalizeInvocation(event, invocation);
        }
    }

    /**
     * True if the event needs no processing: its record is completed, or it
     * was never tracked but the ledger already holds its first entry.
     */
    boolean isDuplicate(TrackedEvent event) {
        Optional<TrackedEventRecord> record = eventLog.find(event.getGroupId());
        if (record.isPresent()) {
            return record.get().isCompleted();
        }
        return ledgerStore.load(event.getGroupId()).isPresent();
    }

    /**
     * The record is stamped before the locks are released, so a redelivery
     * waiting on the same locks sees the finished record.
     */
    private void runLocked(TrackedEvent event, Invocation invocation) {
        String details = event.kind() + " " + event.shortId();
        try (HeldLocks locks = lockCoordinator.lockEvent(event.getGroupId(), event.getCustId(), details)) {
            invocation.reached(ProcessingState.LOCKED);
            log.debug("Holding {}", locks.keys());
            if (isDuplicate(event)) {
                invocation.duplicate();
                return;
            }
            eventLog.recordReceived(event, payloadOf(event), clock.instant());
            invocation.recorded();
            invocation.reached(ProcessingState.PROCESSING);
            try {
                handleWithRetry(event, invocation);
            } catch (RuntimeException e) {
                recordFailure(event, invocation, e);
            }
            invocation.finish();
            stamp(event, invocation);
        }
    }

    private void recordFailure(TrackedEvent event, Invocation invocation, RuntimeException e) {
        if (e instanceof LedgerException) {
            LedgerException ledgerException = (LedgerException) e;
            ProcessingOutcome outcome = ledgerException.isRetryable()
                ? ProcessingOutcome.FAILED_RETRYABLE
                : ProcessingOutcome.FAILED_TERMINAL;
            log.error("Processing {} failed ({}): {} payload={}",
                event.getGroupId(), ledgerException.getKind(), e.getMessage(), payloadOf(event), e);
            invocation.fail(outcome, ledgerException.getKind(), e.getMessage());
        } else {
            log.error("Unexpected failure processing {} payload={}", event.getGroupId(), payloadOf(event), e);
            invocation.fail(ProcessingOutcome.FAILED_TERMINAL, null, e.toString());
        }
    }

    private void handleWithRetry(TrackedEvent event, Invocation invocation) {
        int attempt = 0;
        while (true) {
            attempt++;
            invocation.attempts(attempt);
            HandlerResult result;
            try {
                QuoteLookup lookup = quoteService.quoteFor(event.getTimestamp());
                if (lookup.isDegraded()) {
                    invocation.degraded();
                    log.warn("Using last known quote from {} for {}",
                        lookup.getQuote().getFetchedAt(), event.getGroupId());
                }
                result = dispatcher.dispatch(event, lookup.getQuote());
                if (result.getStatus() == HandlerResult.Status.POSTED) {
                    post(result.getEntries(), invocation);
                }
            } catch (ImbalancedEntryException e) {
                log.error("Imbalanced entry {} built for {}: {} payload={}",
                    e.getGroupId(), event.getGroupId(), e.getMessage(), payloadOf(event), e);
                invocation.fail(ProcessingOutcome.FAILED_TERMINAL, e.getKind(), e.getMessage());
                return;
            } catch (LedgerException e) {
                result = HandlerResult.fromException(e);
            }

            switch (result.getStatus()) {
                case POSTED -> {
                    invocation.outcome(ProcessingOutcome.LEDGER_CREATED);
                    return;
                }
                case SKIPPED -> {
                    log.info("Skipped {}: {}", event.getGroupId(), result.getReason());
                    invocation.outcome(ProcessingOutcome.SKIPPED);
                    return;
                }
                case FAILED -> {
                    log.error("Processing {} failed ({}): {} payload={}",
                        event.getGroupId(), result.getErrorKind(), result.getReason(), payloadOf(event));
                    invocation.fail(ProcessingOutcome.FAILED_TERMINAL, result.getErrorKind(), result.getReason());
                    return;
                }
                case RETRYABLE -> {
                    if (!retryPolicy.canRetry(attempt)) {
                        log.error("Giving up on {} after {} attempts ({}): {} payload={}",
                            event.getGroupId(), attempt, result.getErrorKind(), result.getReason(), payloadOf(event));
                        invocation.fail(ProcessingOutcome.FAILED_TERMINAL, result.getErrorKind(), result.getReason());
                        return;
                    }
                    Duration delay = retryPolicy.delayAfter(attempt);
                    log.warn("Attempt {} for {} failed ({}): {}; retrying in {} ms",
                        attempt, event.getGroupId(), result.getErrorKind(), result.getReason(), delay.toMillis());
                    if (!pause(delay)) {
                        invocation.fail(ProcessingOutcome.FAILED_RETRYABLE, result.getErrorKind(),
                            "Interrupted while waiting to retry: " + result.getReason());
                        return;
                    }
                }
            }
        }
    }

    private void post(List<LedgerEntry> entries, Invocation invocation) {
        invocation.resetDuplicates();
        for (LedgerEntry entry : entries) {
            SaveResult saved = ledgerStore.save(entry);
            invocation.entry(entry.getGroupId());
            if (saved == SaveResult.DUPLICATE) {
                invocation.duplicateEntry();
                metrics.incrementDuplicateEntries();
                log.info("Entry {} already in the ledger", entry.getGroupId());
            } else {
                metrics.recordEntryPosted(entry.getLedgerType());
                log.info("Posted {}", entry);
            }
        }
    }

    private boolean pause(Duration delay) {
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted during retry backoff");
            return false;
        }
    }

    /**
     * Without a group_id there is nothing to dedup, lock or track on, so the
     * event fails before touching the event log or the ledger.
     */
    private ProcessingReport rejectMissingGroupId(TrackedEvent event, Invocation invocation) {
        invocation.fail(ProcessingOutcome.FAILED_TERMINAL, ErrorKind.VALIDATION,
            "Tracked event " + event.kind() + " has no group_id");
        invocation.finish();
        ProcessingReport report = invocation.toReport();
        log.error("Rejected tracked event without group_id kind={} payload={}", event.kind(), payloadOf(event));
        metrics.recordEventProcessed(report.getKind(), report.getOutcome());
        return report;
    }

    private ProcessingReport reportDuplicate(Invocation invocation) {
        ProcessingReport report = invocation.toReport();
        log.debug("Tracked event {} already processed", report.getGroupId());
        metrics.recordEventProcessed(report.getKind(), report.getOutcome());
        return report;
    }

    private ProcessingReport finalizeInvocation(TrackedEvent event, Invocation invocation) {
        if (!invocation.isStampAttempted()) {
            stamp(event, invocation);
        }
        ProcessingReport report = invocation.toReport();
        try {
            sanityChecker.run();
        } catch (RuntimeException e) {
            log.error("Sanity pass could not run after {}", event.getGroupId(), e);
        }

        log.info("Tracked event complete event_id={} kind={} outcome={} duration_ms={} attempts={} entries={} duplicate_entries={} degraded_quote={}",
            report.getGroupId(), report.getKind(), report.getOutcome(), report.getDuration().toMillis(),
            report.getAttempts(), report.getEntryGroupIds(), report.getDuplicateEntries(), report.isDegradedQuote());
        metrics.recordEventProcessed(report.getKind(), report.getOutcome());
        metrics.recordProcessingDuration(report.getKind(), report.getDuration());

        if (invocation.getStampFailure() != null) {
            throw new TransientStoreException("Tracked event " + event.getGroupId() + " was not stamped",
                invocation.getStampFailure());
        }
        return report;
    }

    /**
     * An invocation that failed before writing its own record only stamps when
     * no other invocation has one; otherwise that invocation owns the record.
     * A failure is kept on the invocation and raised once the run is finalized.
     */
    private void stamp(TrackedEvent event, Invocation invocation) {
        invocation.stampAttempted();
        try {
            if (!invocation.isRecorded()) {
                if (eventLog.find(event.getGroupId()).isPresent()) {
                    log.debug("Tracked event {} owned by another invocation, not stamping", event.getGroupId());
                    return;
                }
                eventLog.recordReceived(event, payloadOf(event), clock.instant());
            }
            eventLog.stamp(invocation.toReport(), clock.instant());
        } catch (RuntimeException e) {
            log.error("Could not stamp tracked event {}", event.getGroupId(), e);
            invocation.stampFailed(e);
        }
    }

    private String payloadOf(TrackedEvent event) {
        try {
            return objectMapper.writerFor(TrackedEvent.class).writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize tracked event " + event.getGroupId(), e);
        }
    }

    /**
     * Mutable state of one {@link #process} call.
     */
    private static final class Invocation {
        private final TrackedEvent event;
        private final long startedNanos;
        private final Set<String> entryGroupIds = new LinkedHashSet<>();
        private ProcessingState state = ProcessingState.RECEIVED;
        private ProcessingOutcome outcome;
        private ErrorKind errorKind;
        private String errorMessage;
        private int attempts;
        private int duplicateEntries;
        private boolean degraded;
        private boolean recorded;
        private boolean stampAttempted;
        private RuntimeException stampFailure;
        private Duration duration;

        Invocation(TrackedEvent event, long startedNanos) {
            this.event = event;
            this.startedNanos = startedNanos;
        }

        void reached(ProcessingState reached) {
            this.state = reached;
        }

        void duplicate() {
            this.outcome = ProcessingOutcome.DUPLICATE;
        }

        boolean isDuplicate() {
            return outcome == ProcessingOutcome.DUPLICATE;
        }

        void recorded() {
            this.recorded = true;
        }

        boolean isRecorded() {
            return recorded;
        }

        void attempts(int attempts) {
            this.attempts = attempts;
        }

        void degraded() {
            this.degraded = true;
        }

        void entry(String groupId) {
            entryGroupIds.add(groupId);
        }

        void resetDuplicates() {
            this.duplicateEntries = 0;
        }

        void duplicateEntry() {
            duplicateEntries++;
        }

        void outcome(ProcessingOutcome outcome) {
            this.outcome = outcome;
            this.errorKind = null;
            this.errorMessage = null;
        }

        void fail(ProcessingOutcome outcome, ErrorKind kind, String message) {
            this.outcome = outcome;
            this.errorKind = kind;
            this.errorMessage = message;
        }

        void stampAttempted() {
            this.stampAttempted = true;
        }

        boolean isStampAttempted() {
            return stampAttempted;
        }

        void stampFailed(RuntimeException failure) {
            this.stampFailure = failure;
        }

        RuntimeException getStampFailure() {
            return stampFailure;
        }

        /**
         * Fixes the duration the first time it is called.
         */
        void finish() {
            if (duration == null) {
                duration = Duration.ofNanos(System.nanoTime() - startedNanos);
            }
            if (outcome == null) {
                fail(ProcessingOutcome.FAILED_TERMINAL, null, "Processing ended without an outcome");
            }
        }

        ProcessingReport toReport() {
            return ProcessingReport.builder()
                .groupId(event.getGroupId())
                .kind(event.kind())
                .outcome(outcome)
                .reachedState(state)
                .entryGroupIds(new ArrayList<>(entryGroupIds))
                .duplicateEntries(duplicateEntries)
                .duration(duration != null ? duration : Duration.ofNanos(System.nanoTime() - startedNanos))
                .attempts(attempts)
                .degradedQuote(degraded)
                .errorKind(errorKind)
                .errorMessage(errorMessage)
                .build();
        }
    }
}
