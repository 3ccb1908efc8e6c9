package com.flagship.bridge_ledger.observability;

import com.flagship.bridge_ledger.ledger.LedgerType;
import com.flagship.bridge_ledger.pipeline.ProcessingOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for the ledger pipeline.
 *
 * Metrics exposed:
 * - ledger.events.processed: tracked events by kind and outcome
 * - ledger.entries.posted: entries written, by ledger type
 * - ledger.entries.duplicate: saves that found the group_id already stored
 * - ledger.lock.timeouts: invocations that gave up waiting for a lock
 * - ledger.event.processing.duration: time per invocation, by kind
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    private final Counter duplicateEntries;
    private final Counter lockTimeouts;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.duplicateEntries = Counter.builder("ledger.entries.duplicate")
                .description("Ledger saves skipped because the group_id already exists")
                .register(registry);

        this.lockTimeouts = Counter.builder("ledger.lock.timeouts")
                .description("Pipeline invocations that timed out waiting for a lock")
                .register(registry);
    }

    public void recordEventProcessed(String kind, ProcessingOutcome outcome) {
        registry.counter("ledger.events.processed",
                "kind", sanitizeTag(kind),
                "outcome", outcome.name()
        ).increment();
    }

    public void recordEntryPosted(LedgerType type) {
        registry.counter("ledger.entries.posted", "type", type.getCode()).increment();
    }

    public void incrementDuplicateEntries() {
        duplicateEntries.increment();
    }

    public void incrementLockTimeouts() {
        lockTimeouts.increment();
    }

    public void recordProcessingDuration(String kind, Duration duration) {
        Timer.builder("ledger.event.processing.duration")
                .description("Time taken to process one tracked event")
                .tag("kind", sanitizeTag(kind))
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(duration);
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
