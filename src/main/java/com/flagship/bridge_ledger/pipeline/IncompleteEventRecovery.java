package com.flagship.bridge_ledger.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.bridge_ledger.pipeline.event.TrackedEvent;
import com.flagship.bridge_ledger.pipeline.tracking.TrackedEventLog;
import com.flagship.bridge_ledger.pipeline.tracking.TrackedEventRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Replays tracked events whose processing never finished.
 *
 * A record stays unstamped when the process died mid-invocation. Once it is
 * older than the grace period (longer than any lock can be held) the stored
 * payload is sent through the processor again.
 */
@Component
@ConditionalOnProperty(name = "pipeline.recovery.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class IncompleteEventRecovery {

    private final TrackedEventLog eventLog;
    private final TrackedEventProcessor processor;
    private final ObjectMapper objectMapper;
    private final Duration gracePeriod;
    private final Clock clock;

    @Autowired
    public IncompleteEventRecovery(TrackedEventLog eventLog,
                                   TrackedEventProcessor processor,
                                   ObjectMapper objectMapper,
                                   @Value("${pipeline.recovery.grace-period:PT5M}") Duration gracePeriod) {
        this(eventLog, processor, objectMapper, gracePeriod, Clock.systemUTC());
    }

    IncompleteEventRecovery(TrackedEventLog eventLog,
                            TrackedEventProcessor processor,
                            ObjectMapper objectMapper,
                            Duration gracePeriod,
                            Clock clock) {
        this.eventLog = eventLog;
        this.processor = processor;
        this.objectMapper = objectMapper;
        this.gracePeriod = gracePeriod;
        this.clock = clock;
    }

    /**
     * @return number of events sent back through the processor
     */
    @Scheduled(fixedDelayString = "${pipeline.recovery.interval-ms:60000}",
               initialDelayString = "${pipeline.recovery.initial-delay-ms:30000}")
    public int recover() {
        List<TrackedEventRecord> incomplete = eventLog.findIncomplete(clock.instant().minus(gracePeriod));
        if (incomplete.isEmpty()) {
            return 0;
        }
        log.warn("Found {} tracked events that never finished processing", incomplete.size());

        int replayed = 0;
        for (TrackedEventRecord record : incomplete) {
            TrackedEvent event;
            try {
                event = objectMapper.readValue(record.getPayload(), TrackedEvent.class);
            } catch (JsonProcessingException e) {
                log.error("Stored payload of {} cannot be read, leaving it for manual repair: {}",
                    record.getGroupId(), e.getMessage(), e);
                continue;
            }
            ProcessingReport report = processor.process(event);
            log.info("Recovered {} (received {}): {}", record.getGroupId(), record.getReceivedAt(), report.getOutcome());
            replayed++;
        }
        return replayed;
    }
}
