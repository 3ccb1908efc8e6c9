package com.flagship.bridge_ledger.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.bridge_ledger.pipeline.ProcessingOutcome;
import com.flagship.bridge_ledger.pipeline.ProcessingReport;
import com.flagship.bridge_ledger.pipeline.TrackedEventProcessor;
import com.flagship.bridge_ledger.pipeline.event.TrackedEvent;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Kafka consumer for tracked events.
 *
 * Manual acknowledgment: a record is acknowledged once the processor has
 * reached a final outcome for it. FAILED_RETRYABLE (lock timeouts) is
 * negatively acknowledged so the record comes back after a pause; the
 * processor's dedup makes the redelivery safe.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class TrackedEventConsumer {

    private final TrackedEventProcessor processor;
    private final ObjectMapper objectMapper;
    private final Duration redeliveryDelay;

    public TrackedEventConsumer(TrackedEventProcessor processor,
                                ObjectMapper objectMapper,
                                @Value("${consumer.redelivery-delay:PT5S}") Duration redeliveryDelay) {
        this.processor = processor;
        this.objectMapper = objectMapper;
        this.redeliveryDelay = redeliveryDelay;
    }

    @KafkaListener(
        topics = "${kafka.topic.tracked-events:tracked-events}",
        groupId = "${spring.kafka.consumer.group-id:bridge-ledger-consumers}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received message: topic={}, partition={}, offset={}, key={}",
                record.topic(), record.partition(), record.offset(), record.key());

        TrackedEvent event;
        try {
            event = objectMapper.readValue(record.value(), TrackedEvent.class);
        } catch (JsonProcessingException e) {
            log.error("Unreadable tracked event at offset {}, acknowledging to skip: {} payload={}",
                    record.offset(), e.getMessage(), record.value());
            ack.acknowledge();
            return;
        }

        ProcessingReport report = processor.process(event);
        if (report.getOutcome() == ProcessingOutcome.FAILED_RETRYABLE) {
            log.warn("Tracked event {} will be redelivered in {} ms: {}",
                    event.getGroupId(), redeliveryDelay.toMillis(), report.getErrorMessage());
            ack.nack(redeliveryDelay);
            return;
        }
        ack.acknowledge();
    }
}
