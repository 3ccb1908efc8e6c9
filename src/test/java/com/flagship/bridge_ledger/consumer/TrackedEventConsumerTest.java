package com.flagship.bridge_ledger.consumer;

import com.flagship.bridge_ledger.error.ErrorKind;
import com.flagship.bridge_ledger.pipeline.ProcessingOutcome;
import com.flagship.bridge_ledger.pipeline.ProcessingReport;
import com.flagship.bridge_ledger.pipeline.TrackedEventProcessor;
import com.flagship.bridge_ledger.pipeline.event.ChainTransfer;
import com.flagship.bridge_ledger.pipeline.event.TrackedEvent;
import com.flagship.bridge_ledger.support.PipelineFixture;
import com.flagship.bridge_ledger.support.TestEvents;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.support.Acknowledgment;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TrackedEventConsumerTest {

    @Mock
    private TrackedEventProcessor processor;

    @Mock
    private Acknowledgment ack;

    private final PipelineFixture fixture = new PipelineFixture();
    private TrackedEventConsumer consumer;

    @BeforeEach
    void setUp() {
        consumer = new TrackedEventConsumer(processor, fixture.objectMapper, Duration.ofSeconds(5));
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private ConsumerRecord<String, String> recordOf(String value) {
        return new ConsumerRecord<>("tracked-events", 0, 42L, "dep-1", value);
    }

    private ProcessingReport report(ProcessingOutcome outcome) {
        return ProcessingReport.builder()
            .groupId("dep-1")
            .kind(ChainTransfer.KIND)
            .outcome(outcome)
            .duration(Duration.ZERO)
            .errorKind(outcome == ProcessingOutcome.FAILED_RETRYABLE ? ErrorKind.LOCK_TIMEOUT : null)
            .build();
    }

    @Test
    @DisplayName("A processed event is deserialized into its kind and acknowledged")
    void testAcknowledgesProcessed() throws Exception {
        printTestHeader("Acknowledge Processed");

        String json = fixture.objectMapper.writerFor(TrackedEvent.class)
            .writeValueAsString(TestEvents.deposit("dep-1", "alice", "10.000"));
        when(processor.process(any())).thenReturn(report(ProcessingOutcome.LEDGER_CREATED));

        consumer.consume(recordOf(json), ack);

        ArgumentCaptor<TrackedEvent> captor = ArgumentCaptor.forClass(TrackedEvent.class);
        verify(processor).process(captor.capture());
        assertInstanceOf(ChainTransfer.class, captor.getValue());
        assertEquals("dep-1", captor.getValue().getGroupId());
        verify(ack).acknowledge();
        printSuccess("Acknowledged after LEDGER_CREATED");
    }

    @Test
    @DisplayName("A lock timeout is negatively acknowledged for redelivery")
    void testNacksRetryable() throws Exception {
        printTestHeader("Nack Retryable");

        String json = fixture.objectMapper.writerFor(TrackedEvent.class)
            .writeValueAsString(TestEvents.deposit("dep-1", "alice", "10.000"));
        when(processor.process(any())).thenReturn(report(ProcessingOutcome.FAILED_RETRYABLE));

        consumer.consume(recordOf(json), ack);

        verify(ack).nack(Duration.ofSeconds(5));
        verify(ack, never()).acknowledge();
        printSuccess("Nacked with a 5s pause");
    }

    @Test
    @DisplayName("Terminal failures are acknowledged; redelivery would not help")
    void testAcknowledgesTerminal() throws Exception {
        printTestHeader("Acknowledge Terminal");

        String json = fixture.objectMapper.writerFor(TrackedEvent.class)
            .writeValueAsString(TestEvents.deposit("dep-1", "alice", "10.000"));
        when(processor.process(any())).thenReturn(report(ProcessingOutcome.FAILED_TERMINAL));

        consumer.consume(recordOf(json), ack);

        verify(ack).acknowledge();
        printSuccess("Acknowledged");
    }

    @Test
    @DisplayName("Unreadable messages are acknowledged and never reach the processor")
    void testUnreadableMessage() {
        printTestHeader("Unreadable Message");

        consumer.consume(recordOf("{\"kind\":\"mystery\"}"), ack);

        verify(processor, never()).process(any());
        verify(ack).acknowledge();
        printSuccess("Skipped");
    }
}
