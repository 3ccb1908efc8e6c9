package com.flagship.bridge_ledger.pipeline;

import com.flagship.bridge_ledger.pipeline.event.ChainTransfer;
import com.flagship.bridge_ledger.pipeline.event.TrackedEvent;
import com.flagship.bridge_ledger.pipeline.tracking.TrackedEventRecord;
import com.flagship.bridge_ledger.support.InMemoryTrackedEventLog;
import com.flagship.bridge_ledger.support.PipelineFixture;
import com.flagship.bridge_ledger.support.TestEvents;
import com.flagship.bridge_ledger.support.TestQuotes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IncompleteEventRecoveryTest {

    private PipelineFixture fixture;
    private InMemoryTrackedEventLog eventLog;
    private IncompleteEventRecovery recovery;

    @BeforeEach
    void setUp() {
        fixture = new PipelineFixture();
        eventLog = (InMemoryTrackedEventLog) fixture.eventLog;
        recovery = new IncompleteEventRecovery(eventLog, fixture.processor, fixture.objectMapper,
            Duration.ofMinutes(5), fixture.clock);
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private void leaveUnfinished(String groupId, String payload, Instant receivedAt) {
        eventLog.put(TrackedEventRecord.builder()
            .groupId(groupId)
            .kind(ChainTransfer.KIND)
            .custId("alice")
            .eventTimestamp(TestQuotes.FETCHED_AT)
            .payload(payload)
            .receivedAt(receivedAt)
            .ledgerGroupIds(List.of())
            .build());
    }

    private String payloadOf(TrackedEvent event) throws Exception {
        return fixture.objectMapper.writerFor(TrackedEvent.class).writeValueAsString(event);
    }

    @Test
    @DisplayName("Unfinished events older than the grace period are processed again")
    void testRecoversOldRecords() throws Exception {
        printTestHeader("Recover Old Records");

        ChainTransfer deposit = TestEvents.deposit("dep-1", "alice", "10.000");
        leaveUnfinished("dep-1", payloadOf(deposit), TestQuotes.FETCHED_AT.minus(Duration.ofMinutes(10)));

        int replayed = recovery.recover();

        assertEquals(1, replayed);
        assertTrue(eventLog.find("dep-1").orElseThrow().isCompleted());
        assertEquals(1, fixture.ledgerStore.size());
        assertEquals(0, recovery.recover(), "Nothing left to recover");
        printSuccess("Event booked by recovery");
    }

    @Test
    @DisplayName("Recent unfinished events are left to the invocation that may still own them")
    void testLeavesRecentRecords() throws Exception {
        printTestHeader("Leave Recent Records");

        leaveUnfinished("dep-1", payloadOf(TestEvents.deposit("dep-1", "alice", "10.000")),
            TestQuotes.FETCHED_AT.minus(Duration.ofMinutes(1)));

        assertEquals(0, recovery.recover());
        assertEquals(0, fixture.ledgerStore.size());
        printSuccess("Recent record untouched");
    }

    @Test
    @DisplayName("An unreadable payload is logged and skipped without blocking the others")
    void testUnreadablePayload() throws Exception {
        printTestHeader("Unreadable Payload");

        Instant old = TestQuotes.FETCHED_AT.minus(Duration.ofHours(1));
        leaveUnfinished("bad-1", "{not json", old);
        leaveUnfinished("dep-2", payloadOf(TestEvents.deposit("dep-2", "alice", "1.000")), old.plusSeconds(1));

        assertEquals(1, recovery.recover());
        assertFalse(eventLog.find("bad-1").orElseThrow().isStamped());
        assertTrue(eventLog.find("dep-2").orElseThrow().isCompleted());
        printSuccess("Bad record skipped, good record recovered");
    }
}
