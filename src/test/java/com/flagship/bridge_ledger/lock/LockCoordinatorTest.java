package com.flagship.bridge_ledger.lock;

import com.flagship.bridge_ledger.error.LockTimeoutException;
import com.flagship.bridge_ledger.support.InMemoryLockBackend;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Lock ordering, exclusion and release, against the in-memory backend.
 */
class LockCoordinatorTest {

    private InMemoryLockBackend backend;
    private LockCoordinator coordinator;

    @BeforeEach
    void setUp() {
        backend = new InMemoryLockBackend();
        coordinator = new LockCoordinator(backend, new LockWaitRegistry(),
            Duration.ofSeconds(30), Duration.ofMillis(300), Duration.ofMillis(100));
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @Test
    @DisplayName("Locking an event takes the operation lock, then the customer lock")
    void testLockEventTakesBothLocks() {
        printTestHeader("Lock Event");

        try (HeldLocks locks = coordinator.lockEvent("g1", "alice", "test")) {
            assertEquals(List.of("op_lock:g1", "cust_id_lock:alice"), locks.keys());
            assertTrue(coordinator.isLocked("op_lock:g1"));
            assertTrue(coordinator.isLocked("cust_id_lock:alice"));
        }

        assertFalse(coordinator.isLocked("op_lock:g1"));
        assertFalse(coordinator.isLocked("cust_id_lock:alice"));
        printSuccess("Both locks held and released");
    }

    @Test
    @DisplayName("A blank customer id takes only the operation lock")
    void testBlankCustomer() {
        printTestHeader("Blank Customer");

        try (HeldLocks locks = coordinator.lockEvent("g1", " ", "test")) {
            assertEquals(List.of("op_lock:g1"), locks.keys());
        }
        try (HeldLocks locks = coordinator.lockEvent("g2", null, "test")) {
            assertEquals(1, locks.keys().size());
        }
        printSuccess("Operation lock only");
    }

    @Test
    @DisplayName("Waiting past the blocking timeout fails with LockTimeoutException and frees the operation lock")
    void testTimeout() {
        printTestHeader("Lock Timeout");

        try (HeldLocks held = coordinator.lockEvent("g1", "alice", "holder")) {
            long start = System.nanoTime();
            LockTimeoutException e = assertThrows(LockTimeoutException.class,
                () -> coordinator.lockEvent("g2", "alice", "waiter"));
            long waitedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertEquals("cust_id_lock:alice", e.getLockKey());
            assertTrue(e.isRetryable());
            assertTrue(waitedMs >= 250, "Waited " + waitedMs + " ms");
            assertFalse(coordinator.isLocked("op_lock:g2"), "Operation lock released after customer lock timed out");
            assertTrue(coordinator.isLocked("cust_id_lock:alice"), "Holder keeps its lock");
        }
        printSuccess("Timeout raised and partial locks released");
    }

    @Test
    @DisplayName("Locks are released when the guarded work throws")
    void testReleaseOnException() {
        printTestHeader("Release On Exception");

        assertThrows(IllegalStateException.class, () -> {
            try (HeldLocks locks = coordinator.lockEvent("g1", "alice", "test")) {
                throw new IllegalStateException("boom");
            }
        });

        assertFalse(coordinator.isLocked("op_lock:g1"));
        assertFalse(coordinator.isLocked("cust_id_lock:alice"));
        printSuccess("Locks freed after exception");
    }

    @Test
    @DisplayName("Closing a handle twice releases once")
    void testDoubleClose() {
        printTestHeader("Double Close");

        LockHandle handle = coordinator.acquire("op_lock:x", "test");
        handle.close();
        assertTrue(handle.isReleased());
        LockHandle next = coordinator.acquire("op_lock:x", "next");
        handle.close();

        assertTrue(coordinator.isLocked("op_lock:x"), "Second close must not release the new holder's lock");
        next.close();
        printSuccess("Idempotent close");
    }

    @Test
    @DisplayName("Events of the same customer never run concurrently")
    void testMutualExclusionPerCustomer() throws Exception {
        printTestHeader("Mutual Exclusion");

        LockCoordinator patient = new LockCoordinator(backend, new LockWaitRegistry(),
            Duration.ofSeconds(30), Duration.ofSeconds(10), Duration.ofSeconds(1));
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(4);
        List<Future<?>> futures = new ArrayList<>();

        for (int i = 0; i < 4; i++) {
            String groupId = "g" + i;
            futures.add(executor.submit(() -> {
                start.await();
                try (HeldLocks locks = patient.lockEvent(groupId, "alice", groupId)) {
                    int now = inside.incrementAndGet();
                    maxInside.accumulateAndGet(now, Math::max);
                    Thread.sleep(30);
                    inside.decrementAndGet();
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(20, TimeUnit.SECONDS);
        }
        executor.shutdown();

        assertEquals(1, maxInside.get());
        printSuccess("At most one event per customer at a time");
    }

    @Test
    @DisplayName("The reporter lists and clears ledger locks")
    void testReporter() {
        printTestHeader("Lock Reporter");

        LockReporter reporter = new LockReporter(backend, new LockWaitRegistry());
        HeldLocks locks = coordinator.lockEvent("g1", "alice", "test");

        assertEquals(2, reporter.activeLocks().size());
        reporter.report();
        assertEquals(2, reporter.clearAll());
        assertTrue(reporter.activeLocks().isEmpty());
        locks.close();
        printSuccess("Locks listed and cleared");
    }
}
