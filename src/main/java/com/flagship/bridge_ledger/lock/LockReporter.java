package com.flagship.bridge_ledger.lock;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Periodic report of lock contention: requests waiting in this process and
 * locks currently held anywhere in the cluster.
 */
@Component
@ConditionalOnProperty(name = "locks.reporter.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class LockReporter {

    private final LockBackend backend;
    private final LockWaitRegistry registry;

    @Scheduled(fixedDelayString = "${locks.reporter.interval-ms:120000}",
               initialDelayString = "${locks.reporter.interval-ms:120000}")
    public void report() {
        List<LockWaitRegistry.LockRequest> waiting = registry.outstanding();
        Map<String, Duration> held = activeLocks();
        if (waiting.isEmpty() && held.isEmpty()) {
            log.debug("No outstanding lock requests or active locks");
            return;
        }
        Instant now = registry.now();
        for (LockWaitRegistry.LockRequest request : waiting) {
            log.info("Outstanding lock request {} on {} waiting {}s",
                request, request.getKey(), request.waitingFor(now).toSeconds());
        }
        held.forEach((key, ttl) -> log.info("Active lock {} held by {}, expires in {}s",
            key, backend.holder(key).map(LockCoordinator::describeOwner).orElse("?"), ttl.toSeconds()));
    }

    public Map<String, Duration> activeLocks() {
        Map<String, Duration> held = new LinkedHashMap<>();
        held.putAll(backend.activeLocks(LockCoordinator.OPERATION_PREFIX + "*"));
        held.putAll(backend.activeLocks(LockCoordinator.CUSTOMER_PREFIX + "*"));
        return held;
    }

    /**
     * Drops every ledger lock. For operator use after a crash left locks behind.
     */
    public long clearAll() {
        long cleared = backend.clear(LockCoordinator.OPERATION_PREFIX + "*")
            + backend.clear(LockCoordinator.CUSTOMER_PREFIX + "*");
        log.warn("Cleared {} ledger locks", cleared);
        return cleared;
    }
}
