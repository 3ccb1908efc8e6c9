package com.flagship.bridge_ledger.lock;

import com.flagship.bridge_ledger.error.LockTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Two-level distributed locking for ledger operations.
 *
 * Every state-changing operation holds the operation lock for its event
 * ({@code op_lock:<group_id>}) and then the lock of its customer
 * ({@code cust_id_lock:<cust_id>}). Always taken in that order and released
 * together through {@link HeldLocks#close()}.
 *
 * Waiting happens in slices of the report interval; after each slice that
 * expires without the lock, a "still waiting" line names the current holder
 * and the other requesters queued in this process.
 */
@Component
@Slf4j
public class LockCoordinator {

    public static final String OPERATION_PREFIX = "op_lock:";
    public static final String CUSTOMER_PREFIX = "cust_id_lock:";

    private static final String OWNER_SEPARATOR = "|";

    private final LockBackend backend;
    private final LockWaitRegistry registry;
    private final Duration ttl;
    private final Duration blockingTimeout;
    private final Duration reportInterval;

    @Autowired
    public LockCoordinator(LockBackend backend,
                           LockWaitRegistry registry,
                           @Value("${locks.ttl:PT120S}") Duration ttl,
                           @Value("${locks.blocking-timeout:PT60S}") Duration blockingTimeout,
                           @Value("${locks.report-interval:PT10S}") Duration reportInterval) {
        this.backend = backend;
        this.registry = registry;
        this.ttl = ttl;
        this.blockingTimeout = blockingTimeout;
        this.reportInterval = reportInterval;
    }

    /**
     * Takes the operation lock for {@code groupId}, then the customer lock for {@code custId}.
     * A null or blank customer id takes the operation lock only.
     *
     * @param details who is asking, shown to other waiters
     * @throws LockTimeoutException if either lock is not obtained in time
     */
    public HeldLocks lockEvent(String groupId, String custId, String details) {
        LockHandle operation = acquire(OPERATION_PREFIX + groupId, details);
        if (custId == null || custId.isBlank()) {
            return new HeldLocks(operation, null);
        }
        try {
            LockHandle customer = acquire(CUSTOMER_PREFIX + custId, details);
            return new HeldLocks(operation, customer);
        } catch (RuntimeException e) {
            operation.close();
            throw e;
        }
    }

    /**
     * Takes a single lock, waiting up to the configured blocking timeout.
     */
    public LockHandle acquire(String key, String details) {
        String ownerValue = UUID.randomUUID() + OWNER_SEPARATOR + details;
        LockWaitRegistry.LockRequest request = registry.register(key, details);
        Instant deadline = request.getStartedAt().plus(blockingTimeout);
        try {
            while (true) {
                Duration remaining = Duration.between(registry.now(), deadline);
                if (remaining.isNegative() || remaining.isZero()) {
                    log.warn("Lock {} not acquired within {}s by {}", key, blockingTimeout.toSeconds(), details);
                    throw new LockTimeoutException(key, blockingTimeout);
                }
                Duration slice = remaining.compareTo(reportInterval) < 0 ? remaining : reportInterval;
                if (backend.acquire(key, ownerValue, ttl, slice)) {
                    Duration waited = request.waitingFor(registry.now());
                    if (waited.compareTo(reportInterval) >= 0) {
                        log.info("Lock {} acquired by {} after {}s", key, details, waited.toSeconds());
                    } else {
                        log.debug("Lock {} acquired by {}", key, details);
                    }
                    return new LockHandle(this, key, ownerValue);
                }
                reportWaiting(key, request);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockTimeoutException(key, "Interrupted while waiting for lock " + key, e);
        } finally {
            registry.deregister(request);
        }
    }

    public boolean isLocked(String key) {
        return backend.exists(key);
    }

    void release(String key, String ownerValue) {
        try {
            if (!backend.release(key, ownerValue)) {
                log.warn("Lock {} had already expired or changed owner when released", key);
            } else {
                log.debug("Lock {} released", key);
            }
        } catch (RuntimeException e) {
            log.warn("Failed to release lock {}, leaving it to expire after {}s: {}",
                key, ttl.toSeconds(), e.getMessage(), e);
        }
    }

    private void reportWaiting(String key, LockWaitRegistry.LockRequest request) {
        if (!registry.shouldReport(key, reportInterval)) {
            return;
        }
        String holder = backend.holder(key).map(LockCoordinator::describeOwner).orElse("none (expired)");
        List<LockWaitRegistry.LockRequest> others = registry.othersWaitingOn(key, request);
        String otherText = others.isEmpty() ? "none" : others.stream()
            .map(r -> r + " for " + r.waitingFor(registry.now()).toSeconds() + "s")
            .collect(Collectors.joining(", "));
        log.warn("Still waiting for lock {} after {}s: request {}, held by {}, other waiters: {}",
            key, request.waitingFor(registry.now()).toSeconds(), request, holder, otherText);
    }

    static String describeOwner(String ownerValue) {
        int separator = ownerValue.indexOf(OWNER_SEPARATOR);
        return separator >= 0 ? ownerValue.substring(separator + 1) : ownerValue;
    }
}
