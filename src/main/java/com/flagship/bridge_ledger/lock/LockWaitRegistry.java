package com.flagship.bridge_ledger.lock;

import lombok.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Lock requests currently waiting in this process.
 *
 * Feeds the "still waiting" diagnostics so an operator can see who else is
 * queued on the same key.
 */
@Component
public class LockWaitRegistry {

    private final Map<String, LockRequest> waiting = new ConcurrentHashMap<>();
    private final Map<String, Instant> lastReported = new ConcurrentHashMap<>();
    private final Clock clock;

    public LockWaitRegistry() {
        this(Clock.systemUTC());
    }

    LockWaitRegistry(Clock clock) {
        this.clock = clock;
    }

    public LockRequest register(String key, String details) {
        LockRequest request = new LockRequest(UUID.randomUUID().toString().substring(0, 8), key, details, clock.instant());
        waiting.put(request.getRequestId(), request);
        return request;
    }

    public void deregister(LockRequest request) {
        waiting.remove(request.getRequestId());
        if (waiting.values().stream().noneMatch(r -> r.getKey().equals(request.getKey()))) {
            lastReported.remove(request.getKey());
        }
    }

    /**
     * Requests waiting on {@code key} other than {@code self}, oldest first.
     */
    public List<LockRequest> othersWaitingOn(String key, LockRequest self) {
        return waiting.values().stream()
            .filter(r -> r.getKey().equals(key) && !r.getRequestId().equals(self.getRequestId()))
            .sorted(Comparator.comparing(LockRequest::getStartedAt))
            .collect(Collectors.toList());
    }

    public List<LockRequest> outstanding() {
        return waiting.values().stream()
            .sorted(Comparator.comparing(LockRequest::getStartedAt))
            .collect(Collectors.toList());
    }

    /**
     * True at most once per {@code interval} for a given key.
     */
    public boolean shouldReport(String key, Duration interval) {
        Instant now = clock.instant();
        boolean[] report = {false};
        lastReported.compute(key, (k, last) -> {
            if (last == null || Duration.between(last, now).compareTo(interval) >= 0) {
                report[0] = true;
                return now;
            }
            return last;
        });
        return report[0];
    }

    public Instant now() {
        return clock.instant();
    }

    @Value
    public static class LockRequest {
        String requestId;
        String key;
        String details;
        Instant startedAt;

        public Duration waitingFor(Instant now) {
            return Duration.between(startedAt, now);
        }

        @Override
        public String toString() {
            return requestId + " (" + details + ")";
        }
    }
}
