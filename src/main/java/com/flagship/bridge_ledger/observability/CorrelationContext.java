package com.flagship.bridge_ledger.observability;

import com.flagship.bridge_ledger.pipeline.event.TrackedEvent;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC context for one pipeline invocation.
 *
 * Every log line written while an event is processed carries its group id,
 * customer, kind and a short invocation id, so a reprocessed event can be told
 * apart from its first attempt.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String GROUP_ID_MDC_KEY = "groupId";
    public static final String CUST_ID_MDC_KEY = "custId";
    public static final String EVENT_KIND_MDC_KEY = "eventKind";

    private CorrelationContext() {
        // Utility class
    }

    /**
     * Puts {@code event} into the MDC until the returned scope is closed.
     */
    public static Scope forEvent(TrackedEvent event) {
        MDC.put(CORRELATION_ID_MDC_KEY, generateCorrelationId());
        if (event.getGroupId() != null) {
            MDC.put(GROUP_ID_MDC_KEY, event.getGroupId());
        }
        MDC.put(EVENT_KIND_MDC_KEY, event.kind());
        if (event.getCustId() != null) {
            MDC.put(CUST_ID_MDC_KEY, event.getCustId());
        }
        return new Scope();
    }

    public static String currentGroupId() {
        return MDC.get(GROUP_ID_MDC_KEY);
    }

    /**
     * Uses a shorter format for readability in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public static final class Scope implements AutoCloseable {

        private Scope() {
        }

        @Override
        public void close() {
            MDC.remove(CORRELATION_ID_MDC_KEY);
            MDC.remove(GROUP_ID_MDC_KEY);
            MDC.remove(CUST_ID_MDC_KEY);
            MDC.remove(EVENT_KIND_MDC_KEY);
        }
    }
}
