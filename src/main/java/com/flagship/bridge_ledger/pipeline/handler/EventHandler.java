package com.flagship.bridge_ledger.pipeline.handler;

import com.flagship.bridge_ledger.conversion.Quote;
import com.flagship.bridge_ledger.pipeline.HandlerResult;
import com.flagship.bridge_ledger.pipeline.event.TrackedEvent;

/**
 * Turns one kind of tracked event into ledger entries.
 *
 * Handlers build entries but never save them. They may throw
 * {@link com.flagship.bridge_ledger.error.LedgerException}s; the dispatcher
 * turns those into {@link HandlerResult}s.
 */
public interface EventHandler<E extends TrackedEvent> {

    HandlerResult handle(E event, Quote quote);
}
