package com.flagship.bridge_ledger.pipeline;

/**
 * Furthest stage an event reached before its outcome was decided.
 */
public enum ProcessingState {
    RECEIVED,
    LOCKED,
    PROCESSING
}
