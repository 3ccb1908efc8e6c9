package com.flagship.bridge_ledger.sanity;

import lombok.Value;

/**
 * Outcome of one named ledger check.
 */
@Value
public class SanityCheckResult {
    String name;
    boolean valid;
    String details;

    public static SanityCheckResult pass(String name, String details) {
        return new SanityCheckResult(name, true, details);
    }

    public static SanityCheckResult fail(String name, String details) {
        return new SanityCheckResult(name, false, details);
    }
}
