package com.flagship.bridge_ledger.sanity;

import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
public class SanityReport {
    Instant checkedAt;
    List<SanityCheckResult> results;

    public boolean isValid() {
        return results.stream().allMatch(SanityCheckResult::isValid);
    }

    public List<SanityCheckResult> failures() {
        return results.stream().filter(r -> !r.isValid()).toList();
    }
}
