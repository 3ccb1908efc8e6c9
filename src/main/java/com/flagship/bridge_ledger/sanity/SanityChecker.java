package com.flagship.bridge_ledger.sanity;

import com.flagship.bridge_ledger.conversion.Currency;
import com.flagship.bridge_ledger.ledger.LedgerEntry;
import com.flagship.bridge_ledger.ledger.LedgerStore;
import com.flagship.bridge_ledger.ledger.LedgerTotals;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Ledger-wide invariant checks, run after every pipeline invocation.
 *
 * The latest report is kept for the health endpoint.
 */
@Component
@Slf4j
public class SanityChecker {

    static final String LEDGER_BALANCED = "ledger_balanced";
    static final String ENTRIES_BALANCED = "entries_balanced";

    private final LedgerStore ledgerStore;
    private final Clock clock;
    private final AtomicReference<SanityReport> latest = new AtomicReference<>();

    @Autowired
    public SanityChecker(LedgerStore ledgerStore) {
        this(ledgerStore, Clock.systemUTC());
    }

    SanityChecker(LedgerStore ledgerStore, Clock clock) {
        this.ledgerStore = ledgerStore;
        this.clock = clock;
    }

    public SanityReport run() {
        List<LedgerEntry> candidates = ledgerStore.findConservationCandidates();
        List<SanityCheckResult> results = new ArrayList<>();
        results.add(checkEntries(candidates));
        results.add(checkTotals(candidates));

        SanityReport report = new SanityReport(clock.instant(), List.copyOf(results));
        latest.set(report);
        if (!report.isValid()) {
            log.error("Ledger sanity check failed: {}", report.failures());
        }
        return report;
    }

    public Optional<SanityReport> latestReport() {
        return Optional.ofNullable(latest.get());
    }

    private SanityCheckResult checkEntries(List<LedgerEntry> candidates) {
        List<String> imbalanced = candidates.stream()
            .filter(entry -> !entry.isBalanced())
            .map(LedgerEntry::getGroupId)
            .toList();
        if (imbalanced.isEmpty()) {
            return SanityCheckResult.pass(ENTRIES_BALANCED, candidates.size() + " entries within unit tolerance");
        }
        return SanityCheckResult.fail(ENTRIES_BALANCED, "Imbalanced entries: " + imbalanced);
    }

    /**
     * Total debits and credits in msats may only differ by what each entry's
     * own tolerance allows.
     */
    private SanityCheckResult checkTotals(List<LedgerEntry> candidates) {
        LedgerTotals totals = ledgerStore.totals();
        long difference = Math.abs(totals.getDebitMsats() - totals.getCreditMsats());
        long allowed = candidates.stream().mapToLong(LedgerEntry::toleranceMsats).sum()
            + totals.getEntryCount() * Currency.MSATS.getTolerance().longValue();
        String details = String.format("entries=%d debit_msats=%d credit_msats=%d difference=%d allowed=%d",
            totals.getEntryCount(), totals.getDebitMsats(), totals.getCreditMsats(), difference, allowed);
        return difference <= allowed
            ? SanityCheckResult.pass(LEDGER_BALANCED, details)
            : SanityCheckResult.fail(LEDGER_BALANCED, details);
    }
}
