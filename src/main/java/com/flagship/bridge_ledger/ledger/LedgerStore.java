package com.flagship.bridge_ledger.ledger;

import java.util.List;
import java.util.Optional;

/**
 * Append-only store of ledger entries, keyed by group_id.
 *
 * There is no update or delete: entries are immutable once written.
 */
public interface LedgerStore {

    /**
     * Writes an entry unless one with the same group_id already exists.
     *
     * The conservation rule is checked before anything is written.
     *
     * @return {@link SaveResult#DUPLICATE} if the group_id was already stored
     * @throws com.flagship.bridge_ledger.error.ImbalancedEntryException if the legs do not balance
     * @throws com.flagship.bridge_ledger.error.TransientStoreException if the store is unreachable
     */
    SaveResult save(LedgerEntry entry);

    Optional<LedgerEntry> load(String groupId);

    /**
     * Entries matching {@code query}, oldest first.
     */
    List<LedgerEntry> findEntries(LedgerQuery query);

    /**
     * Entries derived from one tracked event, oldest first.
     */
    List<LedgerEntry> findBySourceGroupId(String sourceGroupId);

    /**
     * Distinct accounts on either side of any entry.
     */
    List<Account> listAccounts();

    LedgerTotals totals();

    /**
     * Entries whose legs differ by more than the settlement-unit tolerance.
     * Callers re-check these with each entry's own tolerance.
     */
    List<LedgerEntry> findConservationCandidates();
}
