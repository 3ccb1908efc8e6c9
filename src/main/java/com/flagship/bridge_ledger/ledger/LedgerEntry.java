package com.flagship.bridge_ledger.ledger;

import com.flagship.bridge_ledger.error.ImbalancedEntryException;
import com.flagship.bridge_ledger.error.ValidationException;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One double-entry record: exactly one debit leg and one credit leg of equal value.
 *
 * Entries are written once and never changed. Corrections are new, offsetting entries.
 */
@Value
@Builder(toBuilder = true)
public class LedgerEntry {
    String groupId;
    String shortId;
    String custId;
    LedgerType ledgerType;
    Instant timestamp;
    String description;
    LedgerLeg debit;
    LedgerLeg credit;

    /** group_id of the tracked event this entry was derived from. */
    String sourceGroupId;

    /**
     * Allowed difference between the two legs, in msats.
     */
    public long toleranceMsats() {
        return Math.max(debit.toleranceMsats(), credit.toleranceMsats());
    }

    public boolean isBalanced() {
        return Math.abs(debit.msats() - credit.msats()) <= toleranceMsats();
    }

    /**
     * Checks required fields and the conservation rule.
     *
     * @throws ValidationException if a required field is missing
     * @throws ImbalancedEntryException if the legs carry different values
     */
    public void checkBalanced() {
        if (groupId == null || groupId.isBlank()) {
            throw new ValidationException("Ledger entry has no group_id");
        }
        if (ledgerType == null || timestamp == null || debit == null || credit == null) {
            throw new ValidationException("Ledger entry " + groupId + " is missing type, timestamp or a leg");
        }
        if (!isBalanced()) {
            throw new ImbalancedEntryException(groupId, debit.msats(), credit.msats(), toleranceMsats());
        }
    }

    public boolean touches(Account account) {
        return debit.getAccount().equals(account) || credit.getAccount().equals(account);
    }

    @Override
    public String toString() {
        return String.format("%s [%s] %s: DR %s %s %s / CR %s %s %s",
            groupId, ledgerType.getCode(), description,
            debit.getAccount(), debit.getAmount().toPlainString(), debit.getUnit(),
            credit.getAccount(), credit.getAmount().toPlainString(), credit.getUnit());
    }
}
