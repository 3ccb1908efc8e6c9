package com.flagship.bridge_ledger.error;

/**
 * Thrown when a ledger entry's debit and credit legs do not carry the same value.
 * Indicates a defect in entry construction.
 */
public class ImbalancedEntryException extends LedgerException {

    private final String groupId;

    public ImbalancedEntryException(String groupId, long debitMsats, long creditMsats, long toleranceMsats) {
        super(ErrorKind.IMBALANCED_ENTRY, String.format(
            "Ledger entry %s is not balanced: debit=%d msats, credit=%d msats, tolerance=%d msats",
            groupId, debitMsats, creditMsats, toleranceMsats));
        this.groupId = groupId;
    }

    public String getGroupId() {
        return groupId;
    }
}
