package com.flagship.bridge_ledger.ledger;

/**
 * Account classes of the chart of accounts.
 *
 * Asset and expense accounts grow with debits; liability, equity and revenue
 * accounts grow with credits.
 */
public enum AccountType {
    ASSET("Asset", EntryType.DEBIT),
    LIABILITY("Liability", EntryType.CREDIT),
    EQUITY("Equity", EntryType.CREDIT),
    REVENUE("Revenue", EntryType.CREDIT),
    EXPENSE("Expense", EntryType.DEBIT);

    private final String label;
    private final EntryType normalSide;

    AccountType(String label, EntryType normalSide) {
        this.label = label;
        this.normalSide = normalSide;
    }

    public String getLabel() {
        return label;
    }

    public EntryType getNormalSide() {
        return normalSide;
    }

    /**
     * +1 if a leg on {@code side} increases an account of this type, -1 otherwise.
     */
    public int signFor(EntryType side) {
        return side == normalSide ? 1 : -1;
    }
}
