package com.flagship.bridge_ledger.ledger;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Objects;

/**
 * An account in the bridge's chart of accounts.
 *
 * Accounts are plain values built fresh for each entry. Two accounts are the
 * same account when name, type, sub-account and contra flag all match.
 */
@Getter
@EqualsAndHashCode
public final class Account {

    private final String name;

    private final AccountType accountType;

    private final String sub;

    private final boolean contra;

    public Account(String name, AccountType accountType, String sub, boolean contra) {
        this.name = Objects.requireNonNull(name, "name");
        this.accountType = Objects.requireNonNull(accountType, "accountType");
        this.sub = sub != null ? sub : "";
        this.contra = contra;
    }

    public static Account asset(String name, String sub) {
        return new Account(name, AccountType.ASSET, sub, false);
    }

    public static Account liability(String name, String sub) {
        return new Account(name, AccountType.LIABILITY, sub, false);
    }

    public static Account equity(String name, String sub) {
        return new Account(name, AccountType.EQUITY, sub, false);
    }

    public static Account revenue(String name, String sub) {
        return new Account(name, AccountType.REVENUE, sub, false);
    }

    public static Account expense(String name, String sub) {
        return new Account(name, AccountType.EXPENSE, sub, false);
    }

    public Account asContra() {
        return new Account(name, accountType, sub, true);
    }

    /**
     * +1 if a leg on {@code side} increases this account's balance, -1 otherwise.
     * Contra accounts run opposite to their type.
     */
    public int signFor(EntryType side) {
        int sign = accountType.signFor(side);
        return contra ? -sign : sign;
    }

    @Override
    public String toString() {
        String text = name + " (" + accountType.getLabel() + ") - Sub: " + sub;
        return contra ? text + " (Contra)" : text;
    }
}
