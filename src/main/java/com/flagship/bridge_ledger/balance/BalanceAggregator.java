package com.flagship.bridge_ledger.balance;

import com.flagship.bridge_ledger.conversion.Currency;
import com.flagship.bridge_ledger.ledger.Account;
import com.flagship.bridge_ledger.ledger.EntryType;
import com.flagship.bridge_ledger.ledger.LedgerEntry;
import com.flagship.bridge_ledger.ledger.LedgerLeg;
import com.flagship.bridge_ledger.ledger.LedgerQuery;
import com.flagship.bridge_ledger.ledger.LedgerStore;
import com.flagship.bridge_ledger.ledger.LedgerType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Derives account balances from the ledger.
 *
 * Balances are never stored or cached: every call reads the entries and
 * accumulates a signed running total per unit. Asset and expense accounts
 * grow with debits, the other types with credits; contra accounts run the
 * other way.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BalanceAggregator {

    private final LedgerStore ledgerStore;

    public AccountBalance balance(Account account, Instant asOf) {
        return balance(account, asOf, null, false);
    }

    /**
     * Balance of {@code account} at {@code asOf}.
     *
     * @param ageWindow when set, only entries newer than {@code asOf - ageWindow} are counted
     * @param withLines include every leg with its running total
     */
    public AccountBalance balance(Account account, Instant asOf, Duration ageWindow, boolean withLines) {
        Instant from = ageWindow != null ? asOf.minus(ageWindow) : null;
        List<LedgerEntry> entries = ledgerStore.findEntries(LedgerQuery.builder()
            .account(account)
            .from(from)
            .to(asOf)
            .build());

        Map<Currency, BigDecimal> totals = new EnumMap<>(Currency.class);
        ConvertedTotals converted = ConvertedTotals.ZERO;
        long runningMsats = 0;
        List<BalanceLine> lines = new ArrayList<>();

        for (LedgerEntry entry : entries) {
            for (EntryType side : EntryType.values()) {
                LedgerLeg leg = side == EntryType.DEBIT ? entry.getDebit() : entry.getCredit();
                if (!leg.getAccount().equals(account)) {
                    continue;
                }
                int sign = leg.getAccount().signFor(side);
                BigDecimal signedAmount = leg.getAmount().multiply(BigDecimal.valueOf(sign));
                BigDecimal running = totals.merge(leg.getUnit(), signedAmount, BigDecimal::add);
                converted = converted.plus(leg.getConv(), sign);
                long signedMsats = sign * leg.msats();
                runningMsats += signedMsats;

                if (withLines) {
                    lines.add(new BalanceLine(
                        entry.getTimestamp(), entry.getGroupId(), entry.getLedgerType(),
                        entry.getDescription(), side, leg.getUnit(), signedAmount, running,
                        signedMsats, runningMsats));
                }
            }
        }

        log.debug("Balance of {} at {}: {} entries, totals={}", account, asOf, entries.size(), totals);
        return AccountBalance.builder()
            .account(account)
            .asOf(asOf)
            .from(from)
            .totals(Collections.unmodifiableMap(totals))
            .converted(converted)
            .lines(Collections.unmodifiableList(lines))
            .entryCount(entries.size())
            .build();
    }

    /**
     * Distinct accounts that appear in the ledger.
     */
    public List<Account> listAccounts() {
        return ledgerStore.listAccounts();
    }

    /**
     * Msats value of a customer's entries of the given types on {@code account}
     * within {@code window} before {@code asOf}. Each entry counts once, even
     * when both of its legs touch the account. Entries derived from the event
     * {@code excludedSourceGroupId} (may be null) are left out.
     */
    public long conversionTotalMsats(String custId, Account account, Set<LedgerType> types,
                                     Instant asOf, Duration window, String excludedSourceGroupId) {
        List<LedgerEntry> entries = ledgerStore.findEntries(LedgerQuery.builder()
            .account(account)
            .custId(custId)
            .ledgerTypes(types)
            .from(asOf.minus(window))
            .to(asOf)
            .build());
        return entries.stream()
            .filter(entry -> excludedSourceGroupId == null || !excludedSourceGroupId.equals(entry.getSourceGroupId()))
            .mapToLong(entry -> entry.getDebit().msats())
            .sum();
    }
}
