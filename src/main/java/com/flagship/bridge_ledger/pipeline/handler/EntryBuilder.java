package com.flagship.bridge_ledger.pipeline.handler;

import com.flagship.bridge_ledger.conversion.ConversionSnapshot;
import com.flagship.bridge_ledger.conversion.Currency;
import com.flagship.bridge_ledger.conversion.Quote;
import com.flagship.bridge_ledger.ledger.Account;
import com.flagship.bridge_ledger.ledger.LedgerEntry;
import com.flagship.bridge_ledger.ledger.LedgerLeg;
import com.flagship.bridge_ledger.ledger.LedgerType;
import com.flagship.bridge_ledger.pipeline.event.TrackedEvent;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Collects the entries one event produces and assigns their group_ids.
 *
 * The first entry takes the event's own group_id; later entries append the
 * ledger type code, so re-running a handler yields the same ids.
 */
public class EntryBuilder {

    private final TrackedEvent event;
    private final List<LedgerEntry> entries = new ArrayList<>();
    private final Set<String> usedIds = new HashSet<>();

    public EntryBuilder(TrackedEvent event) {
        this.event = event;
    }

    public EntryBuilder add(LedgerType type, String description, LedgerLeg debit, LedgerLeg credit) {
        return add(type, event.getCustId(), description, debit, credit);
    }

    public EntryBuilder add(LedgerType type, String custId, String description, LedgerLeg debit, LedgerLeg credit) {
        String groupId = nextGroupId(type);
        entries.add(LedgerEntry.builder()
            .groupId(groupId)
            .shortId(event.shortId())
            .custId(custId)
            .ledgerType(type)
            .timestamp(event.getTimestamp())
            .description(description)
            .debit(debit)
            .credit(credit)
            .sourceGroupId(event.getGroupId())
            .build());
        return this;
    }

    public List<LedgerEntry> build() {
        return List.copyOf(entries);
    }

    private String nextGroupId(LedgerType type) {
        String candidate = entries.isEmpty() ? event.getGroupId() : event.getGroupId() + "_" + type.getCode();
        if (!usedIds.add(candidate)) {
            candidate = candidate + "_" + entries.size();
            usedIds.add(candidate);
        }
        return candidate;
    }

    public static LedgerLeg leg(Account account, Currency unit, BigDecimal amount, ConversionSnapshot conv) {
        return LedgerLeg.of(account, unit, amount, conv);
    }

    /**
     * A leg booking the snapshot's value in msats.
     */
    public static LedgerLeg msatsLeg(Account account, ConversionSnapshot conv) {
        return LedgerLeg.of(account, Currency.MSATS, BigDecimal.valueOf(conv.getMsats()), conv);
    }

    /**
     * The event's own amount, priced by its producer if it was, otherwise at {@code quote}.
     */
    public static ConversionSnapshot priced(TrackedEvent event, Quote quote) {
        if (event.getConv() != null) {
            return event.getConv();
        }
        return ConversionSnapshot.of(event.getAmount(), event.getUnit(), quote);
    }
}
