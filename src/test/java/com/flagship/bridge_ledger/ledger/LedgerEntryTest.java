package com.flagship.bridge_ledger.ledger;

import com.flagship.bridge_ledger.conversion.ConversionSnapshot;
import com.flagship.bridge_ledger.conversion.Currency;
import com.flagship.bridge_ledger.error.ImbalancedEntryException;
import com.flagship.bridge_ledger.error.ValidationException;
import com.flagship.bridge_ledger.support.TestEntries;
import com.flagship.bridge_ledger.support.TestQuotes;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class LedgerEntryTest {

    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

    private final ChartOfAccounts chart = new ChartOfAccounts("v4vapp", "v4vapp.tre", "umbrel");

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private LedgerEntry hiveAgainstMsats(long creditMsats) {
        ConversionSnapshot hiveConv = ConversionSnapshot.of(new BigDecimal("10.000"), Currency.HIVE, TestQuotes.standard());
        return LedgerEntry.builder()
            .groupId("hive-vs-msats")
            .ledgerType(LedgerType.CONV_HIVE_TO_KEEPSATS)
            .timestamp(NOW)
            .custId("alice")
            .debit(LedgerLeg.of(chart.customerLiability("alice"), Currency.HIVE, new BigDecimal("10.000"), hiveConv))
            .credit(TestEntries.msatsLeg(chart.customerLiability("alice"), creditMsats))
            .build();
    }

    @Test
    @DisplayName("Legs within one HIVE tolerance unit (254 msats) balance")
    void testWithinTolerance() {
        printTestHeader("Balanced Within Tolerance");

        LedgerEntry entry = hiveAgainstMsats(2_539_118L + 200);

        assertEquals(254L, entry.toleranceMsats());
        assertTrue(entry.isBalanced());
        assertDoesNotThrow(entry::checkBalanced);
        printSuccess("200 msats difference accepted");
    }

    @Test
    @DisplayName("Legs differing by more than the tolerance are rejected")
    void testOutsideTolerance() {
        printTestHeader("Imbalanced Entry");

        LedgerEntry entry = hiveAgainstMsats(2_539_118L + 300);

        assertFalse(entry.isBalanced());
        ImbalancedEntryException e = assertThrows(ImbalancedEntryException.class, entry::checkBalanced);
        assertEquals("hive-vs-msats", e.getGroupId());
        assertFalse(e.isRetryable());
        printSuccess("300 msats difference rejected: " + e.getMessage());
    }

    @Test
    @DisplayName("A leg is valued by its own amount, not by the snapshot it carries")
    void testLegAmountDisagreesWithSnapshot() {
        printTestHeader("Leg Amount Against Snapshot");

        // Given: both legs carry the 10 HIVE snapshot, but the credit books 1000 HIVE
        ConversionSnapshot tenHive = ConversionSnapshot.of(new BigDecimal("10.000"), Currency.HIVE, TestQuotes.standard());
        LedgerEntry entry = LedgerEntry.builder()
            .groupId("same-snapshot")
            .ledgerType(LedgerType.CUSTOMER_HIVE_IN)
            .timestamp(NOW)
            .custId("alice")
            .debit(LedgerLeg.of(chart.customerDepositsHive(), Currency.HIVE, new BigDecimal("10.000"), tenHive))
            .credit(LedgerLeg.of(chart.customerLiability("alice"), Currency.HIVE, new BigDecimal("1000.000"), tenHive))
            .build();

        // When / Then
        assertEquals(2_539_118L, entry.getDebit().msats());
        assertEquals(253_911_800L, entry.getCredit().msats());
        assertFalse(entry.isBalanced());
        assertThrows(ImbalancedEntryException.class, entry::checkBalanced);
        printSuccess("10 HIVE against 1000 HIVE rejected despite the shared snapshot");
    }

    @Test
    @DisplayName("An entry without a group_id fails validation")
    void testMissingGroupId() {
        printTestHeader("Missing group_id");

        LedgerEntry entry = TestEntries.msats("g", LedgerType.FUNDING, null,
                chart.treasuryLightning(), chart.ownerLoanPayable(), 1000, NOW)
            .toBuilder().groupId(" ").build();

        assertThrows(ValidationException.class, entry::checkBalanced);
        printSuccess("Blank group_id rejected");
    }

    @Test
    @DisplayName("Negative leg amounts are rejected at construction")
    void testNegativeLeg() {
        printTestHeader("Negative Leg");

        ConversionSnapshot conv = ConversionSnapshot.ofMsats(1000, TestQuotes.standard(), null);
        assertThrows(ValidationException.class,
            () -> LedgerLeg.of(chart.treasuryLightning(), Currency.MSATS, new BigDecimal("-1000"), conv));
        printSuccess("Negative amount rejected");
    }

    @Test
    @DisplayName("Ledger types round-trip through their stored code and carry display labels")
    void testLedgerTypeCodesAndLabels() {
        printTestHeader("Ledger Type Codes");

        for (LedgerType type : LedgerType.values()) {
            assertTrue(type.getCode().length() <= 10, type + " code too long");
            assertEquals(type, LedgerType.fromCode(type.getCode()));
        }
        assertEquals(LedgerType.CUSTOMER_HIVE_IN, LedgerType.fromCode("cust_h_in"));
        assertEquals("Receive", LedgerType.RECEIVE_LIGHTNING.getLabel());
        assertEquals("Send", LedgerType.WITHDRAW_LIGHTNING.getLabel());
        assertEquals("Deposit", LedgerType.CUSTOMER_HIVE_IN.getLabel());
        assertEquals("Withdraw Hive", LedgerType.WITHDRAW_HIVE.getLabel());
        assertThrows(ValidationException.class, () -> LedgerType.fromCode("nope"));
        printSuccess("Codes unique and labels resolved");
    }

    @Test
    @DisplayName("Account signs follow the normal side and flip for contra accounts")
    void testAccountSigns() {
        printTestHeader("Account Signs");

        Account asset = chart.treasuryLightning();
        Account liability = chart.customerLiability("alice");
        Account contra = chart.convertedKeepsatsOffset();

        assertEquals(1, asset.signFor(EntryType.DEBIT));
        assertEquals(-1, asset.signFor(EntryType.CREDIT));
        assertEquals(1, liability.signFor(EntryType.CREDIT));
        assertEquals(-1, liability.signFor(EntryType.DEBIT));
        assertTrue(contra.isContra());
        assertEquals(-1, contra.signFor(EntryType.DEBIT));
        assertEquals(1, contra.signFor(EntryType.CREDIT));
        printSuccess("Signs correct");
    }

    @Test
    @DisplayName("Accounts are equal by name, type, sub-account and contra flag")
    void testAccountEquality() {
        printTestHeader("Account Equality");

        assertEquals(chart.customerLiability("alice"), Account.liability("Customer Liability", "alice"));
        assertNotEquals(chart.customerLiability("alice"), chart.customerLiability("bob"));
        assertEquals(Account.asset("X", null).getSub(), "");
        assertTrue(chart.convertedKeepsatsOffset().toString().endsWith("(Contra)"));
        Account offset = chart.convertedKeepsatsOffset();
        Account plain = new Account(offset.getName(), offset.getAccountType(), offset.getSub(), false);
        assertNotEquals(offset, plain, "Contra flag is part of the identity");
        assertEquals(offset, plain.asContra());
        assertEquals(offset.hashCode(), plain.asContra().hashCode());
        printSuccess("Equality based on all identity fields");
    }
}
