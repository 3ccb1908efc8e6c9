package com.flagship.bridge_ledger.support;

import com.flagship.bridge_ledger.conversion.Currency;
import com.flagship.bridge_ledger.pipeline.event.ChainTransfer;
import com.flagship.bridge_ledger.pipeline.event.NetworkInvoice;
import com.flagship.bridge_ledger.pipeline.event.NetworkPayment;

import java.math.BigDecimal;

public final class TestEvents {

    private TestEvents() {
    }

    public static ChainTransfer transfer(String groupId, String custId, String amount, ChainTransfer.Intent intent) {
        return ChainTransfer.builder()
            .groupId(groupId)
            .custId(custId)
            .timestamp(TestQuotes.FETCHED_AT)
            .amount(new BigDecimal(amount))
            .unit(Currency.HIVE)
            .from(custId)
            .to("v4vapp")
            .memo("")
            .intent(intent)
            .build();
    }

    public static ChainTransfer deposit(String groupId, String custId, String amount) {
        return transfer(groupId, custId, amount, ChainTransfer.Intent.DEPOSIT);
    }

    public static NetworkInvoice invoice(String groupId, String custId, long msats, Currency target) {
        return NetworkInvoice.builder()
            .groupId(groupId)
            .custId(custId)
            .timestamp(TestQuotes.FETCHED_AT)
            .amount(BigDecimal.valueOf(msats))
            .unit(Currency.MSATS)
            .memo(custId + " | deposit")
            .settled(true)
            .targetUnit(target)
            .build();
    }

    public static NetworkPayment payment(String groupId, String custId, long msats, long feeMsats,
                                         String initiatingGroupId) {
        return NetworkPayment.builder()
            .groupId(groupId)
            .custId(custId)
            .timestamp(TestQuotes.FETCHED_AT)
            .amount(BigDecimal.valueOf(msats))
            .unit(Currency.MSATS)
            .status(NetworkPayment.Status.SUCCEEDED)
            .feeMsats(feeMsats)
            .initiatingGroupId(initiatingGroupId)
            .build();
    }
}
