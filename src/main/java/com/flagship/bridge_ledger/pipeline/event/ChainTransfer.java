package com.flagship.bridge_ledger.pipeline.event;

import com.fasterxml.jackson.annotation.JsonTypeName;
import com.flagship.bridge_ledger.conversion.ConversionSnapshot;
import com.flagship.bridge_ledger.conversion.Currency;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A token transfer on the chain involving the server account.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonTypeName(ChainTransfer.KIND)
public class ChainTransfer implements TrackedEvent {

    public static final String KIND = "chain_transfer";

    public enum Intent {
        /** Customer sends tokens to be held for them. */
        DEPOSIT,
        /** Server pays tokens out to the customer. */
        WITHDRAWAL,
        /** Server moves tokens to the treasury account. */
        TREASURY_SWEEP,
        /** Customer sends tokens to be converted to keepsats. */
        CONVERT_TO_KEEPSATS
    }

    String groupId;
    String custId;
    Instant timestamp;
    BigDecimal amount;
    Currency unit;
    ConversionSnapshot conv;
    String from;
    String to;
    String memo;
    Intent intent;

    @Override
    public <R> R accept(TrackedEventVisitor<R> visitor) {
        return visitor.visitChainTransfer(this);
    }

    @Override
    public String kind() {
        return KIND;
    }
}
