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
 * A structured payload posted on chain by the bridge or a customer.
 *
 * Plain notifications carry no value. Keepsats transfers move sats between
 * two customers' balances without touching either network.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonTypeName(ChainNotification.KIND)
public class ChainNotification implements TrackedEvent {

    public static final String KIND = "chain_notification";

    public enum Purpose {
        NOTIFICATION,
        KEEPSATS_TRANSFER
    }

    String groupId;
    String custId;
    Instant timestamp;
    BigDecimal amount;
    Currency unit;
    ConversionSnapshot conv;
    Purpose purpose;
    String toCustId;
    String memo;

    @Override
    public <R> R accept(TrackedEventVisitor<R> visitor) {
        return visitor.visitChainNotification(this);
    }

    @Override
    public String kind() {
        return KIND;
    }
}
