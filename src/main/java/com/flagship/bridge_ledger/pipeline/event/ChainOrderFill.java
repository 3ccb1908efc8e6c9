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
 * A fill of one of the server's internal-market orders: {@code amount} of
 * {@code unit} paid, {@code receivedAmount} of {@code receivedUnit} received.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonTypeName(ChainOrderFill.KIND)
public class ChainOrderFill implements TrackedEvent {

    public static final String KIND = "chain_order_fill";

    String groupId;
    String custId;
    Instant timestamp;
    BigDecimal amount;
    Currency unit;
    ConversionSnapshot conv;
    BigDecimal receivedAmount;
    Currency receivedUnit;
    long orderId;

    @Override
    public <R> R accept(TrackedEventVisitor<R> visitor) {
        return visitor.visitChainOrderFill(this);
    }

    @Override
    public String kind() {
        return KIND;
    }
}
