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
 * A payment routed through the node, earning a routing fee.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonTypeName(ForwardedEvent.KIND)
public class ForwardedEvent implements TrackedEvent {

    public static final String KIND = "forwarded_event";

    String groupId;
    String custId;
    Instant timestamp;
    BigDecimal amount;
    Currency unit;
    ConversionSnapshot conv;
    long feeMsats;
    String incomingChannel;
    String outgoingChannel;

    @Override
    public <R> R accept(TrackedEventVisitor<R> visitor) {
        return visitor.visitForwardedEvent(this);
    }

    @Override
    public String kind() {
        return KIND;
    }
}
