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
 * A payment sent by the node on a customer's behalf.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonTypeName(NetworkPayment.KIND)
public class NetworkPayment implements TrackedEvent {

    public static final String KIND = "network_payment";

    public enum Status {
        IN_FLIGHT,
        SUCCEEDED,
        FAILED
    }

    String groupId;
    String custId;
    Instant timestamp;
    BigDecimal amount;
    Currency unit;
    ConversionSnapshot conv;
    Status status;
    long feeMsats;
    /** group_id of the event that asked for this payment, if any. */
    String initiatingGroupId;

    @Override
    public <R> R accept(TrackedEventVisitor<R> visitor) {
        return visitor.visitNetworkPayment(this);
    }

    @Override
    public String kind() {
        return KIND;
    }
}
