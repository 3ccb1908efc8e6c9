package com.flagship.bridge_ledger.pipeline.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.flagship.bridge_ledger.conversion.ConversionSnapshot;
import com.flagship.bridge_ledger.conversion.Currency;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Locale;

/**
 * An invoice paid to the node. {@code targetUnit} says what the customer
 * wants credited: keepsats (SATS/MSATS) or a chain token.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonTypeName(NetworkInvoice.KIND)
public class NetworkInvoice implements TrackedEvent {

    public static final String KIND = "network_invoice";

    String groupId;
    String custId;
    Instant timestamp;
    BigDecimal amount;
    Currency unit;
    ConversionSnapshot conv;
    String memo;
    boolean settled;
    Currency targetUnit;

    @JsonIgnore
    public boolean isFunding() {
        return memo != null && memo.toLowerCase(Locale.ROOT).contains("funding");
    }

    @Override
    public <R> R accept(TrackedEventVisitor<R> visitor) {
        return visitor.visitNetworkInvoice(this);
    }

    @Override
    public String kind() {
        return KIND;
    }
}
