package com.flagship.bridge_ledger.pipeline.event;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.flagship.bridge_ledger.conversion.ConversionSnapshot;
import com.flagship.bridge_ledger.conversion.Currency;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * An event observed on one of the two networks that may move money.
 *
 * The set of kinds is closed; {@link #accept} gives each handler a
 * type-checked view of its own kind. Upstream producers deliver at least
 * once, so the same group_id can arrive many times.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ChainTransfer.class, name = ChainTransfer.KIND),
    @JsonSubTypes.Type(value = ChainOrderFill.class, name = ChainOrderFill.KIND),
    @JsonSubTypes.Type(value = ChainNotification.class, name = ChainNotification.KIND),
    @JsonSubTypes.Type(value = NetworkInvoice.class, name = NetworkInvoice.KIND),
    @JsonSubTypes.Type(value = NetworkPayment.class, name = NetworkPayment.KIND),
    @JsonSubTypes.Type(value = ForwardedEvent.class, name = ForwardedEvent.KIND)
})
public interface TrackedEvent {

    String getGroupId();

    /** Customer the event belongs to; null for node-level events. */
    String getCustId();

    Instant getTimestamp();

    BigDecimal getAmount();

    Currency getUnit();

    /** Pricing supplied by the producer, if it priced the event itself. */
    ConversionSnapshot getConv();

    <R> R accept(TrackedEventVisitor<R> visitor);

    /**
     * Stable kind tag, as used in the JSON payload.
     */
    String kind();

    default String shortId() {
        String groupId = getGroupId();
        return groupId.length() <= 10 ? groupId : groupId.substring(groupId.length() - 10);
    }

    default String describe() {
        return kind() + " " + getGroupId() + " (" + getAmount() + " " + getUnit() + ", cust=" + getCustId() + ")";
    }
}
