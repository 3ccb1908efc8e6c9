package com.flagship.bridge_ledger.pipeline.event;

/**
 * One method per tracked event kind. Adding a kind breaks every visitor until it is handled.
 */
public interface TrackedEventVisitor<R> {

    R visitChainTransfer(ChainTransfer event);

    R visitChainOrderFill(ChainOrderFill event);

    R visitChainNotification(ChainNotification event);

    R visitNetworkInvoice(NetworkInvoice event);

    R visitNetworkPayment(NetworkPayment event);

    R visitForwardedEvent(ForwardedEvent event);
}
