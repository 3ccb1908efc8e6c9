package com.flagship.bridge_ledger.pipeline;

import com.flagship.bridge_ledger.conversion.Quote;
import com.flagship.bridge_ledger.error.LedgerException;
import com.flagship.bridge_ledger.pipeline.event.ChainNotification;
import com.flagship.bridge_ledger.pipeline.event.ChainOrderFill;
import com.flagship.bridge_ledger.pipeline.event.ChainTransfer;
import com.flagship.bridge_ledger.pipeline.event.ForwardedEvent;
import com.flagship.bridge_ledger.pipeline.event.NetworkInvoice;
import com.flagship.bridge_ledger.pipeline.event.NetworkPayment;
import com.flagship.bridge_ledger.pipeline.event.TrackedEvent;
import com.flagship.bridge_ledger.pipeline.event.TrackedEventVisitor;
import com.flagship.bridge_ledger.pipeline.handler.ChainNotificationHandler;
import com.flagship.bridge_ledger.pipeline.handler.ChainOrderFillHandler;
import com.flagship.bridge_ledger.pipeline.handler.ChainTransferHandler;
import com.flagship.bridge_ledger.pipeline.handler.ForwardedEventHandler;
import com.flagship.bridge_ledger.pipeline.handler.NetworkInvoiceHandler;
import com.flagship.bridge_ledger.pipeline.handler.NetworkPaymentHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Routes each tracked event to the handler for its kind.
 *
 * Ledger exceptions thrown by a handler come back as a {@link HandlerResult}
 * so the processor only ever deals with result values.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EventDispatcher {

    private final ChainTransferHandler chainTransferHandler;
    private final ChainOrderFillHandler chainOrderFillHandler;
    private final ChainNotificationHandler chainNotificationHandler;
    private final NetworkInvoiceHandler networkInvoiceHandler;
    private final NetworkPaymentHandler networkPaymentHandler;
    private final ForwardedEventHandler forwardedEventHandler;

    public HandlerResult dispatch(TrackedEvent event, Quote quote) {
        try {
            return event.accept(new TrackedEventVisitor<HandlerResult>() {
                @Override
                public HandlerResult visitChainTransfer(ChainTransfer e) {
                    return chainTransferHandler.handle(e, quote);
                }

                @Override
                public HandlerResult visitChainOrderFill(ChainOrderFill e) {
                    return chainOrderFillHandler.handle(e, quote);
                }

                @Override
                public HandlerResult visitChainNotification(ChainNotification e) {
                    return chainNotificationHandler.handle(e, quote);
                }

                @Override
                public HandlerResult visitNetworkInvoice(NetworkInvoice e) {
                    return networkInvoiceHandler.handle(e, quote);
                }

                @Override
                public HandlerResult visitNetworkPayment(NetworkPayment e) {
                    return networkPaymentHandler.handle(e, quote);
                }

                @Override
                public HandlerResult visitForwardedEvent(ForwardedEvent e) {
                    return forwardedEventHandler.handle(e, quote);
                }
            });
        } catch (LedgerException e) {
            log.warn("Handler for {} rejected it: {} ({})", event.getGroupId(), e.getMessage(), e.getKind());
            return HandlerResult.fromException(e);
        }
    }
}
