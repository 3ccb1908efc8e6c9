package com.flagship.bridge_ledger.lock;

import java.util.ArrayList;
import java.util.List;

/**
 * The operation lock and (optionally) the customer lock held for one event.
 * Released customer-first on close.
 */
public final class HeldLocks implements AutoCloseable {

    private final LockHandle operation;
    private final LockHandle customer;

    HeldLocks(LockHandle operation, LockHandle customer) {
        this.operation = operation;
        this.customer = customer;
    }

    public List<String> keys() {
        List<String> keys = new ArrayList<>();
        keys.add(operation.getKey());
        if (customer != null) {
            keys.add(customer.getKey());
        }
        return keys;
    }

    @Override
    public void close() {
        try {
            if (customer != null) {
                customer.close();
            }
        } finally {
            operation.close();
        }
    }
}
