package com.flagship.bridge_ledger.error;

import java.time.Duration;

/**
 * Thrown when a distributed lock could not be acquired within its blocking timeout.
 */
public class LockTimeoutException extends LedgerException {

    private final String lockKey;

    public LockTimeoutException(String lockKey, Duration waited) {
        super(ErrorKind.LOCK_TIMEOUT, String.format(
            "Could not acquire lock %s within %d ms", lockKey, waited.toMillis()));
        this.lockKey = lockKey;
    }

    public LockTimeoutException(String lockKey, String message, Throwable cause) {
        super(ErrorKind.LOCK_TIMEOUT, message, cause);
        this.lockKey = lockKey;
    }

    public String getLockKey() {
        return lockKey;
    }
}
