package com.flagship.bridge_ledger.pipeline;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Linear backoff for handler failures marked retryable: attempt {@code n}
 * waits {@code n x baseDelay}, up to {@code maxAttempts} attempts in total.
 *
 * Lock timeouts do not go through this policy; they end the invocation as
 * FAILED_RETRYABLE and rely on redelivery, with lock expiry as the backstop.
 */
@Component
@Getter
public class RetryPolicy {

    private final int maxAttempts;
    private final Duration baseDelay;

    public RetryPolicy(@Value("${pipeline.retry.max-attempts:3}") int maxAttempts,
                       @Value("${pipeline.retry.base-delay:PT1S}") Duration baseDelay) {
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
    }

    public boolean canRetry(int attempt) {
        return attempt < maxAttempts;
    }

    /**
     * Delay before the attempt after {@code attempt}.
     */
    public Duration delayAfter(int attempt) {
        return baseDelay.multipliedBy(attempt);
    }
}
