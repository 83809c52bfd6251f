package com.eventdaemon.core;

import java.time.Duration;
import lombok.Value;

/** Fixed-delay retry policy for connection attempts. Allows {@code maxRetries + 1} attempts. */
@Value
public class RetryPolicy {

    /** Largest retry count whose attempt count still fits in an {@code int}. */
    public static final int MAX_RETRIES = Integer.MAX_VALUE - 1;

    int maxRetries;
    Duration retryDelay;

    public RetryPolicy(int maxRetries, Duration retryDelay) {
        if (maxRetries < 0 || maxRetries > MAX_RETRIES) {
            throw new IllegalArgumentException(
                    "maxRetries must be between 0 and " + MAX_RETRIES + ", got " + maxRetries);
        }
        if (retryDelay == null || retryDelay.isNegative()) {
            throw new IllegalArgumentException("retryDelay must be >= 0, got " + retryDelay);
        }
        this.maxRetries = maxRetries;
        this.retryDelay = retryDelay;
    }

    public int getMaxAttempts() {
        return maxRetries + 1;
    }
}
