package com.eventdaemon.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Raised by {@link com.eventdaemon.core.ConnectionManager#connect()} once every attempt
 * allowed by the retry policy has failed. This is the only failure that crosses the
 * daemon's public boundary.
 */
@Getter
public class ConnectionFailedException extends BaseException {

    private final int attempts;

    public ConnectionFailedException(int attempts, Throwable lastError) {
        super(
                ErrorCode.CONNECTION_FAILED,
                "Failed to connect after " + attempts + " attempts",
                Map.of("attempts", attempts),
                lastError);
        this.attempts = attempts;
    }
}
