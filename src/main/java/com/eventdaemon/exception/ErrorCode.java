package com.eventdaemon.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Failure categories of the daemon. Only {@link #CONNECTION_FAILED} is fatal; every other
 * category is logged at the point of failure and the daemon carries on.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    CONNECTION_FAILED("CONNECTION_FAILED", true),
    HANDLER_LOAD_FAILED("HANDLER_LOAD_FAILED", false),
    REGISTRY_SEALED("REGISTRY_SEALED", true),
    GATEWAY_ERROR("GATEWAY_ERROR", false);

    private final String code;
    private final boolean fatal;
}
