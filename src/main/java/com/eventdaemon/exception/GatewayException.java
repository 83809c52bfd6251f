package com.eventdaemon.exception;

public class GatewayException extends BaseException {

    public GatewayException(String message) {
        super(ErrorCode.GATEWAY_ERROR, message);
    }

    public GatewayException(String message, Throwable cause) {
        super(ErrorCode.GATEWAY_ERROR, message, cause);
    }
}
