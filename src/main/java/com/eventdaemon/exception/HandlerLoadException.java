package com.eventdaemon.exception;

import java.nio.file.Path;
import java.util.Map;

public class HandlerLoadException extends BaseException {

    public HandlerLoadException(Path path, String message) {
        super(ErrorCode.HANDLER_LOAD_FAILED, message, Map.of("path", path.toString()));
    }

    public HandlerLoadException(Path path, String message, Throwable cause) {
        super(ErrorCode.HANDLER_LOAD_FAILED, message, Map.of("path", path.toString()), cause);
    }
}
