package com.eventdaemon.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Root of the daemon's unchecked exceptions. Each carries an {@link ErrorCode} and a small map
 * of structured details (attempt counts, file paths) for log lines.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message) {
        this(errorCode, message, Map.of(), null);
    }

    protected BaseException(ErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, Map.of(), cause);
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details) {
        this(errorCode, message, details, null);
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = details != null ? Map.copyOf(details) : Map.of();
    }

    /** Whether the daemon must stop rather than log and carry on. */
    public boolean isFatal() {
        return errorCode.isFatal();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + errorCode.getCode() + "]: " + getMessage();
    }
}
