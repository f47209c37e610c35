package com.tradecopier.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Root of the copier's unchecked exceptions. Every subclass names an {@link ErrorCode};
 * {@code details} carries the ids involved (master position, instrument, venue error code) for
 * the error response and the {@code [ERROR]} log line.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message) {
        this(errorCode, message, Map.of(), null);
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details) {
        this(errorCode, message, details, null);
    }

    protected BaseException(ErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, Map.of(), cause);
    }

    private BaseException(ErrorCode errorCode, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = details != null ? Map.copyOf(details) : Map.of();
    }

    public boolean isRetryable() {
        return errorCode.isRetryable();
    }
}
