package com.reitracker.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Root of the engine's exception hierarchy. Every failure carries an {@link ErrorCode}
 * and an optional map of structured details for the caller (e.g., the offending field).
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message) {
        this(errorCode, message, Map.of());
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(message);
        this.errorCode = errorCode;
        this.details = details != null ? Map.copyOf(details) : Map.of();
    }
}
