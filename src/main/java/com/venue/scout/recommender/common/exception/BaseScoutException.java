package com.venue.scout.recommender.common.exception;

import lombok.Getter;

/**
 * Root of the application's exceptions. Every subclass carries a stable error code that the
 * web layer maps to an HTTP status.
 */
@Getter
public abstract class BaseScoutException extends RuntimeException {

    private final String errorCode;

    protected BaseScoutException(String message) {
        super(message);
        this.errorCode = getDefaultErrorCode();
    }

    protected BaseScoutException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = getDefaultErrorCode();
    }

    protected BaseScoutException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    protected abstract String getDefaultErrorCode();
}
