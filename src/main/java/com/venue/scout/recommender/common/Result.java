package com.venue.scout.recommender.common;

import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * Outcome of a service operation: either a payload or an error message with an optional code.
 * Controllers turn it into an HTTP response through {@link com.venue.scout.recommender.common.exception.Http}.
 */
@Getter
@ToString
public final class Result<T> {

    private final boolean success;
    private final T data;
    private final String error;
    private final String errorCode;
    private final Instant timestamp;

    private Result(boolean success, T data, String error, String errorCode) {
        this.success = success;
        this.data = data;
        this.error = error;
        this.errorCode = errorCode;
        this.timestamp = Instant.now();
    }

    public static <T> Result<T> ok(T data) {
        return new Result<>(true, data, null, null);
    }

    public static <T> Result<T> ok() {
        return new Result<>(true, null, null, null);
    }

    public static <T> Result<T> fail(String code, String message) {
        return new Result<>(false, null, message, code);
    }

    public boolean isOk() {
        return success;
    }

    public T get() {
        return data;
    }
}
