package com.venue.scout.recommender.common.exception;

/**
 * Transient provider failure: network error, non-2xx response, quota exhausted.
 */
public class SourceUnavailableException extends BaseScoutException {
    private static final String DEFAULT_ERROR_CODE = "ERR-SRC-002";

    public SourceUnavailableException(String message) {
        super(message);
    }

    public SourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
