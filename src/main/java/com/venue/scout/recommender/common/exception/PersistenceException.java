package com.venue.scout.recommender.common.exception;

public class PersistenceException extends BaseScoutException {
    private static final String DEFAULT_ERROR_CODE = "ERR-DB-002";

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
