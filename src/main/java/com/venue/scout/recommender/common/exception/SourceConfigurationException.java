package com.venue.scout.recommender.common.exception;

/**
 * A source adapter cannot run as configured (missing or rejected credential, bad base URL).
 * Fatal for that adapter only.
 */
public class SourceConfigurationException extends BaseScoutException {
    private static final String DEFAULT_ERROR_CODE = "ERR-SRC-001";

    public SourceConfigurationException(String message) {
        super(message);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
