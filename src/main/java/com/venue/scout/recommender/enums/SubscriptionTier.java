package com.venue.scout.recommender.enums;

import java.time.Duration;

/**
 * Refresh cadence and batch size per subscription tier. A zero cadence means the pool is
 * regenerated on every request.
 */
public enum SubscriptionTier {
    FREE(Duration.ofHours(4), 8),
    PLUS(Duration.ofHours(1), 10),
    PREMIUM(Duration.ZERO, 20);

    private final Duration refreshInterval;
    private final int resultsPerRefresh;

    SubscriptionTier(Duration refreshInterval, int resultsPerRefresh) {
        this.refreshInterval = refreshInterval;
        this.resultsPerRefresh = resultsPerRefresh;
    }

    public Duration getRefreshInterval() {
        return refreshInterval;
    }

    public int getResultsPerRefresh() {
        return resultsPerRefresh;
    }

    public boolean hasCadenceLimit() {
        return !refreshInterval.isZero();
    }
}
