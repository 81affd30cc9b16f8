package com.venue.scout.recommender.enums;

/**
 * Where the candidate pool of a generated batch came from.
 */
public enum PoolOrigin {
    CACHED,
    LIVE,
    STALE_CACHE,
    NONE
}
