package com.venue.scout.recommender.core;

import java.time.Duration;
import java.util.Optional;

/**
 * Small key-value store with per-entry TTL. Backs the candidate pool cache, the geocode cache
 * and the forced-refresh markers.
 *
 * Contracts:
 *  - All methods are thread-safe.
 *  - TTL of null or non-positive means "no expiry".
 *  - Expired entries are invisible to readers; removal may be lazy.
 */
public interface TtlStateStore {

    void put(String key, String value, Duration ttl);

    Optional<String> get(String key);

    void delete(String key);

    // Atomic "set if absent" with TTL
    boolean setIfAbsent(String key, String value, Duration ttl);
}
