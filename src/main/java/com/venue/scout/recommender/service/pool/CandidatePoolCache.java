package com.venue.scout.recommender.service.pool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.venue.scout.recommender.common.constants.AggregationProperties;
import com.venue.scout.recommender.common.constants.ScoutConsts;
import com.venue.scout.recommender.core.TtlStateStore;
import com.venue.scout.recommender.model.candidate.GeoPoint;
import com.venue.scout.recommender.model.candidate.UnifiedCandidate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Aggregated candidate pools per user and location cell, plus the per-user forced refresh marker.
 * Pools are kept for the stale limit; freshness against the tier cadence is decided by the reader.
 */
@Component
@Slf4j
public class CandidatePoolCache {

    /** Cached pool with the instant it was collected. */
    public record CachedPool(Instant collectedAt, List<UnifiedCandidate> candidates) {

        public Duration ageAt(Instant now) {
            return Duration.between(collectedAt, now);
        }
    }

    private static final TypeReference<CachedPool> POOL_TYPE = new TypeReference<>() {
    };

    private final TtlStateStore store;
    private final ObjectMapper mapper;
    private final AggregationProperties props;
    private final Clock clock;

    public CandidatePoolCache(TtlStateStore store, ObjectMapper mapper, AggregationProperties props, Clock clock) {
        this.store = store;
        this.mapper = mapper;
        this.props = props;
        this.clock = clock;
    }

    public Optional<CachedPool> get(String userId, GeoPoint center) {
        Optional<String> raw = store.get(poolKey(userId, center));
        if (raw.isEmpty()) return Optional.empty();
        try {
            return Optional.of(mapper.readValue(raw.get(), POOL_TYPE));
        } catch (JsonProcessingException e) {
            log.warn("pool.get: unreadable cache entry for {}, dropping it: {}", userId, e.getOriginalMessage());
            store.delete(poolKey(userId, center));
            return Optional.empty();
        }
    }

    public void put(String userId, GeoPoint center, List<UnifiedCandidate> candidates) {
        try {
            String json = mapper.writeValueAsString(new CachedPool(clock.instant(), candidates));
            store.put(poolKey(userId, center), json, props.getPoolCacheMaxAge());
        } catch (JsonProcessingException e) {
            log.warn("pool.put: could not serialize pool for {}: {}", userId, e.getOriginalMessage());
        }
    }

    /** Makes the next generation for the user skip the fresh cache. */
    public void forceRefresh(String userId) {
        store.put(ScoutConsts.Keys.FORCE_REFRESH + userId, "1", props.getPoolCacheMaxAge());
    }

    /** Reads and clears the forced refresh marker. */
    public boolean consumeForceRefresh(String userId) {
        String key = ScoutConsts.Keys.FORCE_REFRESH + userId;
        boolean forced = store.get(key).isPresent();
        if (forced) store.delete(key);
        return forced;
    }

    static String poolKey(String userId, GeoPoint center) {
        return ScoutConsts.Keys.POOL + userId + ":" + center.cellKey();
    }
}
