package com.venue.scout.recommender.model.dto;

import com.venue.scout.recommender.enums.PoolOrigin;

import java.time.Instant;
import java.util.List;

/**
 * Result of one generation cycle. {@code persisted} is false when the ranked list could not be
 * stored; the items are still valid for display.
 */
public record RecommendationBatch(String userId,
                                  List<RecommendationView> items,
                                  PoolOrigin origin,
                                  boolean persisted,
                                  int poolSize,
                                  Instant generatedAt) {

    public static RecommendationBatch empty(String userId, PoolOrigin origin, Instant now) {
        return new RecommendationBatch(userId, List.of(), origin, true, 0, now);
    }

    public boolean isEmpty() {
        return items == null || items.isEmpty();
    }
}
