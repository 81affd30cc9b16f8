package com.venue.scout.recommender.service.filter;

import java.util.Set;

/**
 * Request-level narrowing of a candidate pool. Null fields do not filter.
 */
public record FilterCriteria(String category,
                             Double minRating,
                             Boolean openNow,
                             Integer maxPriceLevel,
                             Set<String> excludedIds,
                             boolean infiniteScroll) {

    public FilterCriteria {
        excludedIds = excludedIds == null ? Set.of() : Set.copyOf(excludedIds);
    }

    public static FilterCriteria none() {
        return new FilterCriteria(null, null, null, null, Set.of(), false);
    }
}
