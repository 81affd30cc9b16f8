package com.venue.scout.recommender.service.aggregation;

import com.venue.scout.recommender.model.candidate.GeoPoint;

import java.util.List;

/**
 * Geo query handed to every adapter. {@code interestHints} carries the category filter first and
 * then the user's interests, strongest first.
 */
public record AggregationQuery(GeoPoint center, int radiusMeters, List<String> interestHints, int perAdapterLimit) {

    public AggregationQuery {
        interestHints = interestHints == null ? List.of() : List.copyOf(interestHints);
    }

    public AggregationQuery withRadius(int radius) {
        return new AggregationQuery(center, radius, interestHints, perAdapterLimit);
    }
}
