package com.venue.scout.recommender.service.collab;

import com.venue.scout.recommender.model.documents.RecommendationRecord;

import java.util.Optional;

/**
 * Hands an accepted recommendation to downstream scheduling. Returns the reference of the
 * scheduling entity when one is known synchronously.
 */
public interface ScheduleLinker {

    Optional<String> link(RecommendationRecord accepted);
}
