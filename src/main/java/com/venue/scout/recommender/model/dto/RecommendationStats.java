package com.venue.scout.recommender.model.dto;

public record RecommendationStats(long total,
                                  long pending,
                                  long viewed,
                                  long accepted,
                                  long declined,
                                  long notInterested,
                                  long expired,
                                  double acceptanceRate) {
}
