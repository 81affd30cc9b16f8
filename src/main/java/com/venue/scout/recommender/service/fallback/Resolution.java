package com.venue.scout.recommender.service.fallback;

/**
 * Value produced by a fallback chain together with the name of the step that produced it.
 */
public record Resolution<T>(T value, String strategy) {
}
