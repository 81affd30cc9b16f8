package com.venue.scout.recommender.model.profile;

import com.venue.scout.recommender.model.candidate.GeoPoint;

import java.time.Instant;

/**
 * An upcoming time-bound obligation of the user (calendar entry) with a known place.
 */
public record Commitment(String title, Instant startsAt, GeoPoint location) {
}
