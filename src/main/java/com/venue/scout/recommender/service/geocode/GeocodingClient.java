package com.venue.scout.recommender.service.geocode;

import com.venue.scout.recommender.model.candidate.GeoPoint;

import java.util.Optional;

/**
 * Resolves a free-text address to coordinates. Empty when the provider knows no match.
 */
public interface GeocodingClient {

    boolean isAvailable();

    Optional<GeoPoint> geocode(String address);
}
