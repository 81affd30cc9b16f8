package com.venue.scout.recommender.service.source;

import com.venue.scout.recommender.enums.SourceKind;
import com.venue.scout.recommender.model.candidate.GeoPoint;
import com.venue.scout.recommender.model.candidate.UnifiedCandidate;

import java.util.List;

/**
 * One external provider of places or events.
 */
public interface SourceAdapter {

    SourceKind kind();

    /**
     * False when the adapter is switched off or misses a credential. Unavailable adapters are
     * skipped by the aggregator.
     */
    boolean isAvailable();

    /**
     * Candidates around {@code center}. Returns an empty list when nothing matches; throws only for
     * misconfiguration or provider failure. Candidates without coordinates must carry an address.
     */
    List<UnifiedCandidate> search(GeoPoint center, int radiusMeters, List<String> interestHints, int limit);
}
