package com.venue.scout.recommender.model.payload;

import com.venue.scout.recommender.enums.SourceKind;

/**
 * Native record shape of one provider. Each variant is turned into a
 * {@link com.venue.scout.recommender.model.candidate.UnifiedCandidate} by its adapter and never
 * travels past the adapter boundary.
 */
public sealed interface SourcePayload
        permits PlacesPayload, OverpassPayload, EventFeedPayload, SponsoredListingPayload {

    SourceKind kind();

    String nativeId();
}
