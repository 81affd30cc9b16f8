package com.venue.scout.recommender.model.payload;

import com.venue.scout.recommender.enums.SourceKind;
import com.venue.scout.recommender.enums.SponsorTier;

import java.time.Instant;
import java.util.List;

/**
 * A paid listing stored locally, already geo-filtered by the database.
 */
public record SponsoredListingPayload(String listingId,
                                      String name,
                                      String address,
                                      double lat,
                                      double lng,
                                      String category,
                                      Double rating,
                                      Integer ratingCount,
                                      Integer priceLevel,
                                      SponsorTier tier,
                                      Instant campaignEndsAt,
                                      List<String> photos) implements SourcePayload {

    @Override
    public SourceKind kind() {
        return SourceKind.SPONSORED;
    }

    @Override
    public String nativeId() {
        return listingId;
    }
}
