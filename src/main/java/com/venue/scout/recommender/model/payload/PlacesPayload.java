package com.venue.scout.recommender.model.payload;

import com.venue.scout.recommender.enums.SourceKind;

import java.util.List;

/**
 * One entry of a Places nearby-search response.
 */
public record PlacesPayload(String placeId,
                            String name,
                            String vicinity,
                            Double lat,
                            Double lng,
                            List<String> types,
                            Double rating,
                            Integer userRatingsTotal,
                            Integer priceLevel,
                            List<String> photoReferences,
                            Boolean openNow) implements SourcePayload {

    @Override
    public SourceKind kind() {
        return SourceKind.PLACES;
    }

    @Override
    public String nativeId() {
        return placeId;
    }
}
