package com.venue.scout.recommender.model.payload;

import com.venue.scout.recommender.enums.SourceKind;

import java.util.List;

/**
 * One event of an event discovery feed. Venue coordinates arrive as strings.
 */
public record EventFeedPayload(String eventId,
                               String name,
                               String startDateTime,
                               String endDateTime,
                               String venueName,
                               String venueAddress,
                               String venueLatitude,
                               String venueLongitude,
                               String segment,
                               String genre,
                               Double minPrice,
                               List<String> imageUrls) implements SourcePayload {

    @Override
    public SourceKind kind() {
        return SourceKind.EVENT_FEED;
    }

    @Override
    public String nativeId() {
        return eventId;
    }
}
