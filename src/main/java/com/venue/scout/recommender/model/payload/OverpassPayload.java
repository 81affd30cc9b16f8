package com.venue.scout.recommender.model.payload;

import com.venue.scout.recommender.enums.SourceKind;

import java.util.Map;

/**
 * One OpenStreetMap node returned by the Overpass interpreter.
 */
public record OverpassPayload(long id, Double lat, Double lon, Map<String, String> tags) implements SourcePayload {

    @Override
    public SourceKind kind() {
        return SourceKind.OPENSTREETMAP;
    }

    @Override
    public String nativeId() {
        return String.valueOf(id);
    }

    public String tag(String key) {
        return tags == null ? null : tags.get(key);
    }
}
