package com.venue.scout.recommender.enums;

public enum SourceKind {
    PLACES,
    OPENSTREETMAP,
    EVENT_FEED,
    SPONSORED
}
