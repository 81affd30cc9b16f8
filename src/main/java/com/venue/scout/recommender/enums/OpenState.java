package com.venue.scout.recommender.enums;

public enum OpenState {
    OPEN,
    CLOSED,
    UNKNOWN;

    public static OpenState of(Boolean openNow) {
        if (openNow == null) return UNKNOWN;
        return openNow ? OPEN : CLOSED;
    }
}
