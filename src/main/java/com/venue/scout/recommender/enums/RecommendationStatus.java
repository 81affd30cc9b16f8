package com.venue.scout.recommender.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a persisted recommendation record.
 */
public enum RecommendationStatus {
    PENDING,
    VIEWED,
    ACCEPTED,
    // may resurface after cooldown
    DECLINED,
    // left only through unblock
    NOT_INTERESTED,
    // may resurface after cooldown
    EXPIRED;

    /** Leaving this state needs an explicit unblock or administrative action. */
    public boolean isTerminal() {
        return this == ACCEPTED || this == NOT_INTERESTED;
    }

    /**
     * Forward transitions reachable through a user response. Moving back to PENDING happens
     * only through resurfacing on save, and NOT_INTERESTED is left only through unblock.
     */
    public boolean canTransitionTo(RecommendationStatus next) {
        return allowedNext().contains(next);
    }

    private Set<RecommendationStatus> allowedNext() {
        return switch (this) {
            case PENDING -> EnumSet.of(VIEWED, ACCEPTED, DECLINED, NOT_INTERESTED, EXPIRED);
            case VIEWED -> EnumSet.of(ACCEPTED, DECLINED, NOT_INTERESTED, EXPIRED);
            case DECLINED, EXPIRED -> EnumSet.of(ACCEPTED, DECLINED, NOT_INTERESTED);
            case ACCEPTED, NOT_INTERESTED -> EnumSet.noneOf(RecommendationStatus.class);
        };
    }
}
