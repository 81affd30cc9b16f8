package com.venue.scout.recommender.enums;

/**
 * Paid placement class of a candidate. Boost ratios per tier live in {@code scout.ranking.sponsorship}.
 */
public enum SponsorTier {
    NONE,
    BOOSTED,
    PREMIUM;

    public boolean isSponsored() {
        return this != NONE;
    }
}
