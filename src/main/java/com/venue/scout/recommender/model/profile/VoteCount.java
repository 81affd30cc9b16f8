package com.venue.scout.recommender.model.profile;

public record VoteCount(int up, int down) {

    public static final VoteCount NONE = new VoteCount(0, 0);

    public int total() {
        return up + down;
    }

    public VoteCount plus(VoteCount other) {
        return new VoteCount(up + other.up, down + other.down);
    }
}
