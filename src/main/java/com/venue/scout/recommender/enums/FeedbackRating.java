package com.venue.scout.recommender.enums;

public enum FeedbackRating {
    UP,
    DOWN
}
