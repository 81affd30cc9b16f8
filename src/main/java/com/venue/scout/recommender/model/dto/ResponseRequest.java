package com.venue.scout.recommender.model.dto;

/**
 * Optional body of the accept/decline endpoints.
 */
public record ResponseRequest(String reason, String scheduleRef) {
}
