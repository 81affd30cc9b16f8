package com.venue.scout.recommender.model.candidate;

import java.time.Instant;

/**
 * Start and optional end of a time-bound candidate.
 */
public record EventWindow(Instant start, Instant end) {

    public boolean hasStartedBy(Instant now) {
        return start != null && !now.isBefore(start);
    }

    public boolean hasEndedBy(Instant now) {
        return end != null && !now.isBefore(end);
    }
}
