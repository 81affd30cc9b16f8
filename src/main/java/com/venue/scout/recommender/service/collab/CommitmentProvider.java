package com.venue.scout.recommender.service.collab;

import com.venue.scout.recommender.model.profile.Commitment;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Calendar lookup: the user's commitments starting within {@code horizon} of {@code from}.
 */
public interface CommitmentProvider {

    List<Commitment> upcoming(String userId, Instant from, Duration horizon);
}
