package com.venue.scout.recommender.model.scoring;

import com.venue.scout.recommender.model.candidate.GeoPoint;
import com.venue.scout.recommender.model.profile.Commitment;
import com.venue.scout.recommender.model.profile.FeedbackSummary;
import com.venue.scout.recommender.model.profile.PersonalSignals;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;

/**
 * Everything about "now" that the scorer needs besides the candidate and the profile.
 */
@Value
@Builder
public class ScoringContext {
    Instant now;
    @Builder.Default
    ZoneId zone = ZoneId.of("UTC");
    GeoPoint userLocation;
    GeoPoint home;
    GeoPoint work;
    @Builder.Default
    Map<String, Double> hoursSinceShown = Map.of();
    @Builder.Default
    List<Commitment> commitments = List.of();
    @Builder.Default
    FeedbackSummary feedback = FeedbackSummary.empty();
    @Builder.Default
    PersonalSignals signals = PersonalSignals.empty();
    boolean discoveryMode;

    public ZonedDateTime localNow() {
        return now.atZone(zone);
    }
}
