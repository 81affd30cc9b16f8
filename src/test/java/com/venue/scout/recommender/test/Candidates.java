package com.venue.scout.recommender.test;

import com.venue.scout.recommender.enums.SourceKind;
import com.venue.scout.recommender.enums.SponsorTier;
import com.venue.scout.recommender.model.candidate.EventWindow;
import com.venue.scout.recommender.model.candidate.GeoPoint;
import com.venue.scout.recommender.model.candidate.UnifiedCandidate;
import com.venue.scout.recommender.model.scoring.ScoreBreakdown;
import com.venue.scout.recommender.model.scoring.ScoredCandidate;

import java.time.Instant;
import java.util.List;

/**
 * Builders for candidates used across tests.
 */
public final class Candidates {

    public static final GeoPoint CENTER = new GeoPoint(40.7128, -74.0060);

    private Candidates() {
    }

    public static UnifiedCandidate place(String id, String category) {
        return UnifiedCandidate.builder()
                .id(id)
                .source(SourceKind.PLACES)
                .name("Place " + id)
                .coordinates(CENTER)
                .category(category)
                .categoryTags(List.of(category))
                .build();
    }

    public static UnifiedCandidate event(String id, String name, Instant start) {
        return UnifiedCandidate.builder()
                .id(id)
                .source(SourceKind.EVENT_FEED)
                .name(name)
                .coordinates(CENTER)
                .category("live music")
                .eventWindow(new EventWindow(start, null))
                .build();
    }

    public static ScoredCandidate scored(UnifiedCandidate c, double score) {
        return ScoredCandidate.builder()
                .candidate(c)
                .breakdown(new ScoreBreakdown())
                .finalScore(score)
                .category(c.getCategory())
                .explanation("Recommended for you")
                .build();
    }

    public static ScoredCandidate scoredPlace(String id, String category, double score) {
        return scored(place(id, category), score);
    }

    public static ScoredCandidate scoredEvent(String id, String name, Instant start, double score) {
        return scored(event(id, name, start), score);
    }

    public static ScoredCandidate scoredEventIn(String id, String category, Instant start, double score) {
        return scored(event(id, "Show " + id, start).toBuilder().category(category).build(), score);
    }

    public static ScoredCandidate scoredSponsored(String id, String category, double score) {
        return scored(place(id, category).toBuilder().source(SourceKind.SPONSORED).sponsorTier(SponsorTier.BOOSTED).build(), score);
    }
}
