package com.venue.scout.recommender.model.dto;

import com.venue.scout.recommender.enums.SourceKind;
import com.venue.scout.recommender.enums.SponsorTier;
import com.venue.scout.recommender.model.candidate.EventWindow;
import com.venue.scout.recommender.model.candidate.GeoPoint;
import com.venue.scout.recommender.model.scoring.ScoreBreakdown;
import com.venue.scout.recommender.model.scoring.ScoredCandidate;

import java.util.List;

/**
 * One ranked entry as returned to clients.
 */
public record RecommendationView(String candidateId,
                                 SourceKind source,
                                 String name,
                                 String address,
                                 GeoPoint coordinates,
                                 String category,
                                 Double rating,
                                 Integer ratingCount,
                                 Integer priceLevel,
                                 List<String> photos,
                                 EventWindow eventWindow,
                                 SponsorTier sponsorTier,
                                 double score,
                                 double confidence,
                                 double distanceMiles,
                                 String explanation,
                                 ScoreBreakdown breakdown) {

    public static RecommendationView of(ScoredCandidate sc, double confidence) {
        var c = sc.getCandidate();
        return new RecommendationView(c.getId(), c.getSource(), c.getName(), c.getAddress(), c.getCoordinates(),
                sc.getCategory(), c.getRating(), c.getRatingCount(), c.getPriceLevel(), c.getPhotos(),
                c.getEventWindow(), c.getSponsorTier(), sc.getFinalScore(), confidence, sc.getDistanceMiles(),
                sc.getExplanation(), sc.getBreakdown());
    }
}
