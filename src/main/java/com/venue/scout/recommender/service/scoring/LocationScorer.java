package com.venue.scout.recommender.service.scoring;

import com.venue.scout.recommender.common.constants.RankingProperties;
import com.venue.scout.recommender.model.candidate.GeoPoint;
import com.venue.scout.recommender.model.documents.UserProfile;
import com.venue.scout.recommender.model.profile.Commitment;
import com.venue.scout.recommender.model.scoring.ScoringContext;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Distance banding, home/work proximity and nearby upcoming commitments.
 */
@Component
public class LocationScorer {

    private final RankingProperties props;

    public LocationScorer(RankingProperties props) {
        this.props = props;
    }

    public double score(GeoPoint where, double distanceMiles, UserProfile profile, ScoringContext ctx) {
        RankingProperties.Location l = props.getLocation();
        double max = profile != null && profile.getMaxDistanceMiles() != null && profile.getMaxDistanceMiles() > 0
                ? profile.getMaxDistanceMiles() : l.getDefaultMaxMiles();

        double score = distanceBand(distanceMiles, max);
        if (where != null) {
            if (ctx.getHome() != null && where.milesTo(ctx.getHome()) <= l.getAnchorRadiusMiles()) score += l.getAnchorBonus();
            if (ctx.getWork() != null && where.milesTo(ctx.getWork()) <= l.getAnchorRadiusMiles()) score += l.getAnchorBonus();
            score += commitmentBonus(where, ctx);
        }
        return Math.min(score, l.getCap());
    }

    double distanceBand(double d, double maxMiles) {
        RankingProperties.Location l = props.getLocation();
        if (d <= l.getVeryCloseMiles()) return l.getVeryCloseScore();
        if (d <= l.getWalkingMiles()) return l.getWalkingScore();
        if (d <= maxMiles) return 10 + 5 * (1 - d / maxMiles);
        return Math.max(0, 10 - (d - maxMiles) * l.getBeyondSlope());
    }

    /** Best bonus over commitments in the next 24h whose place is close to the candidate. */
    double commitmentBonus(GeoPoint where, ScoringContext ctx) {
        RankingProperties.Location l = props.getLocation();
        double best = 0;
        for (Commitment c : ctx.getCommitments()) {
            if (c.startsAt() == null || c.location() == null || c.startsAt().isBefore(ctx.getNow())) continue;
            if (where.milesTo(c.location()) > l.getCommitmentRadiusMiles()) continue;
            long minutes = Duration.between(ctx.getNow(), c.startsAt()).toMinutes();
            double bonus;
            if (minutes <= 120) bonus = l.getCommitmentWithin2h();
            else if (minutes <= 360) bonus = l.getCommitmentWithin6h();
            else if (minutes <= 1440) bonus = l.getCommitmentWithin24h();
            else bonus = 0;
            best = Math.max(best, bonus);
        }
        return best;
    }
}
