package com.venue.scout.recommender.service.scoring;

import com.venue.scout.recommender.common.constants.RankingProperties;
import com.venue.scout.recommender.enums.TimeOfDay;
import com.venue.scout.recommender.model.candidate.GeoPoint;
import com.venue.scout.recommender.model.candidate.UnifiedCandidate;
import com.venue.scout.recommender.model.documents.UserProfile;
import com.venue.scout.recommender.model.scoring.DataSourceBoosts;
import com.venue.scout.recommender.model.scoring.ScoreBreakdown;
import com.venue.scout.recommender.model.scoring.ScoredCandidate;
import com.venue.scout.recommender.model.scoring.ScoringContext;
import com.venue.scout.recommender.service.source.CategoryMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Sums the score components of a candidate and clamps the total to {@code [0, scoreCeiling]}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CandidateScorer {

    private final RankingProperties props;
    private final CategoryMapper categories;
    private final BaseInterestScorer baseScorer;
    private final LocationScorer locationScorer;
    private final TimeContextScorer timeScorer;
    private final FeedbackScorer feedbackScorer;
    private final EventUrgencyScorer urgencyScorer;
    private final DataSourceBoostScorer boostScorer;
    private final RecencyPenaltyPolicy recencyPolicy;
    private final SponsorshipBoostPolicy sponsorshipPolicy;
    private final ExplanationBuilder explanations;

    /**
     * Scores every candidate and returns them sorted by final score, highest first. Events that
     * have already started or ended are left out.
     */
    public List<ScoredCandidate> scoreAll(List<UnifiedCandidate> candidates, UserProfile profile, ScoringContext ctx) {
        List<ScoredCandidate> out = new ArrayList<>(candidates.size());
        int passed = 0;
        for (UnifiedCandidate c : candidates) {
            if (urgencyScorer.hasPassed(c, ctx.getNow())) {
                passed++;
                continue;
            }
            out.add(score(c, profile, ctx));
        }
        out.sort(ScoredCandidate.BY_SCORE_DESC);
        log.debug("scorer: scored {} candidates, skipped {} passed events", out.size(), passed);
        return out;
    }

    public ScoredCandidate score(UnifiedCandidate c, UserProfile profile, ScoringContext ctx) {
        String category = categories.normalize(c.getCategory());
        ZonedDateTime local = ctx.localNow();
        TimeOfDay tod = TimeOfDay.of(local.toLocalTime());

        GeoPoint where = c.hasCoordinates() ? c.getCoordinates() : null;
        double distance = (where != null && ctx.getUserLocation() != null) ? where.milesTo(ctx.getUserLocation()) : 0;

        DataSourceBoosts boosts = boostScorer.score(c, category, profile, ctx.getSignals(), local.getDayOfWeek(), tod);
        ScoreBreakdown b = ScoreBreakdown.builder()
                .base(baseScorer.score(c, profile, ctx.isDiscoveryMode()))
                .location(locationScorer.score(where, distance, profile, ctx))
                .time(timeScorer.score(category, profile, tod))
                .feedback(feedbackScorer.feedback(c, category, profile, ctx.getFeedback()))
                .collaborative(feedbackScorer.collaborative(c, ctx.getFeedback()))
                .eventUrgency(urgencyScorer.score(c, ctx.getNow()))
                .recencyPenalty(-recencyPolicy.penalty(ctx.getHoursSinceShown().get(c.getId())))
                .declinePenalty(feedbackScorer.declinePenalty(c, category, ctx.getFeedback()))
                .dataSourceBoosts(boosts)
                .build();
        b.setSponsoredBoost(sponsorshipPolicy.boost(c.getSponsorTier(), b.preBoostTotal()));

        double finalScore = round2(clamp(b.total(), 0, props.getScoreCeiling()));
        String explanation = explanations.explain(c, b, distance,
                baseScorer.matchedInterest(c, profile), timeScorer.affinity(category, tod), tod, ctx.getNow());

        return ScoredCandidate.builder()
                .candidate(c)
                .breakdown(b)
                .finalScore(finalScore)
                .category(category)
                .distanceMiles(round2(distance))
                .explanation(explanation)
                .build();
    }

    /** Final score mapped onto [0, 1]. */
    public double confidence(ScoredCandidate sc) {
        double ceiling = props.getScoreCeiling();
        if (ceiling <= 0) return 0;
        return clamp(sc.getFinalScore() / ceiling, 0, 1);
    }

    private static double clamp(double v, double lo, double hi) {
        if (Double.isNaN(v)) return lo;
        return Math.max(lo, Math.min(hi, v));
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
