package com.venue.scout.recommender.service.rules;

import com.venue.scout.recommender.model.scoring.ScoredCandidate;

import java.time.ZoneId;
import java.util.List;

/**
 * One deterministic transformation of a ranked list. Implementations never mutate their input.
 */
public interface RankingRule {

    String name();

    List<ScoredCandidate> apply(List<ScoredCandidate> ranked);

    /** Variant for rules that depend on the user's calendar; most rules ignore the zone. */
    default List<ScoredCandidate> apply(List<ScoredCandidate> ranked, ZoneId zone) {
        return apply(ranked);
    }
}
