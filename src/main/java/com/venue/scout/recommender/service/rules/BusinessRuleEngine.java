package com.venue.scout.recommender.service.rules;

import com.venue.scout.recommender.model.scoring.ScoredCandidate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the ranking rules over a scored list in their fixed order and truncates the result.
 */
@Service
@Slf4j
public class BusinessRuleEngine {

    private final List<RankingRule> rules;

    public BusinessRuleEngine(IdentityDedupRule identityDedup,
                              EventDedupRule eventDedup,
                              ConsecutiveDuplicateRule consecutiveDuplicates,
                              CategoryDiversityRule diversity,
                              EventBalanceRule eventBalance,
                              SponsorshipCapRule sponsorshipCap) {
        // diversity runs again last to restore categories the two caps moved out of the top-N
        this.rules = List.of(identityDedup, eventDedup, consecutiveDuplicates, diversity, eventBalance, sponsorshipCap,
                diversity);
    }

    public List<ScoredCandidate> apply(List<ScoredCandidate> scored, int resultCount) {
        return apply(scored, resultCount, ZoneOffset.UTC);
    }

    /** Event dates are compared as calendar days in {@code zone}. */
    public List<ScoredCandidate> apply(List<ScoredCandidate> scored, int resultCount, ZoneId zone) {
        if (scored == null || scored.isEmpty() || resultCount <= 0) return List.of();

        List<ScoredCandidate> list = new ArrayList<>(scored);
        list.sort(ScoredCandidate.BY_SCORE_DESC);
        for (RankingRule rule : rules) {
            int before = list.size();
            list = rule.apply(list, zone);
            if (list.size() != before) log.debug("rules.{}: {} -> {}", rule.name(), before, list.size());
        }
        return list.size() > resultCount ? new ArrayList<>(list.subList(0, resultCount)) : list;
    }

    public List<String> ruleNames() {
        List<String> names = new ArrayList<>(rules.size());
        for (RankingRule r : rules) names.add(r.name());
        return names;
    }
}
