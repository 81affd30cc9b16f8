package com.venue.scout.recommender.service.rules;

import com.venue.scout.recommender.model.scoring.ScoredCandidate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** First occurrence of an id wins. */
@Component
public class IdentityDedupRule implements RankingRule {

    @Override
    public String name() {
        return "identity-dedup";
    }

    @Override
    public List<ScoredCandidate> apply(List<ScoredCandidate> ranked) {
        Set<String> seen = new HashSet<>();
        List<ScoredCandidate> out = new ArrayList<>(ranked.size());
        for (ScoredCandidate sc : ranked) {
            if (seen.add(sc.getId())) out.add(sc);
        }
        return out;
    }
}
