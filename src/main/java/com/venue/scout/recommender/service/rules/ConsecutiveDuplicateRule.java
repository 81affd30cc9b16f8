package com.venue.scout.recommender.service.rules;

import com.venue.scout.recommender.model.scoring.ScoredCandidate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Drops an entry whose id equals the id of the entry kept right before it. */
@Component
public class ConsecutiveDuplicateRule implements RankingRule {

    @Override
    public String name() {
        return "consecutive-duplicate";
    }

    @Override
    public List<ScoredCandidate> apply(List<ScoredCandidate> ranked) {
        List<ScoredCandidate> out = new ArrayList<>(ranked.size());
        String previous = null;
        for (ScoredCandidate sc : ranked) {
            if (!out.isEmpty() && Objects.equals(previous, sc.getId())) continue;
            out.add(sc);
            previous = sc.getId();
        }
        return out;
    }
}
