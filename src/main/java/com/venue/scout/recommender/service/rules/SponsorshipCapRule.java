package com.venue.scout.recommender.service.rules;

import com.venue.scout.recommender.common.constants.RankingProperties;
import com.venue.scout.recommender.model.scoring.ScoredCandidate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * At most {@code maxSponsoredInTopN} sponsored entries in the top-N. The excess keeps its order
 * and moves right behind the top-N, which is refilled with organic entries. With too few organic
 * entries below the top-N only the lowest excess entries that can be replaced move.
 */
@Component
@Slf4j
public class SponsorshipCapRule implements RankingRule {

    private final RankingProperties props;

    public SponsorshipCapRule(RankingProperties props) {
        this.props = props;
    }

    @Override
    public String name() {
        return "sponsorship-cap";
    }

    @Override
    public List<ScoredCandidate> apply(List<ScoredCandidate> ranked) {
        RankingProperties.Sponsorship s = props.getSponsorship();
        List<ScoredCandidate> list = new ArrayList<>(ranked);
        int topN = Math.min(s.getTopN(), list.size());

        List<ScoredCandidate> top = new ArrayList<>(list.subList(0, topN));
        List<ScoredCandidate> rest = new ArrayList<>(list.subList(topN, list.size()));

        List<ScoredCandidate> excess = new ArrayList<>();
        int sponsored = 0;
        for (ScoredCandidate sc : top) {
            if (sc.isSponsored() && ++sponsored > s.getMaxSponsoredInTopN()) excess.add(sc);
        }
        int organic = 0;
        for (ScoredCandidate sc : rest) if (!sc.isSponsored()) organic++;
        // short on organic entries: demote as many of the lowest excess entries as can be replaced
        int demote = Math.min(excess.size(), organic);
        if (demote == 0) return list;
        List<ScoredCandidate> demoted = excess.subList(excess.size() - demote, excess.size());

        List<ScoredCandidate> kept = new ArrayList<>(topN);
        for (ScoredCandidate sc : top) if (!demoted.contains(sc)) kept.add(sc);

        // organic entries from below fill the freed slots; sponsored ones met on the way queue up behind
        List<ScoredCandidate> queued = new ArrayList<>(demoted);
        while (kept.size() < topN && !rest.isEmpty()) {
            ScoredCandidate next = rest.remove(0);
            if (next.isSponsored()) queued.add(next);
            else kept.add(next);
        }

        List<ScoredCandidate> out = new ArrayList<>(list.size());
        out.addAll(kept);
        out.addAll(queued);
        out.addAll(rest);
        log.debug("rules.sponsorship-cap: moved {} of {} excess sponsored out of top {}", demote, excess.size(), topN);
        return out;
    }
}
