package com.venue.scout.recommender.service.scoring;

import com.venue.scout.recommender.common.constants.RankingProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Step function of hours since a candidate was last shown. Returns the magnitude; callers store
 * it as a negative score term.
 */
@Component
public class RecencyPenaltyPolicy {

    private final List<RankingProperties.RecencyBand> bands;

    public RecencyPenaltyPolicy(RankingProperties props) {
        List<RankingProperties.RecencyBand> sorted = new ArrayList<>(props.getRecencyBands());
        sorted.sort(Comparator.comparingDouble(RankingProperties.RecencyBand::getHours));
        // a later band may never be steeper than an earlier one
        double ceiling = Double.MAX_VALUE;
        List<RankingProperties.RecencyBand> monotone = new ArrayList<>(sorted.size());
        for (RankingProperties.RecencyBand b : sorted) {
            ceiling = Math.min(ceiling, Math.max(0, b.getPenalty()));
            monotone.add(new RankingProperties.RecencyBand(b.getHours(), ceiling));
        }
        this.bands = List.copyOf(monotone);
    }

    public double penalty(Double hoursSinceShown) {
        if (hoursSinceShown == null || hoursSinceShown < 0) return 0;
        for (RankingProperties.RecencyBand b : bands) {
            if (hoursSinceShown < b.getHours()) return b.getPenalty();
        }
        return 0;
    }
}
