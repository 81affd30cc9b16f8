package com.venue.scout.recommender.service.scoring;

import com.venue.scout.recommender.common.constants.RankingProperties;
import com.venue.scout.recommender.model.candidate.UnifiedCandidate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Bonus for time-bound candidates that shrinks as the start moves away. Events already under way
 * or over get a large negative value.
 */
@Component
public class EventUrgencyScorer {

    private final RankingProperties props;

    public EventUrgencyScorer(RankingProperties props) {
        this.props = props;
    }

    public double score(UnifiedCandidate c, Instant now) {
        if (!c.isTimeBound()) return 0;
        RankingProperties.Urgency u = props.getUrgency();
        if (hasPassed(c, now)) return u.getPassedPenalty();

        long hours = Duration.between(now, c.getEventWindow().start()).toHours();
        if (hours <= 6) return u.getWithin6h();
        if (hours <= 24) return u.getWithin24h();
        if (hours <= 72) return u.getWithin72h();
        if (hours <= 24 * 7) return u.getWithin7d();
        return u.getLater();
    }

    /** True for time-bound candidates that are under way or over at {@code now}. */
    public boolean hasPassed(UnifiedCandidate c, Instant now) {
        if (!c.isTimeBound()) return false;
        return c.getEventWindow().hasStartedBy(now) || c.getEventWindow().hasEndedBy(now);
    }
}
