package com.venue.scout.recommender.service.scoring;

import com.venue.scout.recommender.common.constants.RankingProperties;
import com.venue.scout.recommender.enums.TimeOfDay;
import com.venue.scout.recommender.model.candidate.UnifiedCandidate;
import com.venue.scout.recommender.model.documents.UserProfile;
import com.venue.scout.recommender.model.profile.PersonalSignals;
import com.venue.scout.recommender.model.profile.SchedulePattern;
import com.venue.scout.recommender.model.scoring.DataSourceBoosts;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;

/**
 * Terms from connected personal data. A missing signal contributes zero.
 */
@Component
public class DataSourceBoostScorer {

    private final RankingProperties props;

    public DataSourceBoostScorer(RankingProperties props) {
        this.props = props;
    }

    public DataSourceBoosts score(UnifiedCandidate c, String category, UserProfile profile,
                                  PersonalSignals signals, DayOfWeek day, TimeOfDay timeOfDay) {
        RankingProperties.Boosts b = props.getBoosts();
        DataSourceBoosts out = DataSourceBoosts.none();

        Integer visits = signals.getVisitCounts().get(c.getId());
        if (visits != null && visits > 0) {
            out.setVisits(visits >= b.getRegularVisits() ? b.getVisitRegular() : b.getVisitOnce());
        }

        Integer stars = signals.getPersonalRatings().get(c.getId());
        if (stars != null) {
            if (stars >= 4) out.setPersonalRating(b.getRatedHigh());
            else if (stars <= 2) out.setPersonalRating(b.getRatedLow());
        }

        if (category != null && signals.getExternalLikedCategories().stream().anyMatch(category::equalsIgnoreCase)) {
            out.setExternalLikes(b.getExternalLike());
        }

        for (SchedulePattern p : signals.getSchedulePatterns()) {
            if (p.matches(day, timeOfDay, category)) {
                out.setSchedulePattern(b.getSchedulePattern());
                break;
            }
        }

        Integer budget = profile == null ? null : profile.getBudgetLevel();
        if (budget != null && c.getPriceLevel() != null) {
            int over = c.getPriceLevel() - budget;
            out.setPriceMatch(over <= 0 ? b.getPriceMatch() : Math.max(b.getPriceFloor(), over * b.getPricePerLevelOver()));
        }
        return out;
    }
}
