package com.venue.scout.recommender.service.scoring;

import com.venue.scout.recommender.common.constants.RankingProperties;
import com.venue.scout.recommender.common.constants.ScoutConsts;
import com.venue.scout.recommender.enums.TimeOfDay;
import com.venue.scout.recommender.model.documents.UserProfile;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

import static com.venue.scout.recommender.enums.TimeOfDay.AFTERNOON;
import static com.venue.scout.recommender.enums.TimeOfDay.EVENING;
import static com.venue.scout.recommender.enums.TimeOfDay.MORNING;
import static com.venue.scout.recommender.enums.TimeOfDay.NIGHT;

/**
 * Preferred time-of-day match and category/time affinity.
 */
@Component
public class TimeContextScorer {

    public enum Affinity { PERFECT, GOOD, OTHER }

    private static final Map<String, Map<TimeOfDay, Affinity>> AFFINITY = new HashMap<>();

    static {
        affinity("coffee", MORNING, AFTERNOON);
        affinity("dining", EVENING, AFTERNOON);
        affinity("bars", NIGHT, EVENING);
        affinity("nightlife", NIGHT, EVENING);
        affinity("outdoor", AFTERNOON, MORNING);
        affinity("culture", AFTERNOON, MORNING);
        affinity("arts", AFTERNOON, EVENING);
        affinity("entertainment", EVENING, NIGHT);
        affinity("fitness", MORNING, EVENING);
        affinity("shopping", AFTERNOON, EVENING);
        affinity("wellness", AFTERNOON, MORNING);
        affinity("family", AFTERNOON, MORNING);
        affinity(ScoutConsts.Categories.LIVE_MUSIC, EVENING, NIGHT);
    }

    private static void affinity(String category, TimeOfDay perfect, TimeOfDay good) {
        Map<TimeOfDay, Affinity> m = new EnumMap<>(TimeOfDay.class);
        m.put(perfect, Affinity.PERFECT);
        m.put(good, Affinity.GOOD);
        AFFINITY.put(category, m);
    }

    private final RankingProperties props;

    public TimeContextScorer(RankingProperties props) {
        this.props = props;
    }

    public double score(String category, UserProfile profile, TimeOfDay now) {
        RankingProperties.Time t = props.getTime();
        double score = 0;
        if (profile != null && profile.getPreferredTimes() != null) {
            for (String preferred : profile.getPreferredTimes()) {
                if (preferred != null && preferred.trim().equalsIgnoreCase(now.label())) {
                    score += t.getPreferredMatch();
                    break;
                }
            }
        }
        score += switch (affinity(category, now)) {
            case PERFECT -> t.getPerfectAffinity();
            case GOOD -> t.getGoodAffinity();
            case OTHER -> t.getOtherAffinity();
        };
        return Math.min(score, t.getCap());
    }

    public Affinity affinity(String category, TimeOfDay now) {
        if (category == null) return Affinity.OTHER;
        Map<TimeOfDay, Affinity> m = AFFINITY.get(category.toLowerCase(Locale.ROOT));
        if (m == null) return Affinity.OTHER;
        return m.getOrDefault(now, Affinity.OTHER);
    }
}
