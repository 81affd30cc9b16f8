package com.venue.scout.recommender.service.scoring;

import com.venue.scout.recommender.common.constants.RankingProperties;
import com.venue.scout.recommender.model.candidate.UnifiedCandidate;
import com.venue.scout.recommender.model.documents.UserProfile;
import com.venue.scout.recommender.service.source.CategoryMapper;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Interest match tier plus rating and popularity bonuses.
 */
@Component
public class BaseInterestScorer {

    public enum Match { TOP, LISTED, NONE }

    private final RankingProperties props;
    private final CategoryMapper categories;

    public BaseInterestScorer(RankingProperties props, CategoryMapper categories) {
        this.props = props;
        this.categories = categories;
    }

    public double score(UnifiedCandidate c, UserProfile profile, boolean discoveryMode) {
        RankingProperties.Base b = props.getBase();
        double score = switch (match(c, profile)) {
            case TOP -> b.getTopInterest();
            case LISTED -> b.getListedInterest();
            case NONE -> discoveryMode ? b.getNoMatchDiscovery() : b.getNoMatch();
        };
        score += ratingBonus(c.getRating());
        score += popularityBonus(c.getRatingCount());
        return Math.min(score, b.getCap());
    }

    public Match match(UnifiedCandidate c, UserProfile profile) {
        if (profile == null) return Match.NONE;
        if (matchesAny(c, profile.topInterests())) return Match.TOP;
        if (matchesAny(c, profile.getInterests())) return Match.LISTED;
        return Match.NONE;
    }

    /** The profile interest the candidate matched, for explanations. */
    public String matchedInterest(UnifiedCandidate c, UserProfile profile) {
        if (profile == null) return null;
        for (List<String> list : List.of(profile.topInterests(), profile.getInterests())) {
            if (list == null) continue;
            for (String interest : list) {
                if (matches(c, interest)) return interest;
            }
        }
        return null;
    }

    double ratingBonus(Double rating) {
        if (rating == null) return 0;
        RankingProperties.Base b = props.getBase();
        if (rating >= b.getRatingExcellent()) return b.getRatingExcellentBonus();
        if (rating >= b.getRatingGreat()) return b.getRatingGreatBonus();
        if (rating >= b.getRatingGood()) return b.getRatingGoodBonus();
        return 0;
    }

    double popularityBonus(Integer reviews) {
        if (reviews == null) return 0;
        RankingProperties.Base b = props.getBase();
        if (reviews >= b.getReviewsMany()) return b.getReviewsManyBonus();
        if (reviews >= b.getReviewsSome()) return b.getReviewsSomeBonus();
        if (reviews >= b.getReviewsFew()) return b.getReviewsFewBonus();
        return 0;
    }

    private boolean matchesAny(UnifiedCandidate c, List<String> interests) {
        if (interests == null) return false;
        for (String interest : interests) {
            if (matches(c, interest)) return true;
        }
        return false;
    }

    private boolean matches(UnifiedCandidate c, String interest) {
        String wanted = categories.normalize(interest);
        if (wanted.equals(categories.normalize(c.getCategory()))) return true;
        if (c.getCategoryTags() == null) return false;
        for (String tag : c.getCategoryTags()) {
            if (wanted.equals(categories.normalize(tag))) return true;
        }
        return false;
    }
}
