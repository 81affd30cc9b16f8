package com.venue.scout.recommender.service.scoring;

import com.venue.scout.recommender.common.constants.RankingProperties;
import com.venue.scout.recommender.enums.SponsorTier;
import org.springframework.stereotype.Component;

/**
 * Boost of sponsored candidates, proportional to relevance. Low relevance caps the boost so paid
 * placement alone cannot lift an unrelated candidate.
 */
@Component
public class SponsorshipBoostPolicy {

    private final RankingProperties props;

    public SponsorshipBoostPolicy(RankingProperties props) {
        this.props = props;
    }

    public double boost(SponsorTier tier, double preBoostTotal) {
        if (tier == null || !tier.isSponsored() || preBoostTotal <= 0) return 0;
        RankingProperties.Sponsorship s = props.getSponsorship();
        double ratio = tier == SponsorTier.PREMIUM ? s.getPremiumRatio() : s.getBoostedRatio();
        double boost = preBoostTotal * ratio;
        if (preBoostTotal < s.getLowRelevanceThreshold()) boost = Math.min(boost, s.getLowRelevanceCap());
        return boost;
    }
}
