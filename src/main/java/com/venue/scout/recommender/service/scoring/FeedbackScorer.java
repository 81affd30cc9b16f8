package com.venue.scout.recommender.service.scoring;

import com.venue.scout.recommender.common.constants.RankingProperties;
import com.venue.scout.recommender.model.candidate.UnifiedCandidate;
import com.venue.scout.recommender.model.documents.UserProfile;
import com.venue.scout.recommender.model.profile.FeedbackSummary;
import com.venue.scout.recommender.model.profile.VoteCount;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * The user's own preference signals, other users' votes and past "not interested" answers.
 */
@Component
public class FeedbackScorer {

    private final RankingProperties props;

    public FeedbackScorer(RankingProperties props) {
        this.props = props;
    }

    /** Personal feedback in [0, max]; neutral when nothing is known. */
    public double feedback(UnifiedCandidate c, String category, UserProfile profile, FeedbackSummary summary) {
        RankingProperties.Feedback f = props.getFeedback();
        double score = f.getNeutral();
        if (profile != null) {
            if (containsIgnoreCase(profile.getFavoriteCategories(), category)) score += f.getFavoriteCategory();
            if (containsIgnoreCase(profile.getDislikedCategories(), category)) score += f.getDislikedCategory();
            if (profile.getBudgetLevel() != null && c.getPriceLevel() != null
                    && c.getPriceLevel() <= profile.getBudgetLevel()) {
                score += f.getPriceWithinBudget();
            }
        }
        VoteCount own = summary.userVotesFor(c.getId());
        if (own.up() > own.down()) score += f.getCandidateVotes();
        else if (own.down() > own.up()) score -= f.getCandidateVotes();
        return clamp(score, 0, f.getMax());
    }

    /** Other users' votes scaled into [collaborativeMin, collaborativeMax] once enough exist. */
    public double collaborative(UnifiedCandidate c, FeedbackSummary summary) {
        RankingProperties.Feedback f = props.getFeedback();
        VoteCount crowd = summary.crowdVotesFor(c.getId());
        if (crowd.total() < f.getCollaborativeMinVotes()) return 0;
        double ratio = (crowd.up() - crowd.down()) / (double) crowd.total();
        return ratio >= 0 ? ratio * f.getCollaborativeMax() : ratio * Math.abs(f.getCollaborativeMin());
    }

    /** Non-positive penalty for candidates or categories the user already turned down for good. */
    public double declinePenalty(UnifiedCandidate c, String category, FeedbackSummary summary) {
        RankingProperties.Feedback f = props.getFeedback();
        double penalty = 0;
        if (summary.getNotInterestedCandidates().contains(c.getId())) {
            penalty -= f.getNotInterestedCandidatePenalty();
        }
        Integer perCategory = category == null ? null : summary.getNotInterestedByCategory().get(category);
        if (perCategory != null && perCategory >= f.getNotInterestedCategoryThreshold()) {
            penalty -= f.getNotInterestedCategoryPenalty();
        }
        return penalty;
    }

    private static boolean containsIgnoreCase(List<String> list, String value) {
        if (list == null || value == null) return false;
        for (String s : list) {
            if (s != null && s.trim().equalsIgnoreCase(value)) return true;
        }
        return false;
    }

    private static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }
}
