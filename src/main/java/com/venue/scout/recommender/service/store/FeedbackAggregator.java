package com.venue.scout.recommender.service.store;

import com.venue.scout.recommender.enums.FeedbackRating;
import com.venue.scout.recommender.enums.RecommendationStatus;
import com.venue.scout.recommender.model.documents.FeedbackRecord;
import com.venue.scout.recommender.model.documents.RecommendationRecord;
import com.venue.scout.recommender.model.profile.FeedbackSummary;
import com.venue.scout.recommender.model.profile.VoteCount;
import com.venue.scout.recommender.repo.documents.FeedbackRecordRepo;
import com.venue.scout.recommender.repo.documents.RecommendationRecordRepo;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns raw feedback rows and opt-outs into the vote counts the scorer reads.
 */
@Service
@RequiredArgsConstructor
public class FeedbackAggregator {

    private final FeedbackRecordRepo feedbackRepo;
    private final RecommendationRecordRepo recordRepo;

    public FeedbackSummary summarize(String userId, Collection<String> candidateIds) {
        Map<String, VoteCount> own = tally(feedbackRepo.findTop100ByUserIdOrderByCreatedAtDesc(userId));
        Map<String, VoteCount> crowd = candidateIds == null || candidateIds.isEmpty()
                ? Map.of()
                : tally(feedbackRepo.findByCandidateIdInAndUserIdNot(candidateIds, userId));

        Set<String> notInterested = new HashSet<>();
        Map<String, Integer> byCategory = new HashMap<>();
        List<RecommendationRecord> optedOut = recordRepo.findByUserIdAndStatus(userId, RecommendationStatus.NOT_INTERESTED);
        for (RecommendationRecord r : optedOut) {
            notInterested.add(r.getCandidateId());
            if (r.getCategory() != null) byCategory.merge(r.getCategory(), 1, Integer::sum);
        }

        return FeedbackSummary.builder()
                .userVotes(own)
                .crowdVotes(crowd)
                .notInterestedCandidates(notInterested)
                .notInterestedByCategory(byCategory)
                .build();
    }

    static Map<String, VoteCount> tally(List<FeedbackRecord> rows) {
        Map<String, VoteCount> out = new HashMap<>();
        for (FeedbackRecord f : rows) {
            if (f.getCandidateId() == null || f.getRating() == null) continue;
            VoteCount one = f.getRating() == FeedbackRating.UP ? new VoteCount(1, 0) : new VoteCount(0, 1);
            out.merge(f.getCandidateId(), one, VoteCount::plus);
        }
        return out;
    }
}
