package com.venue.scout.recommender.model.profile;

import lombok.Builder;
import lombok.Value;

import java.util.Map;
import java.util.Set;

/**
 * Aggregated feedback counts consumed by the scorer.
 */
@Value
@Builder
public class FeedbackSummary {
    @Builder.Default
    Map<String, VoteCount> userVotes = Map.of();              // this user, per candidate
    @Builder.Default
    Map<String, VoteCount> crowdVotes = Map.of();             // other users, per candidate
    @Builder.Default
    Set<String> notInterestedCandidates = Set.of();
    @Builder.Default
    Map<String, Integer> notInterestedByCategory = Map.of();

    public static FeedbackSummary empty() {
        return FeedbackSummary.builder().build();
    }

    public VoteCount userVotesFor(String candidateId) {
        return userVotes.getOrDefault(candidateId, VoteCount.NONE);
    }

    public VoteCount crowdVotesFor(String candidateId) {
        return crowdVotes.getOrDefault(candidateId, VoteCount.NONE);
    }
}
