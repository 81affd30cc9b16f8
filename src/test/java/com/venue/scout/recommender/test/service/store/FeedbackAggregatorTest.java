package com.venue.scout.recommender.test.service.store;

import com.venue.scout.recommender.enums.FeedbackRating;
import com.venue.scout.recommender.enums.RecommendationStatus;
import com.venue.scout.recommender.model.documents.FeedbackRecord;
import com.venue.scout.recommender.model.documents.RecommendationRecord;
import com.venue.scout.recommender.model.profile.FeedbackSummary;
import com.venue.scout.recommender.model.profile.VoteCount;
import com.venue.scout.recommender.repo.documents.FeedbackRecordRepo;
import com.venue.scout.recommender.repo.documents.RecommendationRecordRepo;
import com.venue.scout.recommender.service.store.FeedbackAggregator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FeedbackAggregatorTest {

    @Mock
    FeedbackRecordRepo feedbackRepo;
    @Mock
    RecommendationRecordRepo recordRepo;

    @InjectMocks
    FeedbackAggregator aggregator;

    private static FeedbackRecord vote(String userId, String candidateId, FeedbackRating rating) {
        return FeedbackRecord.builder().userId(userId).candidateId(candidateId).rating(rating).build();
    }

    @Test
    void ownAndCrowdVotesAreTalliedSeparately() {
        when(feedbackRepo.findTop100ByUserIdOrderByCreatedAtDesc("u1")).thenReturn(List.of(
                vote("u1", "gp-1", FeedbackRating.UP),
                vote("u1", "gp-1", FeedbackRating.DOWN),
                vote("u1", "gp-2", null)));
        when(feedbackRepo.findByCandidateIdInAndUserIdNot(List.of("gp-1", "gp-3"), "u1")).thenReturn(List.of(
                vote("u2", "gp-3", FeedbackRating.UP),
                vote("u3", "gp-3", FeedbackRating.UP)));
        when(recordRepo.findByUserIdAndStatus("u1", RecommendationStatus.NOT_INTERESTED)).thenReturn(List.of(
                RecommendationRecord.builder().candidateId("gp-7").category("bars").build(),
                RecommendationRecord.builder().candidateId("gp-8").category("bars").build()));

        FeedbackSummary s = aggregator.summarize("u1", List.of("gp-1", "gp-3"));

        assertThat(s.userVotesFor("gp-1")).isEqualTo(new VoteCount(1, 1));
        assertThat(s.userVotesFor("gp-2")).isEqualTo(VoteCount.NONE);
        assertThat(s.crowdVotesFor("gp-3")).isEqualTo(new VoteCount(2, 0));
        assertThat(s.getNotInterestedCandidates()).containsExactlyInAnyOrder("gp-7", "gp-8");
        assertThat(s.getNotInterestedByCategory()).containsEntry("bars", 2);
    }

    @Test
    void noCandidatesSkipsCrowdLookup() {
        when(feedbackRepo.findTop100ByUserIdOrderByCreatedAtDesc("u1")).thenReturn(List.of());
        when(recordRepo.findByUserIdAndStatus("u1", RecommendationStatus.NOT_INTERESTED)).thenReturn(List.of());

        FeedbackSummary s = aggregator.summarize("u1", List.of());

        assertThat(s.getCrowdVotes()).isEmpty();
        verify(feedbackRepo, never()).findByCandidateIdInAndUserIdNot(any(), any());
    }
}
