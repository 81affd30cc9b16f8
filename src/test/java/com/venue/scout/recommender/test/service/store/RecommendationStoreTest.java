package com.venue.scout.recommender.test.service.store;

import com.venue.scout.recommender.bus.EventPublisher;
import com.venue.scout.recommender.common.Result;
import com.venue.scout.recommender.common.constants.CooldownProperties;
import com.venue.scout.recommender.common.exception.PersistenceException;
import com.venue.scout.recommender.enums.RecommendationStatus;
import com.venue.scout.recommender.model.documents.BlockedCandidate;
import com.venue.scout.recommender.model.documents.RecommendationRecord;
import com.venue.scout.recommender.model.dto.RecommendationStats;
import com.venue.scout.recommender.model.scoring.ScoredCandidate;
import com.venue.scout.recommender.repo.documents.BlockedCandidateRepo;
import com.venue.scout.recommender.repo.documents.RecommendationRecordRepo;
import com.venue.scout.recommender.service.collab.ScheduleLinker;
import com.venue.scout.recommender.service.cooldown.CooldownPolicy;
import com.venue.scout.recommender.service.pool.CandidatePoolCache;
import com.venue.scout.recommender.service.store.RecommendationStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static com.venue.scout.recommender.test.Candidates.scoredPlace;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RecommendationStoreTest {

    private static final Instant NOW = Instant.parse("2026-10-16T12:00:00Z");

    @Mock
    RecommendationRecordRepo recordRepo;
    @Mock
    BlockedCandidateRepo blockedRepo;
    @Mock
    ScheduleLinker scheduleLinker;
    @Mock
    CandidatePoolCache poolCache;
    @Mock
    EventPublisher events;

    RecommendationStore store;

    @BeforeEach
    void setUp() {
        CooldownProperties cooldown = new CooldownProperties();
        store = new RecommendationStore(recordRepo, blockedRepo, new CooldownPolicy(cooldown), cooldown,
                scheduleLinker, poolCache, events, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static RecommendationRecord existing(String candidateId, RecommendationStatus status, Duration shownAgo) {
        return RecommendationRecord.builder()
                .id("rec-" + candidateId)
                .userId("u1")
                .candidateId(candidateId)
                .status(status)
                .createdAt(NOW.minus(shownAgo))
                .lastShownAt(NOW.minus(shownAgo))
                .expiresAt(NOW.minus(shownAgo).plus(Duration.ofDays(7)))
                .confidenceScore(0.5)
                .build();
    }

    private void saveReturnsArgument() {
        when(recordRepo.save(any(RecommendationRecord.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void saveCreatesPendingRecordForNewCandidate() {
        when(recordRepo.findByUserIdAndCandidateId("u1", "gp-1")).thenReturn(Optional.empty());
        saveReturnsArgument();

        List<RecommendationRecord> saved = store.save("u1", List.of(scoredPlace("gp-1", "coffee", 90)), sc -> 0.6);

        assertThat(saved).hasSize(1);
        RecommendationRecord r = saved.get(0);
        assertThat(r.getStatus()).isEqualTo(RecommendationStatus.PENDING);
        assertThat(r.getCreatedAt()).isEqualTo(NOW);
        assertThat(r.getLastShownAt()).isEqualTo(NOW);
        assertThat(r.getExpiresAt()).isEqualTo(NOW.plus(Duration.ofDays(7)));
        assertThat(r.getConfidenceScore()).isEqualTo(0.6);
        assertThat(r.getCategory()).isEqualTo("coffee");
    }

    @Test
    void saveNeverRevivesTerminalRecords() {
        when(recordRepo.findByUserIdAndCandidateId("u1", "gp-1"))
                .thenReturn(Optional.of(existing("gp-1", RecommendationStatus.NOT_INTERESTED, Duration.ofDays(60))));
        when(recordRepo.findByUserIdAndCandidateId("u1", "gp-2"))
                .thenReturn(Optional.of(existing("gp-2", RecommendationStatus.ACCEPTED, Duration.ofDays(60))));

        List<RecommendationRecord> saved = store.save("u1",
                List.of(scoredPlace("gp-1", "coffee", 90), scoredPlace("gp-2", "dining", 80)), sc -> 0.5);

        assertThat(saved).isEmpty();
        verify(recordRepo, never()).save(any());
    }

    @Test
    void declinedRecordWithinCooldownKeepsStatusAndShownClock() {
        RecommendationRecord declined = existing("gp-1", RecommendationStatus.DECLINED, Duration.ofDays(1));
        Instant shownAt = declined.getLastShownAt();
        when(recordRepo.findByUserIdAndCandidateId("u1", "gp-1")).thenReturn(Optional.of(declined));
        saveReturnsArgument();

        RecommendationRecord r = store.save("u1", List.of(scoredPlace("gp-1", "coffee", 90)), sc -> 0.7).get(0);

        assertThat(r.getStatus()).isEqualTo(RecommendationStatus.DECLINED);
        assertThat(r.getLastShownAt()).isEqualTo(shownAt);
        assertThat(r.getCreatedAt()).isEqualTo(NOW);
        assertThat(r.getConfidenceScore()).isEqualTo(0.7);
    }

    @Test
    void declinedRecordPastCooldownResurfacesAsPending() {
        RecommendationRecord declined = existing("gp-1", RecommendationStatus.DECLINED, Duration.ofDays(4));
        declined.setDeclineReason("too far");
        when(recordRepo.findByUserIdAndCandidateId("u1", "gp-1")).thenReturn(Optional.of(declined));
        saveReturnsArgument();

        RecommendationRecord r = store.save("u1", List.of(scoredPlace("gp-1", "coffee", 90)), sc -> 0.7).get(0);

        assertThat(r.getStatus()).isEqualTo(RecommendationStatus.PENDING);
        assertThat(r.getLastShownAt()).isEqualTo(NOW);
        assertThat(r.getResurfacedCount()).isEqualTo(1);
        assertThat(r.getDeclineReason()).isNull();
    }

    @Test
    void databaseFailureSurfacesAsPersistenceException() {
        when(recordRepo.findByUserIdAndCandidateId(anyString(), anyString()))
                .thenThrow(new DataAccessResourceFailureException("mongo down"));

        List<ScoredCandidate> ranked = List.of(scoredPlace("gp-1", "coffee", 90));
        assertThatThrownBy(() -> store.save("u1", ranked, sc -> 0.5))
                .isInstanceOf(PersistenceException.class)
                .hasCauseInstanceOf(DataAccessResourceFailureException.class);
    }

    @Test
    void loadReturnsLoadableRecordsByConfidence() {
        RecommendationRecord low = existing("gp-1", RecommendationStatus.PENDING, Duration.ofHours(1));
        low.setConfidenceScore(0.3);
        RecommendationRecord high = existing("gp-2", RecommendationStatus.PENDING, Duration.ofHours(2));
        high.setConfidenceScore(0.9);
        RecommendationRecord cooling = existing("gp-3", RecommendationStatus.DECLINED, Duration.ofHours(3));
        cooling.setConfidenceScore(0.95);
        when(recordRepo.findLoadCandidates(eq("u1"), eq(NOW), eq(NOW.minus(Duration.ofHours(24)))))
                .thenReturn(List.of(low, high, cooling));

        Result<List<RecommendationRecord>> r = store.load("u1");

        assertThat(r.isOk()).isTrue();
        assertThat(r.get()).extracting(RecommendationRecord::getCandidateId).containsExactly("gp-2", "gp-1");
    }

    @Test
    void loadRejectsBlankUser() {
        assertThat(store.load(" ").getErrorCode()).isEqualTo("BAD_REQUEST");
        verifyNoInteractions(recordRepo);
    }

    @Test
    void acceptLinksScheduleEntry() {
        RecommendationRecord pending = existing("gp-1", RecommendationStatus.PENDING, Duration.ofHours(1));
        when(recordRepo.findById("rec-gp-1")).thenReturn(Optional.of(pending));
        saveReturnsArgument();
        when(scheduleLinker.link(any())).thenReturn(Optional.of("sched-42"));

        Result<RecommendationRecord> r = store.markAccepted("rec-gp-1", null);

        assertThat(r.isOk()).isTrue();
        assertThat(r.get().getStatus()).isEqualTo(RecommendationStatus.ACCEPTED);
        assertThat(r.get().getRespondedAt()).isEqualTo(NOW);
        assertThat(r.get().getScheduleRef()).isEqualTo("sched-42");
        verify(events).publishEvent(anyString(), eq("u1"), eq("recommendation.accepted"), any());
    }

    @Test
    void acceptSurvivesScheduleLinkFailure() {
        when(recordRepo.findById("rec-gp-1"))
                .thenReturn(Optional.of(existing("gp-1", RecommendationStatus.VIEWED, Duration.ofHours(1))));
        saveReturnsArgument();
        when(scheduleLinker.link(any())).thenThrow(new IllegalStateException("calendar offline"));

        Result<RecommendationRecord> r = store.markAccepted("rec-gp-1", "manual-1");

        assertThat(r.isOk()).isTrue();
        assertThat(r.get().getScheduleRef()).isEqualTo("manual-1");
    }

    @Test
    void declineOfUnknownOrTerminalRecordFails() {
        when(recordRepo.findById("missing")).thenReturn(Optional.empty());
        when(recordRepo.findById("rec-gp-1"))
                .thenReturn(Optional.of(existing("gp-1", RecommendationStatus.ACCEPTED, Duration.ofHours(1))));

        assertThat(store.markDeclined("missing", null).getErrorCode()).isEqualTo("NOT_FOUND");
        assertThat(store.markDeclined("rec-gp-1", null).getErrorCode()).isEqualTo("INVALID_STATE");
        verify(recordRepo, never()).save(any());
    }

    @Test
    void declineUsesDefaultReason() {
        when(recordRepo.findById("rec-gp-1"))
                .thenReturn(Optional.of(existing("gp-1", RecommendationStatus.PENDING, Duration.ofHours(1))));
        saveReturnsArgument();

        RecommendationRecord r = store.markDeclined("rec-gp-1", "  ").get();

        assertThat(r.getStatus()).isEqualTo(RecommendationStatus.DECLINED);
        assertThat(r.getDeclineReason()).isEqualTo("declined");
    }

    @Test
    void viewedOnlyMovesPendingRecords() {
        RecommendationRecord declined = existing("gp-1", RecommendationStatus.DECLINED, Duration.ofHours(1));
        when(recordRepo.findById("rec-gp-1")).thenReturn(Optional.of(declined));

        Result<RecommendationRecord> r = store.markViewed("rec-gp-1");

        assertThat(r.isOk()).isTrue();
        assertThat(r.get().getStatus()).isEqualTo(RecommendationStatus.DECLINED);
        verify(recordRepo, never()).save(any());
    }

    @Test
    void notInterestedAlsoBlocksTheCandidate() {
        RecommendationRecord pending = existing("gp-1", RecommendationStatus.PENDING, Duration.ofHours(1));
        pending.setCandidateName("Blue Bottle");
        when(recordRepo.findById("rec-gp-1")).thenReturn(Optional.of(pending));
        saveReturnsArgument();
        when(blockedRepo.existsByUserIdAndCandidateId("u1", "gp-1")).thenReturn(false);
        when(blockedRepo.insert(any(BlockedCandidate.class))).thenAnswer(inv -> inv.getArgument(0));

        RecommendationRecord r = store.markNotInterested("rec-gp-1", null).get();

        assertThat(r.getStatus()).isEqualTo(RecommendationStatus.NOT_INTERESTED);
        ArgumentCaptor<BlockedCandidate> block = ArgumentCaptor.forClass(BlockedCandidate.class);
        verify(blockedRepo).insert(block.capture());
        assertThat(block.getValue().getCandidateId()).isEqualTo("gp-1");
        assertThat(block.getValue().getCandidateName()).isEqualTo("Blue Bottle");
        assertThat(block.getValue().getBlockedAt()).isEqualTo(NOW);
    }

    @Test
    void unblockRestoresRecordToDeclined() {
        RecommendationRecord blocked = existing("gp-1", RecommendationStatus.NOT_INTERESTED, Duration.ofDays(2));
        blocked.setBlockReason("never");
        when(blockedRepo.deleteByUserIdAndCandidateId("u1", "gp-1")).thenReturn(1L);
        when(recordRepo.findByUserIdAndCandidateId("u1", "gp-1")).thenReturn(Optional.of(blocked));

        Result<Void> r = store.unblock("u1", "gp-1");

        assertThat(r.isOk()).isTrue();
        assertThat(blocked.getStatus()).isEqualTo(RecommendationStatus.DECLINED);
        assertThat(blocked.getBlockReason()).isNull();
        verify(recordRepo).save(blocked);
    }

    @Test
    void unblockOfUnknownCandidateIsNotFound() {
        when(blockedRepo.deleteByUserIdAndCandidateId("u1", "gp-9")).thenReturn(0L);
        when(recordRepo.findByUserIdAndCandidateId("u1", "gp-9")).thenReturn(Optional.empty());

        assertThat(store.unblock("u1", "gp-9").getErrorCode()).isEqualTo("NOT_FOUND");
        verifyNoInteractions(events);
    }

    @Test
    void clearPendingDeclinesAndForcesRefresh() {
        List<RecommendationRecord> pending = List.of(
                existing("gp-1", RecommendationStatus.PENDING, Duration.ofHours(1)),
                existing("gp-2", RecommendationStatus.PENDING, Duration.ofHours(2)));
        when(recordRepo.findByUserIdAndStatus("u1", RecommendationStatus.PENDING)).thenReturn(pending);

        Result<Integer> r = store.clearPending("u1");

        assertThat(r.get()).isEqualTo(2);
        assertThat(pending).allSatisfy(rec -> {
            assertThat(rec.getStatus()).isEqualTo(RecommendationStatus.DECLINED);
            assertThat(rec.getLastShownAt()).isEqualTo(NOW);
        });
        verify(recordRepo).saveAll(pending);
        verify(poolCache).forceRefresh("u1");
    }

    @Test
    void statsReportAcceptanceRateWithOneDecimal() {
        when(recordRepo.countByUserId("u1")).thenReturn(3L);
        when(recordRepo.countByUserIdAndStatus(eq("u1"), any())).thenReturn(0L);
        when(recordRepo.countByUserIdAndStatus("u1", RecommendationStatus.ACCEPTED)).thenReturn(1L);

        RecommendationStats stats = store.stats("u1").get();

        assertThat(stats.total()).isEqualTo(3);
        assertThat(stats.accepted()).isEqualTo(1);
        assertThat(stats.acceptanceRate()).isEqualTo(33.3);
    }

    @Test
    void expireStaleMovesOpenRecordsToExpired() {
        RecommendationRecord old = existing("gp-1", RecommendationStatus.VIEWED, Duration.ofDays(8));
        when(recordRepo.findExpiredOpenRecords(NOW)).thenReturn(List.of(old));

        assertThat(store.expireStale()).isEqualTo(1);
        assertThat(old.getStatus()).isEqualTo(RecommendationStatus.EXPIRED);
    }
}
