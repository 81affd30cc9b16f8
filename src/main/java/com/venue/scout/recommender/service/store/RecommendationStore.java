package com.venue.scout.recommender.service.store;

import com.google.gson.JsonObject;
import com.venue.scout.recommender.bus.EventBusConfig;
import com.venue.scout.recommender.bus.EventPublisher;
import com.venue.scout.recommender.common.Result;
import com.venue.scout.recommender.common.constants.CooldownProperties;
import com.venue.scout.recommender.common.constants.ScoutConsts;
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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.ToDoubleFunction;

/**
 * Persisted recommendation records of each user and their lifecycle.
 *
 * <p>One record per (userId, candidateId); a candidate generated again updates its record in place.
 * Accepted and not-interested records are never revived by a save.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecommendationStore {

    private final RecommendationRecordRepo recordRepo;
    private final BlockedCandidateRepo blockedRepo;
    private final CooldownPolicy cooldownPolicy;
    private final CooldownProperties cooldown;
    private final ScheduleLinker scheduleLinker;
    private final CandidatePoolCache poolCache;
    private final EventPublisher events;
    private final Clock clock;

    // ---------------- Save / Load ----------------

    /**
     * Upserts the ranked list. {@code confidence} maps a scored candidate onto [0, 1].
     *
     * @throws PersistenceException when the database rejects a write
     */
    public List<RecommendationRecord> save(String userId, List<ScoredCandidate> ranked,
                                           ToDoubleFunction<ScoredCandidate> confidence) {
        Instant now = clock.instant();
        List<RecommendationRecord> saved = new ArrayList<>(ranked.size());
        int resurfaced = 0;
        try {
            for (ScoredCandidate sc : ranked) {
                Upserted u;
                try {
                    u = upsert(userId, sc, confidence.applyAsDouble(sc), now);
                } catch (DuplicateKeyException race) {
                    // a concurrent cycle inserted the same key first; apply on top of its record
                    log.debug("store.save: concurrent insert of {}/{}, retrying", userId, sc.getId());
                    u = upsert(userId, sc, confidence.applyAsDouble(sc), now);
                }
                if (u == null) continue;
                if (u.resurfaced()) resurfaced++;
                saved.add(u.record());
            }
        } catch (DataAccessException e) {
            log.error("store.save: failed for user {} after {} records", userId, saved.size(), e);
            throw new PersistenceException("Could not save recommendations for " + userId, e);
        }
        log.info("store.save user={} saved={} resurfaced={}", userId, saved.size(), resurfaced);
        return saved;
    }

    private record Upserted(RecommendationRecord record, boolean resurfaced) {
    }

    private Upserted upsert(String userId, ScoredCandidate sc, double confidence, Instant now) {
        Optional<RecommendationRecord> existing = recordRepo.findByUserIdAndCandidateId(userId, sc.getId());
        RecommendationRecord r;
        boolean resurfaced = false;
        if (existing.isEmpty()) {
            r = RecommendationRecord.builder()
                    .userId(userId)
                    .candidateId(sc.getId())
                    .build();
            markShownAsPending(r, now);
        } else {
            r = existing.get();
            RecommendationStatus status = r.getStatus();
            if (status == null || status == RecommendationStatus.PENDING) {
                markShownAsPending(r, now);
            } else if (status.isTerminal()) {
                return null;
            } else if (cooldownPolicy.cooldownElapsed(r, now)) {
                markShownAsPending(r, now);
                r.setResurfacedCount(nz(r.getResurfacedCount()) + 1);
                r.setViewedAt(null);
                r.setRespondedAt(null);
                r.setDeclineReason(null);
                resurfaced = true;
            } else {
                // still cooling down: regenerated, but keeps its status and cooldown clock
                r.setCreatedAt(now);
                r.setExpiresAt(now.plus(cooldown.getRecordLifetime()));
            }
        }
        var c = sc.getCandidate();
        r.setSource(c.getSource());
        r.setCategory(sc.getCategory());
        r.setCandidateName(c.getName());
        r.setAddress(c.getAddress());
        r.setExplanation(sc.getExplanation());
        r.setConfidenceScore(confidence);
        r.setUpdatedAt(now);
        return new Upserted(recordRepo.save(r), resurfaced);
    }

    private void markShownAsPending(RecommendationRecord r, Instant now) {
        r.setStatus(RecommendationStatus.PENDING);
        r.setCreatedAt(now);
        r.setLastShownAt(now);
        r.setExpiresAt(now.plus(cooldown.getRecordLifetime()));
        r.setDisplayCount(0);
    }

    /**
     * Records the user may see now, highest confidence first.
     */
    public Result<List<RecommendationRecord>> load(String userId) {
        if (userId == null || userId.isBlank()) return Result.fail("BAD_REQUEST", "userId is required");
        Instant now = clock.instant();
        List<RecommendationRecord> rows = recordRepo.findLoadCandidates(userId, now, now.minus(cooldown.getFreshnessWindow()));
        List<RecommendationRecord> out = new ArrayList<>(rows.size());
        for (RecommendationRecord r : rows) {
            if (cooldownPolicy.isLoadable(r, now)) out.add(r);
        }
        out.sort(Comparator.comparing(RecommendationRecord::getConfidenceScore,
                Comparator.nullsLast(Comparator.reverseOrder())));
        if (out.size() > cooldown.getLoadLimit()) out = new ArrayList<>(out.subList(0, cooldown.getLoadLimit()));
        log.debug("store.load user={} candidates={} loadable={}", userId, rows.size(), out.size());
        return Result.ok(out);
    }

    /** candidateId -> hours since last shown, for records shown within the recency lookback. */
    public Map<String, Double> recentlyShown(String userId, Instant now) {
        Map<String, Double> out = new LinkedHashMap<>();
        for (RecommendationRecord r : recordRepo.findByUserIdAndLastShownAtAfter(userId, now.minus(cooldown.getRecencyLookback()))) {
            if (r.getLastShownAt() == null) continue;
            out.put(r.getCandidateId(), Duration.between(r.getLastShownAt(), now).toMillis() / 3_600_000.0);
        }
        return out;
    }

    // ---------------- Transitions ----------------

    public Result<RecommendationRecord> markViewed(String recordId) {
        RecommendationRecord r = recordRepo.findById(recordId).orElse(null);
        if (r == null) return Result.fail("NOT_FOUND", "Recommendation not found: " + recordId);
        if (r.getStatus() != RecommendationStatus.PENDING) return Result.ok(r);

        Instant now = clock.instant();
        r.setStatus(RecommendationStatus.VIEWED);
        r.setViewedAt(now);
        r.setDisplayCount(nz(r.getDisplayCount()) + 1);
        r.setUpdatedAt(now);
        RecommendationRecord saved = recordRepo.save(r);
        publish("recommendation.viewed", saved);
        return Result.ok(saved);
    }

    public Result<RecommendationRecord> markAccepted(String recordId, String scheduleRef) {
        RecommendationRecord r = recordRepo.findById(recordId).orElse(null);
        if (r == null) return Result.fail("NOT_FOUND", "Recommendation not found: " + recordId);
        if (r.getStatus() == RecommendationStatus.ACCEPTED) return Result.ok(r);
        if (!canMove(r, RecommendationStatus.ACCEPTED)) {
            return Result.fail("INVALID_STATE", "Recommendation is " + r.getStatus() + ", cannot accept");
        }

        Instant now = clock.instant();
        r.setStatus(RecommendationStatus.ACCEPTED);
        r.setRespondedAt(now);
        r.setUpdatedAt(now);
        if (scheduleRef != null && !scheduleRef.isBlank()) r.setScheduleRef(scheduleRef);
        RecommendationRecord saved = recordRepo.save(r);

        try {
            Optional<String> ref = scheduleLinker.link(saved);
            if (ref.isPresent() && !ref.get().equals(saved.getScheduleRef())) {
                saved.setScheduleRef(ref.get());
                saved = recordRepo.save(saved);
            }
        } catch (RuntimeException e) {
            log.warn("store.accept: schedule link failed for {}: {}", recordId, e.toString());
        }
        publish("recommendation.accepted", saved);
        return Result.ok(saved);
    }

    public Result<RecommendationRecord> markDeclined(String recordId, String reason) {
        RecommendationRecord r = recordRepo.findById(recordId).orElse(null);
        if (r == null) return Result.fail("NOT_FOUND", "Recommendation not found: " + recordId);
        if (!canMove(r, RecommendationStatus.DECLINED)) {
            return Result.fail("INVALID_STATE", "Recommendation is " + r.getStatus() + ", cannot decline");
        }

        Instant now = clock.instant();
        r.setStatus(RecommendationStatus.DECLINED);
        r.setRespondedAt(now);
        r.setDeclineReason(reason == null || reason.isBlank() ? ScoutConsts.Reasons.DECLINED : reason);
        r.setUpdatedAt(now);
        RecommendationRecord saved = recordRepo.save(r);
        publish("recommendation.declined", saved);
        return Result.ok(saved);
    }

    /**
     * Permanent opt-out from the record's candidate; also adds the candidate to the block list.
     */
    public Result<RecommendationRecord> markNotInterested(String recordId, String reason) {
        RecommendationRecord r = recordRepo.findById(recordId).orElse(null);
        if (r == null) return Result.fail("NOT_FOUND", "Recommendation not found: " + recordId);
        if (r.getStatus() == RecommendationStatus.NOT_INTERESTED) return Result.ok(r);
        if (!canMove(r, RecommendationStatus.NOT_INTERESTED)) {
            return Result.fail("INVALID_STATE", "Recommendation is " + r.getStatus() + ", cannot opt out");
        }

        Instant now = clock.instant();
        String why = reason == null || reason.isBlank() ? ScoutConsts.Reasons.NOT_INTERESTED : reason;
        r.setStatus(RecommendationStatus.NOT_INTERESTED);
        r.setRespondedAt(now);
        r.setDeclineReason(why);
        r.setUpdatedAt(now);
        RecommendationRecord saved = recordRepo.save(r);
        insertBlock(r.getUserId(), r.getCandidateId(), r.getCandidateName(), why, now);
        publish("recommendation.not_interested", saved);
        return Result.ok(saved);
    }

    private static boolean canMove(RecommendationRecord r, RecommendationStatus next) {
        return r.getStatus() != null && r.getStatus().canTransitionTo(next);
    }

    /**
     * Declines every pending record of the user, starting their cooldown, and forces the next
     * generation to refresh its pool.
     */
    public Result<Integer> clearPending(String userId) {
        if (userId == null || userId.isBlank()) return Result.fail("BAD_REQUEST", "userId is required");
        Instant now = clock.instant();
        List<RecommendationRecord> pending = recordRepo.findByUserIdAndStatus(userId, RecommendationStatus.PENDING);
        for (RecommendationRecord r : pending) {
            r.setStatus(RecommendationStatus.DECLINED);
            r.setLastShownAt(now);
            r.setRespondedAt(now);
            r.setDeclineReason(ScoutConsts.Reasons.DECLINED);
            r.setUpdatedAt(now);
        }
        if (!pending.isEmpty()) recordRepo.saveAll(pending);
        poolCache.forceRefresh(userId);

        JsonObject o = new JsonObject();
        o.addProperty("userId", userId);
        o.addProperty("cleared", pending.size());
        events.publishEvent(EventBusConfig.TOPIC_AUDIT, userId, "recommendation.clear_pending", o);
        log.info("store.clearPending user={} cleared={}", userId, pending.size());
        return Result.ok(pending.size());
    }

    // ---------------- Block list ----------------

    public Result<BlockedCandidate> block(String userId, String candidateId, String candidateName, String reason) {
        if (isBlank(userId) || isBlank(candidateId)) return Result.fail("BAD_REQUEST", "userId and candidateId are required");
        Instant now = clock.instant();
        String why = isBlank(reason) ? ScoutConsts.Reasons.BLOCKED : reason;
        BlockedCandidate b = insertBlock(userId, candidateId, candidateName, why, now);

        recordRepo.findByUserIdAndCandidateId(userId, candidateId).ifPresent(r -> {
            if (r.getStatus() == RecommendationStatus.NOT_INTERESTED && why.equals(r.getBlockReason())) return;
            r.setStatus(RecommendationStatus.NOT_INTERESTED);
            r.setBlockReason(why);
            r.setRespondedAt(now);
            r.setUpdatedAt(now);
            recordRepo.save(r);
        });

        JsonObject o = new JsonObject();
        o.addProperty("userId", userId);
        o.addProperty("candidateId", candidateId);
        o.addProperty("reason", why);
        events.publishEvent(EventBusConfig.TOPIC_AUDIT, userId, "candidate.blocked", o);
        return Result.ok(b);
    }

    /**
     * Removes the block and moves a not-interested record back to declined, so it resurfaces only
     * after the declined cooldown.
     */
    public Result<Void> unblock(String userId, String candidateId) {
        if (isBlank(userId) || isBlank(candidateId)) return Result.fail("BAD_REQUEST", "userId and candidateId are required");
        long removed = blockedRepo.deleteByUserIdAndCandidateId(userId, candidateId);
        Instant now = clock.instant();
        boolean restored = recordRepo.findByUserIdAndCandidateId(userId, candidateId)
                .filter(r -> r.getStatus() == RecommendationStatus.NOT_INTERESTED)
                .map(r -> {
                    r.setStatus(RecommendationStatus.DECLINED);
                    r.setBlockReason(null);
                    r.setUpdatedAt(now);
                    recordRepo.save(r);
                    return true;
                })
                .orElse(false);
        if (removed == 0 && !restored) return Result.fail("NOT_FOUND", "Candidate is not blocked: " + candidateId);

        JsonObject o = new JsonObject();
        o.addProperty("userId", userId);
        o.addProperty("candidateId", candidateId);
        events.publishEvent(EventBusConfig.TOPIC_AUDIT, userId, "candidate.unblocked", o);
        return Result.ok();
    }

    public Result<List<BlockedCandidate>> listBlocked(String userId) {
        if (isBlank(userId)) return Result.fail("BAD_REQUEST", "userId is required");
        return Result.ok(blockedRepo.findByUserIdOrderByBlockedAtDesc(userId));
    }

    public Set<String> blockedIds(String userId) {
        Set<String> ids = new HashSet<>();
        for (BlockedCandidate b : blockedRepo.findByUserIdOrderByBlockedAtDesc(userId)) ids.add(b.getCandidateId());
        return ids;
    }

    private BlockedCandidate insertBlock(String userId, String candidateId, String name, String reason, Instant now) {
        BlockedCandidate b = BlockedCandidate.builder()
                .userId(userId)
                .candidateId(candidateId)
                .candidateName(name)
                .reason(reason)
                .blockedAt(now)
                .build();
        if (blockedRepo.existsByUserIdAndCandidateId(userId, candidateId)) return b;
        try {
            return blockedRepo.insert(b);
        } catch (DuplicateKeyException e) {
            log.debug("store.block: {}/{} already blocked", userId, candidateId);
            return b;
        }
    }

    // ---------------- Stats / expiry ----------------

    public Result<RecommendationStats> stats(String userId) {
        if (isBlank(userId)) return Result.fail("BAD_REQUEST", "userId is required");
        long total = recordRepo.countByUserId(userId);
        long accepted = recordRepo.countByUserIdAndStatus(userId, RecommendationStatus.ACCEPTED);
        double rate = total == 0 ? 0.0 : Math.round(accepted * 1000.0 / total) / 10.0;
        return Result.ok(new RecommendationStats(
                total,
                recordRepo.countByUserIdAndStatus(userId, RecommendationStatus.PENDING),
                recordRepo.countByUserIdAndStatus(userId, RecommendationStatus.VIEWED),
                accepted,
                recordRepo.countByUserIdAndStatus(userId, RecommendationStatus.DECLINED),
                recordRepo.countByUserIdAndStatus(userId, RecommendationStatus.NOT_INTERESTED),
                recordRepo.countByUserIdAndStatus(userId, RecommendationStatus.EXPIRED),
                rate));
    }

    /** Moves pending and viewed records past their lifetime to expired. Returns how many moved. */
    public int expireStale() {
        Instant now = clock.instant();
        List<RecommendationRecord> stale = recordRepo.findExpiredOpenRecords(now);
        for (RecommendationRecord r : stale) {
            r.setStatus(RecommendationStatus.EXPIRED);
            r.setUpdatedAt(now);
        }
        if (!stale.isEmpty()) recordRepo.saveAll(stale);
        return stale.size();
    }

    private void publish(String event, RecommendationRecord r) {
        JsonObject o = new JsonObject();
        o.addProperty("recordId", r.getId());
        o.addProperty("userId", r.getUserId());
        o.addProperty("candidateId", r.getCandidateId());
        o.addProperty("status", r.getStatus().name());
        if (r.getCategory() != null) o.addProperty("category", r.getCategory());
        events.publishEvent(EventBusConfig.TOPIC_RECOMMENDATION, r.getUserId(), event, o);
    }

    private static int nz(Integer v) {
        return v == null ? 0 : v;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
