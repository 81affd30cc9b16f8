package com.venue.scout.recommender.service.pipeline;

import com.google.gson.JsonObject;
import com.venue.scout.recommender.bus.EventBusConfig;
import com.venue.scout.recommender.bus.EventPublisher;
import com.venue.scout.recommender.common.Result;
import com.venue.scout.recommender.common.constants.AggregationProperties;
import com.venue.scout.recommender.common.exception.PersistenceException;
import com.venue.scout.recommender.core.TtlStateStore;
import com.venue.scout.recommender.enums.PoolOrigin;
import com.venue.scout.recommender.enums.SubscriptionTier;
import com.venue.scout.recommender.model.candidate.GeoPoint;
import com.venue.scout.recommender.model.candidate.UnifiedCandidate;
import com.venue.scout.recommender.model.documents.UserProfile;
import com.venue.scout.recommender.model.dto.GenerateRequest;
import com.venue.scout.recommender.model.dto.RecommendationBatch;
import com.venue.scout.recommender.model.dto.RecommendationView;
import com.venue.scout.recommender.model.profile.Commitment;
import com.venue.scout.recommender.model.profile.FeedbackSummary;
import com.venue.scout.recommender.model.profile.PersonalSignals;
import com.venue.scout.recommender.model.scoring.ScoredCandidate;
import com.venue.scout.recommender.model.scoring.ScoringContext;
import com.venue.scout.recommender.service.aggregation.AggregationQuery;
import com.venue.scout.recommender.service.aggregation.CandidateAggregator;
import com.venue.scout.recommender.service.collab.CommitmentProvider;
import com.venue.scout.recommender.service.collab.PersonalSignalsProvider;
import com.venue.scout.recommender.service.collab.UserProfileProvider;
import com.venue.scout.recommender.service.fallback.FallbackResolver;
import com.venue.scout.recommender.service.fallback.FallbackStrategy;
import com.venue.scout.recommender.service.fallback.Resolution;
import com.venue.scout.recommender.service.filter.CandidateFilter;
import com.venue.scout.recommender.service.filter.FilterCriteria;
import com.venue.scout.recommender.service.pool.CandidatePoolCache;
import com.venue.scout.recommender.service.rules.BusinessRuleEngine;
import com.venue.scout.recommender.service.scoring.CandidateScorer;
import com.venue.scout.recommender.service.store.FeedbackAggregator;
import com.venue.scout.recommender.service.store.RecommendationStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * One generation cycle: pool, filter, score, rank, persist, publish.
 *
 * <p>Provider outages and persistence failures degrade the result but never fail the cycle; an
 * empty batch is a valid answer.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecommendationPipeline {

    private static final Duration GENERATION_LOCK_TTL = Duration.ofSeconds(30);
    private static final Duration COMMITMENT_HORIZON = Duration.ofHours(24);

    private final UserProfileProvider profiles;
    private final CommitmentProvider commitments;
    private final PersonalSignalsProvider signals;
    private final CandidateAggregator aggregator;
    private final CandidatePoolCache poolCache;
    private final FallbackResolver fallbackResolver;
    private final CandidateFilter candidateFilter;
    private final CandidateScorer scorer;
    private final BusinessRuleEngine ruleEngine;
    private final RecommendationStore store;
    private final FeedbackAggregator feedbackAggregator;
    private final TtlStateStore stateStore;
    private final EventPublisher events;
    private final AggregationProperties aggregation;
    private final Clock clock;

    public Result<RecommendationBatch> generate(GenerateRequest req) {
        if (req == null || req.userId() == null || req.userId().isBlank()) {
            return Result.fail("BAD_REQUEST", "userId is required");
        }
        if (req.center() == null || !req.center().isValid()) {
            return Result.fail("BAD_REQUEST", "A valid center is required");
        }
        ZoneId zone;
        try {
            zone = req.timeZone() == null || req.timeZone().isBlank() ? ZoneOffset.UTC : ZoneId.of(req.timeZone());
        } catch (DateTimeException e) {
            return Result.fail("BAD_REQUEST", "Unknown time zone: " + req.timeZone());
        }

        UserProfile profile = profiles.find(req.userId()).orElse(null);
        if (profile == null) return Result.fail("NOT_FOUND", "User profile not found: " + req.userId());

        String lockKey = "lock:generate:" + req.userId();
        if (!stateStore.setIfAbsent(lockKey, "1", GENERATION_LOCK_TTL)) {
            return Result.fail("THROTTLED", "A generation for this user is already running");
        }
        try {
            return Result.ok(run(req, profile, zone));
        } finally {
            stateStore.delete(lockKey);
        }
    }

    private RecommendationBatch run(GenerateRequest req, UserProfile profile, ZoneId zone) {
        String userId = req.userId();
        Instant now = clock.instant();
        SubscriptionTier tier = profile.getSubscriptionTier() == null ? SubscriptionTier.FREE : profile.getSubscriptionTier();
        int resultCount = req.maxResults() != null ? req.maxResults() : tier.getResultsPerRefresh();

        Resolution<List<UnifiedCandidate>> pool = resolvePool(req, profile, tier, now);
        PoolOrigin origin = PoolOrigin.valueOf(pool.strategy());
        if (pool.value().isEmpty()) {
            log.info("pipeline user={} origin={} empty pool", userId, origin);
            return RecommendationBatch.empty(userId, origin, now);
        }

        Set<String> blocked = orDefault("blocked", () -> store.blockedIds(userId), Set.of());
        FilterCriteria criteria = new FilterCriteria(req.category(), req.minRating(), req.openNow(), req.maxPriceLevel(),
                req.excludedIds() == null ? Set.of() : new HashSet<>(req.excludedIds()), req.infiniteScroll());
        List<UnifiedCandidate> candidates = candidateFilter.apply(pool.value(), criteria, blocked);

        List<String> ids = new ArrayList<>(candidates.size());
        for (UnifiedCandidate c : candidates) ids.add(c.getId());

        ScoringContext ctx = ScoringContext.builder()
                .now(now)
                .zone(zone)
                .userLocation(req.center())
                .home(req.home() != null ? req.home() : profile.getHome())
                .work(req.work() != null ? req.work() : profile.getWork())
                .hoursSinceShown(orDefault("recency", () -> store.recentlyShown(userId, now), Map.<String, Double>of()))
                .commitments(orDefault("commitments", () -> commitments.upcoming(userId, now, COMMITMENT_HORIZON), List.<Commitment>of()))
                .feedback(orDefault("feedback", () -> feedbackAggregator.summarize(userId, ids), FeedbackSummary.empty()))
                .signals(orDefault("signals", () -> signals.signalsFor(userId), PersonalSignals.empty()))
                .discoveryMode(req.discovery())
                .build();

        List<ScoredCandidate> ranked = ruleEngine.apply(scorer.scoreAll(candidates, profile, ctx), resultCount, zone);

        boolean persisted = true;
        if (!ranked.isEmpty()) {
            try {
                store.save(userId, ranked, scorer::confidence);
            } catch (PersistenceException | DataAccessException e) {
                persisted = false;
                log.error("pipeline user={} ranked list not persisted, returning it anyway", userId, e);
            }
        }

        List<RecommendationView> items = new ArrayList<>(ranked.size());
        for (ScoredCandidate sc : ranked) items.add(RecommendationView.of(sc, scorer.confidence(sc)));

        publishGenerated(userId, origin, pool.value().size(), items.size(), persisted);
        log.info("pipeline user={} origin={} pool={} filtered={} returned={} persisted={}",
                userId, origin, pool.value().size(), candidates.size(), items.size(), persisted);
        return new RecommendationBatch(userId, items, origin, persisted, pool.value().size(), now);
    }

    /**
     * Fresh cache, live aggregation, stale cache, nothing; in that order.
     */
    private Resolution<List<UnifiedCandidate>> resolvePool(GenerateRequest req, UserProfile profile,
                                                           SubscriptionTier tier, Instant now) {
        String userId = req.userId();
        GeoPoint center = req.center();
        boolean forced = poolCache.consumeForceRefresh(userId) || req.infiniteScroll();

        List<String> hints = new ArrayList<>();
        if (req.category() != null && !req.category().isBlank()) hints.add(req.category());
        if (profile.getInterests() != null) hints.addAll(profile.getInterests());
        int perAdapter = req.infiniteScroll() ? aggregation.getInfiniteScrollLimit() : aggregation.getPerAdapterLimit();
        AggregationQuery query = new AggregationQuery(center, req.radiusOrDefault(), hints, perAdapter);

        List<FallbackStrategy<List<UnifiedCandidate>>> chain = List.of(
                FallbackStrategy.of(PoolOrigin.CACHED.name(), () -> {
                    if (forced || !tier.hasCadenceLimit()) return Optional.empty();
                    return poolCache.get(userId, center)
                            .filter(p -> p.ageAt(now).compareTo(tier.getRefreshInterval()) < 0)
                            .map(CandidatePoolCache.CachedPool::candidates);
                }),
                FallbackStrategy.of(PoolOrigin.LIVE.name(), () -> {
                    List<UnifiedCandidate> live = aggregator.aggregate(query);
                    if (live.isEmpty()) return Optional.empty();
                    poolCache.put(userId, center, live);
                    return Optional.of(live);
                }),
                FallbackStrategy.of(PoolOrigin.STALE_CACHE.name(), () -> {
                    Optional<List<UnifiedCandidate>> stale = poolCache.get(userId, center)
                            .filter(p -> p.ageAt(now).compareTo(aggregation.getPoolCacheMaxAge()) <= 0)
                            .map(CandidatePoolCache.CachedPool::candidates);
                    stale.ifPresent(s -> log.warn("pipeline user={} serving stale pool of {}", userId, s.size()));
                    return stale;
                }));

        return fallbackResolver.resolve("pool", chain)
                .orElseGet(() -> new Resolution<>(List.of(), PoolOrigin.NONE.name()));
    }

    private void publishGenerated(String userId, PoolOrigin origin, int poolSize, int returned, boolean persisted) {
        JsonObject o = new JsonObject();
        o.addProperty("userId", userId);
        o.addProperty("origin", origin.name());
        o.addProperty("pool", poolSize);
        o.addProperty("returned", returned);
        o.addProperty("persisted", persisted);
        events.publishEvent(EventBusConfig.TOPIC_RECOMMENDATION, userId, "recommendation.generated", o);
    }

    private <T> T orDefault(String what, Supplier<T> supplier, T fallback) {
        try {
            T value = supplier.get();
            return value == null ? fallback : value;
        } catch (RuntimeException e) {
            log.warn("pipeline: {} unavailable, continuing without it: {}", what, e.toString());
            return fallback;
        }
    }
}
