package com.venue.scout.recommender.service.aggregation;

import com.venue.scout.recommender.common.constants.AggregationProperties;
import com.venue.scout.recommender.model.candidate.UnifiedCandidate;
import com.venue.scout.recommender.service.geocode.GeocodingEnricher;
import com.venue.scout.recommender.service.source.SourceAdapter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fans a geo query out to every available adapter, merges the answers and widens the radius while
 * the pool stays under the target size.
 *
 * <p>Never throws for provider trouble: a failing or slow adapter contributes nothing, and an
 * overall timeout returns what was collected so far.
 */
@Service
@Slf4j
public class CandidateAggregator {

    private final List<SourceAdapter> adapters;
    private final Executor sourceExecutor;
    private final GeocodingEnricher enricher;
    private final AggregationProperties props;

    public CandidateAggregator(List<SourceAdapter> adapters,
                               @Qualifier("sourceExecutor") Executor sourceExecutor,
                               GeocodingEnricher enricher,
                               AggregationProperties props) {
        this.adapters = List.copyOf(adapters);
        this.sourceExecutor = sourceExecutor;
        this.enricher = enricher;
        this.props = props;
    }

    public List<UnifiedCandidate> aggregate(AggregationQuery query) {
        List<SourceAdapter> available = new ArrayList<>();
        for (SourceAdapter a : adapters) {
            if (a.isAvailable()) available.add(a);
            else log.debug("aggregator: {} unavailable, skipped", a.kind());
        }
        if (available.isEmpty()) {
            log.warn("aggregator: no source adapter available");
            return List.of();
        }

        long deadline = System.nanoTime() + props.getOverallTimeout().toNanos();
        Map<String, UnifiedCandidate> merged = new LinkedHashMap<>();
        int radius = query.radiusMeters();

        for (int attempt = 0; attempt <= props.getMaxExpansions(); attempt++) {
            if (attempt > 0) {
                radius = expandedRadius(query.radiusMeters(), attempt);
            }
            int before = merged.size();
            boolean completed = runRound(available, query.withRadius(radius), merged, deadline);
            int added = merged.size() - before;
            log.info("aggregator.round attempt={} radius={} added={} total={}", attempt, radius, added, merged.size());

            if (!completed) {
                log.warn("aggregator: overall timeout {} reached, returning {} partial candidates",
                        props.getOverallTimeout(), merged.size());
                break;
            }
            if (merged.size() >= props.getTargetCount()) break;
            if (attempt > 0 && added == 0) break;
            if (radius >= props.getRadiusCapMeters()) break;
        }

        List<UnifiedCandidate> enriched = enricher.enrich(new ArrayList<>(merged.values()));
        List<UnifiedCandidate> out = new ArrayList<>(enriched.size());
        for (UnifiedCandidate c : enriched) {
            if (c.hasCoordinates()) out.add(c);
            else log.debug("aggregator: dropped {} without coordinates", c.getId());
        }
        return out;
    }

    int expandedRadius(int baseRadius, int attempt) {
        double widened = baseRadius * (1 + attempt * props.getExpansionStep());
        return (int) Math.min(Math.round(widened), props.getRadiusCapMeters());
    }

    /**
     * One concurrent pass over the adapters. Results merge in adapter order, first occurrence of
     * an id wins. Returns false when the overall deadline cut the round short.
     */
    private boolean runRound(List<SourceAdapter> available, AggregationQuery query,
                             Map<String, UnifiedCandidate> merged, long deadline) {
        List<CompletableFuture<List<UnifiedCandidate>>> futures = new ArrayList<>(available.size());
        for (SourceAdapter adapter : available) {
            futures.add(CompletableFuture
                    .supplyAsync(() -> search(adapter, query), sourceExecutor)
                    .orTimeout(props.getAdapterTimeout().toMillis(), TimeUnit.MILLISECONDS)
                    .exceptionally(ex -> {
                        log.warn("aggregator: {} failed: {}", adapter.kind(), rootMessage(ex));
                        return List.of();
                    }));
        }

        boolean completed = true;
        long remaining = deadline - System.nanoTime();
        try {
            if (remaining <= 0) throw new TimeoutException();
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            completed = false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            completed = false;
        } catch (ExecutionException e) {
            log.warn("aggregator: round failed: {}", rootMessage(e));
        }

        for (CompletableFuture<List<UnifiedCandidate>> f : futures) {
            for (UnifiedCandidate c : f.getNow(List.of())) {
                if (c == null || c.getId() == null) continue;
                merged.putIfAbsent(c.getId(), c);
            }
        }
        return completed;
    }

    private static List<UnifiedCandidate> search(SourceAdapter adapter, AggregationQuery q) {
        List<UnifiedCandidate> found = adapter.search(q.center(), q.radiusMeters(), q.interestHints(), q.perAdapterLimit());
        return found == null ? List.of() : found;
    }

    private static String rootMessage(Throwable t) {
        Throwable root = t;
        while (root.getCause() != null && root.getCause() != root) root = root.getCause();
        return root.getClass().getSimpleName() + (root.getMessage() == null ? "" : ": " + root.getMessage());
    }
}
