package com.venue.scout.recommender.service.geocode;

import com.venue.scout.recommender.common.constants.GeocodeProperties;
import com.venue.scout.recommender.model.candidate.GeoPoint;
import com.venue.scout.recommender.model.candidate.UnifiedCandidate;
import com.venue.scout.recommender.service.fallback.FallbackResolver;
import com.venue.scout.recommender.service.fallback.FallbackStrategy;
import com.venue.scout.recommender.service.fallback.Resolution;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fills in coordinates for candidates that only carry an address. Lookups go through the cache
 * first, then the provider, and run on the bounded geocode pool so at most pool-size requests
 * are in flight.
 */
@Service
@Slf4j
public class GeocodingEnricher {

    private final GeocodingClient client;
    private final GeocodeCache cache;
    private final FallbackResolver resolver;
    private final Executor geocodeExecutor;
    private final GeocodeProperties props;

    public GeocodingEnricher(GeocodingClient client,
                             GeocodeCache cache,
                             FallbackResolver resolver,
                             @Qualifier("geocodeExecutor") Executor geocodeExecutor,
                             GeocodeProperties props) {
        this.client = client;
        this.cache = cache;
        this.resolver = resolver;
        this.geocodeExecutor = geocodeExecutor;
        this.props = props;
    }

    /**
     * Same candidates in the same order; resolved ones get coordinates, the rest are unchanged.
     */
    public List<UnifiedCandidate> enrich(List<UnifiedCandidate> candidates) {
        Set<String> addresses = new LinkedHashSet<>();
        for (UnifiedCandidate c : candidates) {
            if (!c.hasCoordinates() && c.getAddress() != null && !c.getAddress().isBlank()) {
                addresses.add(c.getAddress());
            }
        }
        if (addresses.isEmpty()) return candidates;

        Map<String, CompletableFuture<Optional<GeoPoint>>> pending = new LinkedHashMap<>();
        for (String address : addresses) {
            pending.put(address, CompletableFuture.supplyAsync(() -> lookup(address), geocodeExecutor)
                    .exceptionally(ex -> {
                        log.warn("geocode.enrich: lookup failed for '{}': {}", address, ex.toString());
                        return Optional.empty();
                    }));
        }

        CompletableFuture<Void> all = CompletableFuture.allOf(pending.values().toArray(new CompletableFuture[0]));
        try {
            all.get(props.getBatchTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("geocode.enrich: batch timed out after {}, keeping resolved addresses", props.getBatchTimeout());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("geocode.enrich: interrupted");
        } catch (ExecutionException e) {
            log.warn("geocode.enrich: batch failed: {}", e.getMessage());
        }

        Map<String, GeoPoint> resolved = new LinkedHashMap<>();
        pending.forEach((address, f) -> {
            Optional<GeoPoint> p = f.getNow(Optional.empty());
            p.ifPresent(point -> resolved.put(address, point));
        });
        log.debug("geocode.enrich: {}/{} addresses resolved", resolved.size(), addresses.size());

        List<UnifiedCandidate> out = new ArrayList<>(candidates.size());
        for (UnifiedCandidate c : candidates) {
            GeoPoint p = c.hasCoordinates() ? null : resolved.get(c.getAddress());
            out.add(p == null ? c : c.toBuilder().coordinates(p).build());
        }
        return out;
    }

    private Optional<GeoPoint> lookup(String address) {
        List<FallbackStrategy<GeoPoint>> chain = List.of(
                FallbackStrategy.of("cache", () -> cache.get(address)),
                FallbackStrategy.of("provider", () -> {
                    if (!client.isAvailable()) return Optional.empty();
                    Optional<GeoPoint> p = client.geocode(address);
                    p.ifPresent(point -> cache.put(address, point));
                    return p;
                }));
        return resolver.resolve("geocode", chain).map(Resolution::value);
    }
}
