package com.venue.scout.recommender.test.service.aggregation;

import com.venue.scout.recommender.common.constants.AggregationProperties;
import com.venue.scout.recommender.common.exception.SourceUnavailableException;
import com.venue.scout.recommender.enums.SourceKind;
import com.venue.scout.recommender.model.candidate.GeoPoint;
import com.venue.scout.recommender.model.candidate.UnifiedCandidate;
import com.venue.scout.recommender.service.aggregation.AggregationQuery;
import com.venue.scout.recommender.service.aggregation.CandidateAggregator;
import com.venue.scout.recommender.service.geocode.GeocodingEnricher;
import com.venue.scout.recommender.service.source.SourceAdapter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.IntUnaryOperator;

import static com.venue.scout.recommender.test.Candidates.CENTER;
import static com.venue.scout.recommender.test.Candidates.place;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CandidateAggregatorTest {

    private ExecutorService pool;
    private GeocodingEnricher enricher;
    private AggregationProperties props;

    @BeforeEach
    void setUp() {
        pool = Executors.newFixedThreadPool(4);
        enricher = mock(GeocodingEnricher.class);
        when(enricher.enrich(anyList())).thenAnswer(inv -> inv.getArgument(0));
        props = new AggregationProperties();
        props.setAdapterTimeout(Duration.ofSeconds(2));
        props.setOverallTimeout(Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private CandidateAggregator aggregator(SourceAdapter... adapters) {
        return new CandidateAggregator(List.of(adapters), pool, enricher, props);
    }

    private static AggregationQuery query() {
        return new AggregationQuery(CENTER, 5000, List.of("coffee"), 20);
    }

    /** Adapter that answers with {@code count(radius)} candidates and records the radii it was asked for. */
    private static final class RadiusAdapter implements SourceAdapter {
        private final List<Integer> radii = Collections.synchronizedList(new ArrayList<>());
        private final IntUnaryOperator count;

        RadiusAdapter(IntUnaryOperator count) {
            this.count = count;
        }

        @Override
        public SourceKind kind() {
            return SourceKind.PLACES;
        }

        @Override
        public boolean isAvailable() {
            return true;
        }

        @Override
        public List<UnifiedCandidate> search(GeoPoint center, int radiusMeters, List<String> interestHints, int limit) {
            radii.add(radiusMeters);
            List<UnifiedCandidate> out = new ArrayList<>();
            for (int i = 0; i < count.applyAsInt(radiusMeters); i++) out.add(place("gp-" + i, "coffee"));
            return out;
        }
    }

    private static SourceAdapter adapter(SourceKind kind, List<UnifiedCandidate> result) {
        SourceAdapter a = mock(SourceAdapter.class);
        when(a.kind()).thenReturn(kind);
        when(a.isAvailable()).thenReturn(true);
        when(a.search(any(), anyInt(), anyList(), anyInt())).thenReturn(result);
        return a;
    }

    @Test
    void mergesAdaptersAndKeepsFirstOccurrenceOfAnId() {
        props.setTargetCount(3);
        UnifiedCandidate fromPlaces = place("gp-2", "coffee");
        UnifiedCandidate duplicate = place("gp-2", "coffee").toBuilder().name("Other name").build();
        SourceAdapter places = adapter(SourceKind.PLACES, List.of(place("gp-1", "coffee"), fromPlaces));
        SourceAdapter osm = adapter(SourceKind.OPENSTREETMAP, List.of(duplicate, place("osm-1", "bars")));

        List<UnifiedCandidate> out = aggregator(places, osm).aggregate(query());

        assertThat(out).extracting(UnifiedCandidate::getId).containsExactly("gp-1", "gp-2", "osm-1");
        assertThat(out.get(1).getName()).isEqualTo(fromPlaces.getName());
    }

    @Test
    void smallPoolTriggersAtLeastOneRadiusExpansion() {
        RadiusAdapter adapter = new RadiusAdapter(r -> 8);

        List<UnifiedCandidate> out = aggregator(adapter).aggregate(query());

        assertThat(out).hasSize(8);
        assertThat(adapter.radii).hasSizeGreaterThanOrEqualTo(2);
        assertThat(adapter.radii.get(0)).isEqualTo(5000);
        assertThat(adapter.radii.get(1)).isGreaterThan(5000);
    }

    @Test
    void stopsExpandingWhenARoundAddsNothing() {
        RadiusAdapter adapter = new RadiusAdapter(r -> r > 5000 ? 16 : 8);

        List<UnifiedCandidate> out = aggregator(adapter).aggregate(query());

        assertThat(out).hasSize(16);
        assertThat(adapter.radii).containsExactly(5000, 7500, 10000);
    }

    @Test
    void radiusNeverExceedsTheCap() {
        props.setRadiusCapMeters(6000);
        RadiusAdapter adapter = new RadiusAdapter(r -> r / 1000);

        aggregator(adapter).aggregate(query());

        assertThat(adapter.radii).containsExactly(5000, 6000);
    }

    @Test
    void allAdaptersFailingGivesEmptyList() {
        SourceAdapter broken = mock(SourceAdapter.class);
        when(broken.isAvailable()).thenReturn(true);
        when(broken.search(any(), anyInt(), anyList(), anyInt())).thenThrow(new SourceUnavailableException("down"));
        SourceAdapter alsoBroken = mock(SourceAdapter.class);
        when(alsoBroken.isAvailable()).thenReturn(true);
        when(alsoBroken.search(any(), anyInt(), anyList(), anyInt())).thenThrow(new IllegalStateException("boom"));

        assertThat(aggregator(broken, alsoBroken).aggregate(query())).isEmpty();
    }

    @Test
    void unavailableAdaptersAreNeverQueried() {
        SourceAdapter off = mock(SourceAdapter.class);
        when(off.isAvailable()).thenReturn(false);

        assertThat(aggregator(off).aggregate(query())).isEmpty();
        verify(off, never()).search(any(), anyInt(), anyList(), anyInt());
    }

    @Test
    void slowAdapterDoesNotHoldBackTheOthers() {
        props.setTargetCount(1);
        props.setAdapterTimeout(Duration.ofMillis(200));
        SourceAdapter slow = mock(SourceAdapter.class);
        when(slow.isAvailable()).thenReturn(true);
        when(slow.search(any(), anyInt(), anyList(), anyInt())).thenAnswer(inv -> {
            Thread.sleep(2000);
            return List.of(place("tm-late", "live music"));
        });
        SourceAdapter fast = adapter(SourceKind.PLACES, List.of(place("gp-1", "coffee")));

        List<UnifiedCandidate> out = aggregator(slow, fast).aggregate(query());

        assertThat(out).extracting(UnifiedCandidate::getId).containsExactly("gp-1");
    }

    @Test
    void overallTimeoutReturnsPartialResults() {
        props.setAdapterTimeout(Duration.ofSeconds(10));
        props.setOverallTimeout(Duration.ofMillis(300));
        SourceAdapter hanging = mock(SourceAdapter.class);
        when(hanging.isAvailable()).thenReturn(true);
        when(hanging.search(any(), anyInt(), anyList(), anyInt())).thenAnswer(inv -> {
            Thread.sleep(3000);
            return List.of();
        });
        SourceAdapter fast = adapter(SourceKind.PLACES, List.of(place("gp-1", "coffee"), place("gp-2", "dining")));

        long started = System.nanoTime();
        List<UnifiedCandidate> out = aggregator(hanging, fast).aggregate(query());

        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(2));
        assertThat(out).extracting(UnifiedCandidate::getId).containsExactly("gp-1", "gp-2");
    }

    @Test
    void candidatesStillWithoutCoordinatesAreDropped() {
        props.setTargetCount(2);
        UnifiedCandidate unresolved = place("tm-1", "live music").toBuilder().coordinates(null).address("1 Main St").build();
        SourceAdapter feed = adapter(SourceKind.EVENT_FEED, List.of(unresolved, place("tm-2", "live music")));

        List<UnifiedCandidate> out = aggregator(feed).aggregate(query());

        assertThat(out).extracting(UnifiedCandidate::getId).containsExactly("tm-2");
    }
}
