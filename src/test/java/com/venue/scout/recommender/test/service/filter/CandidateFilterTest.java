package com.venue.scout.recommender.test.service.filter;

import com.venue.scout.recommender.common.constants.AggregationProperties;
import com.venue.scout.recommender.enums.OpenState;
import com.venue.scout.recommender.model.candidate.UnifiedCandidate;
import com.venue.scout.recommender.service.filter.CandidateFilter;
import com.venue.scout.recommender.service.filter.FilterCriteria;
import com.venue.scout.recommender.service.source.CategoryMapper;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static com.venue.scout.recommender.test.Candidates.place;
import static org.assertj.core.api.Assertions.assertThat;

class CandidateFilterTest {

    private final CandidateFilter filter = new CandidateFilter(new CategoryMapper(), new AggregationProperties());

    @Test
    void blockedAndGenericPlacesAreRemoved() {
        List<UnifiedCandidate> pool = List.of(
                place("gp-1", "coffee"),
                place("gp-2", "coffee").toBuilder().name("Starbucks Reserve").build(),
                place("gp-3", "dining").toBuilder().name("McDonald's").build(),
                place("gp-4", "outdoor").toBuilder().name("Chase Bank Plaza").build());

        List<UnifiedCandidate> out = filter.apply(pool, FilterCriteria.none(), Set.of("gp-1"));

        assertThat(out).extracting(UnifiedCandidate::getId).containsExactly("gp-2");
    }

    @Test
    void requestCriteriaNarrowThePool() {
        List<UnifiedCandidate> pool = List.of(
                place("gp-1", "coffee").toBuilder().rating(4.5).priceLevel(2).openState(OpenState.OPEN).build(),
                place("gp-2", "cafe").toBuilder().rating(3.9).build(),
                place("gp-3", "coffee").toBuilder().rating(4.8).openState(OpenState.CLOSED).build(),
                place("gp-4", "coffee").toBuilder().rating(4.2).priceLevel(4).build(),
                place("gp-5", "coffee").toBuilder().rating(4.9).priceLevel(0).build(),
                place("gp-6", "dining").toBuilder().rating(4.9).build());
        FilterCriteria criteria = new FilterCriteria("Cafes", 4.0, true, 2, Set.of(), false);

        List<UnifiedCandidate> out = filter.apply(pool, criteria, Set.of());

        assertThat(out).extracting(UnifiedCandidate::getId).containsExactly("gp-1", "gp-5");
    }

    @Test
    void exclusionListIsWaivedWhenTooFewFreshRemain() {
        List<UnifiedCandidate> pool = new ArrayList<>();
        for (int i = 0; i < 12; i++) pool.add(place("gp-" + i, "coffee"));
        Set<String> seen = Set.of("gp-0", "gp-1", "gp-2", "gp-3", "gp-4");

        List<UnifiedCandidate> fresh = filter.apply(pool, new FilterCriteria(null, null, null, null, seen, false), Set.of());
        List<UnifiedCandidate> scroll = filter.apply(pool, new FilterCriteria(null, null, null, null, seen, true), Set.of());

        assertThat(fresh).hasSize(12);
        assertThat(scroll).hasSize(7).noneMatch(c -> seen.contains(c.getId()));
    }

    @Test
    void exclusionListAppliesWhenEnoughFreshRemain() {
        List<UnifiedCandidate> pool = new ArrayList<>();
        for (int i = 0; i < 15; i++) pool.add(place("gp-" + i, "coffee"));

        List<UnifiedCandidate> out = filter.apply(pool,
                new FilterCriteria(null, null, null, null, Set.of("gp-0", "gp-1"), false), Set.of());

        assertThat(out).hasSize(13);
    }
}
