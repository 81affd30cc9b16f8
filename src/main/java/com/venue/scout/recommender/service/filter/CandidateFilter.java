package com.venue.scout.recommender.service.filter;

import com.venue.scout.recommender.common.constants.AggregationProperties;
import com.venue.scout.recommender.common.constants.ScoutConsts;
import com.venue.scout.recommender.enums.OpenState;
import com.venue.scout.recommender.model.candidate.UnifiedCandidate;
import com.venue.scout.recommender.service.source.CategoryMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Removes candidates the user must not see before they are scored.
 */
@Component
@Slf4j
public class CandidateFilter {

    private final CategoryMapper categories;
    private final AggregationProperties props;

    public CandidateFilter(CategoryMapper categories, AggregationProperties props) {
        this.categories = categories;
        this.props = props;
    }

    public List<UnifiedCandidate> apply(List<UnifiedCandidate> pool, FilterCriteria criteria, Set<String> blockedIds) {
        FilterCriteria f = criteria == null ? FilterCriteria.none() : criteria;
        List<UnifiedCandidate> kept = new ArrayList<>(pool.size());
        for (UnifiedCandidate c : pool) {
            if (blockedIds != null && blockedIds.contains(c.getId())) continue;
            if (isGeneric(c.getName())) continue;
            if (!matches(c, f)) continue;
            kept.add(c);
        }

        if (f.excludedIds().isEmpty()) return kept;

        List<UnifiedCandidate> fresh = new ArrayList<>(kept.size());
        for (UnifiedCandidate c : kept) {
            if (!f.excludedIds().contains(c.getId())) fresh.add(c);
        }
        // infinite scroll must never repeat; a fresh load prefers repeats to a near-empty feed
        if (f.infiniteScroll() || fresh.size() >= props.getMinFreshThreshold()) return fresh;
        log.info("filter: only {} fresh candidates, exclusion list waived", fresh.size());
        return kept;
    }

    boolean matches(UnifiedCandidate c, FilterCriteria f) {
        if (f.category() != null && !f.category().isBlank()) {
            String wanted = categories.normalize(f.category());
            if (!wanted.equals(categories.normalize(c.getCategory()))) return false;
        }
        if (f.minRating() != null && (c.getRating() == null || c.getRating() < f.minRating())) return false;
        if (Boolean.TRUE.equals(f.openNow()) && c.getOpenState() == OpenState.CLOSED) return false;
        if (f.maxPriceLevel() != null && c.getPriceLevel() != null
                && c.getPriceLevel() > 0 && c.getPriceLevel() > f.maxPriceLevel()) return false;
        return true;
    }

    static boolean isGeneric(String name) {
        if (name == null) return false;
        for (Pattern p : ScoutConsts.GENERIC_PLACE_PATTERNS) {
            if (p.matcher(name).find()) return true;
        }
        return false;
    }
}
