package com.venue.scout.recommender.service.rules;

import com.venue.scout.recommender.common.constants.RankingProperties;
import com.venue.scout.recommender.common.constants.ScoutConsts;
import com.venue.scout.recommender.model.scoring.ScoredCandidate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Swaps entries into the top-N until it holds the configured number of distinct categories.
 *
 * <p>Each pass swaps at most once per overrepresented category: its lowest-scored top-N entry
 * leaves for the best entry of a category not yet in the top-N, looked up in the window first
 * and then in the rest of the list. Passes repeat until the minimum is met or nothing can move.
 * Swaps that would break the event or sponsorship balance are skipped, so the rule can also run
 * after those rules to win back categories they pushed out.
 */
@Component
@Slf4j
public class CategoryDiversityRule implements RankingRule {

    private final RankingProperties props;

    public CategoryDiversityRule(RankingProperties props) {
        this.props = props;
    }

    @Override
    public String name() {
        return "category-diversity";
    }

    @Override
    public List<ScoredCandidate> apply(List<ScoredCandidate> ranked) {
        RankingProperties.Diversity d = props.getDiversity();
        List<ScoredCandidate> list = new ArrayList<>(ranked);
        int topN = Math.min(d.getTopN(), list.size());
        if (topN == 0) return list;

        int swaps = 0;
        for (int pass = 0; pass < topN; pass++) {
            Map<String, Integer> counts = countTop(list, topN);
            if (counts.size() >= d.getMinDistinctCategories()) break;

            List<String> crowded = overrepresented(counts, d.getOverrepresentedThreshold());
            boolean swapped = false;
            for (String category : crowded) {
                if (counts.getOrDefault(category, 0) < 2) continue;
                int out = lowestOf(list, topN, category);
                int in = out < 0 ? -1 : firstNewCategory(list, topN, Math.min(d.getWindow(), list.size()), counts, out);
                if (out < 0 || in < 0) continue;

                ScoredCandidate leaving = list.get(out);
                ScoredCandidate entering = list.get(in);
                list.set(out, entering);
                list.set(in, leaving);
                counts.merge(category, -1, Integer::sum);
                counts.merge(categoryOf(entering), 1, Integer::sum);
                swapped = true;
                swaps++;
                if (counts.size() >= d.getMinDistinctCategories()) break;
            }
            if (!swapped) break;
        }
        if (swaps > 0) log.debug("rules.diversity: {} swaps", swaps);
        return list;
    }

    private static Map<String, Integer> countTop(List<ScoredCandidate> list, int topN) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (int i = 0; i < topN; i++) counts.merge(categoryOf(list.get(i)), 1, Integer::sum);
        return counts;
    }

    /** Categories at or over the threshold, most frequent first; count of two when none qualifies. */
    private static List<String> overrepresented(Map<String, Integer> counts, int threshold) {
        List<String> out = new ArrayList<>();
        for (Map.Entry<String, Integer> e : counts.entrySet()) {
            if (e.getValue() >= threshold) out.add(e.getKey());
        }
        if (out.isEmpty()) {
            for (Map.Entry<String, Integer> e : counts.entrySet()) {
                if (e.getValue() >= 2) out.add(e.getKey());
            }
        }
        out.sort((a, b) -> Integer.compare(counts.get(b), counts.get(a)));
        return out;
    }

    private static int lowestOf(List<ScoredCandidate> list, int topN, String category) {
        int idx = -1;
        double lowest = Double.MAX_VALUE;
        for (int i = 0; i < topN; i++) {
            ScoredCandidate sc = list.get(i);
            if (!category.equals(categoryOf(sc))) continue;
            if (sc.getFinalScore() <= lowest) {
                lowest = sc.getFinalScore();
                idx = i;
            }
        }
        return idx;
    }

    private int firstNewCategory(List<ScoredCandidate> list, int topN, int window, Map<String, Integer> present, int out) {
        for (int i = topN; i < window; i++) {
            if (!present.containsKey(categoryOf(list.get(i))) && keepsBalance(list, out, i)) return i;
        }
        for (int i = Math.max(topN, window); i < list.size(); i++) {
            if (!present.containsKey(categoryOf(list.get(i))) && keepsBalance(list, out, i)) return i;
        }
        return -1;
    }

    /**
     * A swap may not push events or sponsored entries over their top-N caps, nor drop the events
     * in the guarantee window below the minimum, unless the list already broke that bound.
     */
    private boolean keepsBalance(List<ScoredCandidate> list, int out, int in) {
        RankingProperties.EventBalance e = props.getEventBalance();
        RankingProperties.Sponsorship s = props.getSponsorship();

        int eventTop = Math.min(e.getTopN(), list.size());
        int eventsBefore = count(list, eventTop, -1, -1, ScoredCandidate::isTimeBound);
        int eventsAfter = count(list, eventTop, out, in, ScoredCandidate::isTimeBound);
        if (eventsAfter > eventsBefore && eventsAfter > e.getMaxEventsInTopN()) return false;

        int sponsoredTop = Math.min(s.getTopN(), list.size());
        int sponsoredBefore = count(list, sponsoredTop, -1, -1, ScoredCandidate::isSponsored);
        int sponsoredAfter = count(list, sponsoredTop, out, in, ScoredCandidate::isSponsored);
        if (sponsoredAfter > sponsoredBefore && sponsoredAfter > s.getMaxSponsoredInTopN()) return false;

        int window = Math.min(e.getGuaranteeWindow(), list.size());
        int windowBefore = count(list, window, -1, -1, ScoredCandidate::isTimeBound);
        int windowAfter = count(list, window, out, in, ScoredCandidate::isTimeBound);
        return windowAfter >= windowBefore || windowAfter >= e.getMinEventsInWindow();
    }

    /** Matches among the first {@code n} entries, as if {@code a} and {@code b} had traded places. */
    private static int count(List<ScoredCandidate> list, int n, int a, int b, Predicate<ScoredCandidate> p) {
        int hits = 0;
        for (int i = 0; i < n; i++) {
            int from = i == a ? b : i == b ? a : i;
            if (p.test(list.get(from))) hits++;
        }
        return hits;
    }

    static String categoryOf(ScoredCandidate sc) {
        return sc.getCategory() == null ? ScoutConsts.Categories.OTHER : sc.getCategory();
    }
}
