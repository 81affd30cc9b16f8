package com.venue.scout.recommender.service.rules;

import com.venue.scout.recommender.model.scoring.ScoredCandidate;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Keeps one listing per (normalized name, event date in the user's zone). Different feeds often
 * list the same event under different ids; the higher-scored copy stays.
 */
@Component
public class EventDedupRule implements RankingRule {

    @Override
    public String name() {
        return "event-dedup";
    }

    @Override
    public List<ScoredCandidate> apply(List<ScoredCandidate> ranked) {
        return apply(ranked, ZoneOffset.UTC);
    }

    @Override
    public List<ScoredCandidate> apply(List<ScoredCandidate> ranked, ZoneId zone) {
        List<ScoredCandidate> sorted = new ArrayList<>(ranked);
        sorted.sort(ScoredCandidate.BY_SCORE_DESC);
        Set<String> dropped = new HashSet<>();
        Set<String> keys = new HashSet<>();
        for (ScoredCandidate sc : sorted) {
            if (!sc.isTimeBound()) continue;
            if (!keys.add(key(sc, zone))) dropped.add(sc.getId());
        }
        if (dropped.isEmpty()) return new ArrayList<>(ranked);

        List<ScoredCandidate> out = new ArrayList<>(ranked.size());
        for (ScoredCandidate sc : ranked) {
            if (!(sc.isTimeBound() && dropped.contains(sc.getId()))) out.add(sc);
        }
        return out;
    }

    static String key(ScoredCandidate sc, ZoneId zone) {
        LocalDate date = sc.getCandidate().getEventWindow().start().atZone(zone).toLocalDate();
        return normalizeName(sc.getCandidate().getName()) + "|" + date;
    }

    static String normalizeName(String name) {
        if (name == null) return "";
        return name.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", " ")
                .trim()
                .replaceAll("\\s+", " ");
    }
}
