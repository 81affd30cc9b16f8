package com.venue.scout.recommender.service.scoring;

import com.venue.scout.recommender.enums.TimeOfDay;
import com.venue.scout.recommender.model.candidate.UnifiedCandidate;
import com.venue.scout.recommender.model.scoring.ScoreBreakdown;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Short human-readable reason line shown with a recommendation. At most two reasons, strongest first.
 */
@Component
public class ExplanationBuilder {

    static final String FALLBACK = "Recommended for you";
    private static final int MAX_REASONS = 2;

    public String explain(UnifiedCandidate c,
                          ScoreBreakdown breakdown,
                          double distanceMiles,
                          String matchedInterest,
                          TimeContextScorer.Affinity affinity,
                          TimeOfDay timeOfDay,
                          Instant now) {
        List<String> reasons = new ArrayList<>();

        if (c.isTimeBound() && breakdown.getEventUrgency() > 0) {
            long hours = Math.max(1, Duration.between(now, c.getEventWindow().start()).toHours());
            reasons.add(hours < 48 ? "Starts in " + hours + (hours == 1 ? " hour" : " hours")
                    : "Coming up in " + (hours / 24) + " days");
        }
        if (distanceMiles <= 0.5) reasons.add("Right near you");
        if (matchedInterest != null) reasons.add("Matches your love of " + matchedInterest.toLowerCase(Locale.ROOT));
        if (affinity == TimeContextScorer.Affinity.PERFECT) reasons.add("Perfect " + timeOfDay.label() + " spot");
        if (c.getRating() != null && c.getRating() >= 4.5) {
            reasons.add(String.format(Locale.ROOT, "Highly rated (%.1f stars)", c.getRating()));
        }
        if (breakdown.getDataSourceBoosts() != null && breakdown.getDataSourceBoosts().getVisits() > 0) {
            reasons.add("One of your regular spots");
        }

        if (reasons.isEmpty()) return FALLBACK;
        return String.join(" · ", reasons.subList(0, Math.min(MAX_REASONS, reasons.size())));
    }
}
