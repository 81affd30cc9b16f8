package com.venue.scout.recommender.model.scoring;

import com.venue.scout.recommender.model.candidate.UnifiedCandidate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Comparator;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ScoredCandidate {

    /** Highest score first; ties broken by id for a deterministic order. */
    public static final Comparator<ScoredCandidate> BY_SCORE_DESC =
            Comparator.comparingDouble(ScoredCandidate::getFinalScore).reversed()
                    .thenComparing(ScoredCandidate::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private UnifiedCandidate candidate;
    private ScoreBreakdown breakdown;
    private double finalScore;
    private String category;
    private double distanceMiles;
    private String explanation;

    public String getId() {
        return candidate == null ? null : candidate.getId();
    }

    public boolean isTimeBound() {
        return candidate != null && candidate.isTimeBound();
    }

    public boolean isSponsored() {
        return candidate != null && candidate.isSponsored();
    }

    /** Time-bound entry whose urgency term carries the started-or-over penalty. */
    public boolean isPassedEvent() {
        return isTimeBound() && breakdown != null && breakdown.getEventUrgency() < 0;
    }
}
