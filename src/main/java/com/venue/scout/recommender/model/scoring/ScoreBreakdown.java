package com.venue.scout.recommender.model.scoring;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-component contributions to a candidate's score. Penalties are stored as non-positive values.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoreBreakdown {
    private double base;
    private double location;
    private double time;
    private double feedback;
    private double collaborative;
    private double eventUrgency;
    private double sponsoredBoost;
    private double recencyPenalty;
    private double declinePenalty;
    @Builder.Default
    private DataSourceBoosts dataSourceBoosts = DataSourceBoosts.none();

    /** Sum of everything except the sponsorship boost. */
    public double preBoostTotal() {
        double boosts = dataSourceBoosts == null ? 0 : dataSourceBoosts.total();
        return base + location + time + feedback + collaborative + eventUrgency
                + recencyPenalty + declinePenalty + boosts;
    }

    public double total() {
        return preBoostTotal() + sponsoredBoost;
    }
}
