package com.venue.scout.recommender.model.scoring;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Signed terms contributed by connected personal data sources. Zero when a source has no data.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DataSourceBoosts {
    private double visits;
    private double personalRating;
    private double externalLikes;
    private double schedulePattern;
    private double priceMatch;

    public static DataSourceBoosts none() {
        return new DataSourceBoosts();
    }

    public double total() {
        return visits + personalRating + externalLikes + schedulePattern + priceMatch;
    }
}
