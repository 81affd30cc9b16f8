package com.venue.scout.recommender.common.constants;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Scoring weights and business-rule constants. Values are product-tuning decisions and can be
 * overridden under {@code scout.ranking.*}.
 */
@Data
@ConfigurationProperties(prefix = "scout.ranking")
public class RankingProperties {

    private double scoreCeiling = 150.0;
    private int defaultResultCount = 10;

    private Base base = new Base();
    private Location location = new Location();
    private Time time = new Time();
    private Feedback feedback = new Feedback();
    private Urgency urgency = new Urgency();
    private Boosts boosts = new Boosts();
    private Sponsorship sponsorship = new Sponsorship();
    private Diversity diversity = new Diversity();
    private EventBalance eventBalance = new EventBalance();
    private List<RecencyBand> recencyBands = defaultRecencyBands();

    @Data
    public static class Base {
        private double topInterest = 30;
        private double listedInterest = 20;
        private double noMatch = 10;
        private double noMatchDiscovery = 15;
        private double ratingExcellent = 4.5;
        private double ratingExcellentBonus = 12;
        private double ratingGreat = 4.0;
        private double ratingGreatBonus = 8;
        private double ratingGood = 3.5;
        private double ratingGoodBonus = 4;
        private int reviewsMany = 500;
        private double reviewsManyBonus = 8;
        private int reviewsSome = 200;
        private double reviewsSomeBonus = 5;
        private int reviewsFew = 50;
        private double reviewsFewBonus = 2;
        private double cap = 50;
    }

    @Data
    public static class Location {
        private double veryCloseMiles = 0.5;
        private double veryCloseScore = 20;
        private double walkingMiles = 1.0;
        private double walkingScore = 15;
        private double defaultMaxMiles = 5.0;
        private double beyondSlope = 2.0;
        private double anchorRadiusMiles = 1.0;
        private double anchorBonus = 5;
        private double commitmentRadiusMiles = 1.0;
        private double commitmentWithin2h = 8;
        private double commitmentWithin6h = 5;
        private double commitmentWithin24h = 2;
        private double cap = 25;
    }

    @Data
    public static class Time {
        private double preferredMatch = 5;
        private double perfectAffinity = 10;
        private double goodAffinity = 5;
        private double otherAffinity = 2;
        private double cap = 15;
    }

    @Data
    public static class Feedback {
        private double neutral = 8;
        private double favoriteCategory = 7;
        private double dislikedCategory = -5;
        private double priceWithinBudget = 3;
        private double candidateVotes = 4;
        private double max = 15;
        private double notInterestedCandidatePenalty = 20;
        private double notInterestedCategoryPenalty = 10;
        private int notInterestedCategoryThreshold = 3;
        private int collaborativeMinVotes = 3;
        private double collaborativeMax = 10;
        private double collaborativeMin = -5;
    }

    @Data
    public static class Urgency {
        private double passedPenalty = -100;
        private double within6h = 20;
        private double within24h = 15;
        private double within72h = 10;
        private double within7d = 5;
        private double later = 2;
    }

    @Data
    public static class Boosts {
        private double visitOnce = 3;
        private double visitRegular = 6;
        private int regularVisits = 3;
        private double ratedHigh = 8;
        private double ratedLow = -8;
        private double externalLike = 5;
        private double schedulePattern = 5;
        private double priceMatch = 3;
        private double pricePerLevelOver = -3;
        private double priceFloor = -6;
    }

    @Data
    public static class Sponsorship {
        private double premiumRatio = 0.30;
        private double boostedRatio = 0.15;
        private double lowRelevanceThreshold = 40;
        private double lowRelevanceCap = 10;
        private int topN = 5;
        private int maxSponsoredInTopN = 2;
    }

    @Data
    public static class Diversity {
        private int window = 15;
        private int topN = 10;
        private int minDistinctCategories = 7;
        private int overrepresentedThreshold = 3;
    }

    @Data
    public static class EventBalance {
        private int topN = 10;
        private int maxEventsInTopN = 4;
        private int guaranteeWindow = 20;
        private int minEventsInWindow = 2;
    }

    /**
     * Penalty applied when the candidate was shown less than {@code hours} ago.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RecencyBand {
        private double hours;
        private double penalty;
    }

    private static List<RecencyBand> defaultRecencyBands() {
        List<RecencyBand> bands = new ArrayList<>();
        bands.add(new RecencyBand(6, 40));
        bands.add(new RecencyBand(12, 30));
        bands.add(new RecencyBand(24, 25));
        bands.add(new RecencyBand(48, 12));
        bands.add(new RecencyBand(72, 5));
        return bands;
    }
}
