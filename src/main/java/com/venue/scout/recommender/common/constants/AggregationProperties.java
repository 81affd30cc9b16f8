package com.venue.scout.recommender.common.constants;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "scout.aggregation")
public class AggregationProperties {

    private int targetCount = 30;
    private int radiusCapMeters = 50_000;
    private int maxExpansions = 3;
    private double expansionStep = 0.5;
    private int perAdapterLimit = 20;
    private int infiniteScrollLimit = 50;
    private Duration adapterTimeout = Duration.ofSeconds(6);
    private Duration overallTimeout = Duration.ofSeconds(15);
    private int minFreshThreshold = 10;
    private Duration poolCacheMaxAge = Duration.ofHours(24);
}
