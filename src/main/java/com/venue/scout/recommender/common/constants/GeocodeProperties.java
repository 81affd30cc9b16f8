package com.venue.scout.recommender.common.constants;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "scout.geocode")
public class GeocodeProperties {

    private boolean enabled = true;
    private String apiKey = "";
    private String baseUrl = "https://maps.googleapis.com/maps/api/geocode/json";
    private int poolSize = 4;
    private Duration cacheTtl = Duration.ofDays(7);
    private Duration batchTimeout = Duration.ofSeconds(10);
}
