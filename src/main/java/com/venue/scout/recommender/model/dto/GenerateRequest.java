package com.venue.scout.recommender.model.dto;

import com.venue.scout.recommender.model.candidate.GeoPoint;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record GenerateRequest(
        @NotBlank(message = "userId is required")
        String userId,

        @NotNull(message = "center is required")
        GeoPoint center,

        @Min(value = 100, message = "radiusMeters must be at least 100")
        @Max(value = 50000, message = "radiusMeters must be at most 50000")
        Integer radiusMeters,

        String category,

        @DecimalMin("0.0") @DecimalMax("5.0")
        Double minRating,

        Boolean openNow,

        @Min(0) @Max(4)
        Integer maxPriceLevel,

        boolean discovery,
        boolean infiniteScroll,
        List<String> excludedIds,

        @Min(1) @Max(50)
        Integer maxResults,

        GeoPoint home,
        GeoPoint work,
        String timeZone
) {
    public static final int DEFAULT_RADIUS_METERS = 5000;

    public int radiusOrDefault() {
        return radiusMeters == null ? DEFAULT_RADIUS_METERS : radiusMeters;
    }
}
