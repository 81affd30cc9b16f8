package com.venue.scout.recommender.model.documents;

import com.venue.scout.recommender.enums.SponsorTier;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.geo.GeoJsonPoint;
import org.springframework.data.mongodb.core.index.GeoSpatialIndexType;
import org.springframework.data.mongodb.core.index.GeoSpatialIndexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Document("sponsored_listings")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SponsoredListing {
    @Id
    private String id;
    private String name;
    private String address;
    @GeoSpatialIndexed(type = GeoSpatialIndexType.GEO_2DSPHERE)
    private GeoJsonPoint location; // x = lng, y = lat
    private String category;
    private Double rating;
    private Integer ratingCount;
    private Integer priceLevel;
    private SponsorTier tier;
    private Instant campaignStartsAt;
    private Instant campaignEndsAt;
    @Builder.Default
    private List<String> photos = new ArrayList<>();

    public boolean isRunningAt(Instant now) {
        return (campaignStartsAt == null || !now.isBefore(campaignStartsAt))
                && (campaignEndsAt == null || now.isBefore(campaignEndsAt));
    }
}
