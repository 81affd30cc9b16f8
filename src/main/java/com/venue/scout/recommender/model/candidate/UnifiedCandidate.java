package com.venue.scout.recommender.model.candidate;

import com.venue.scout.recommender.enums.OpenState;
import com.venue.scout.recommender.enums.SourceKind;
import com.venue.scout.recommender.enums.SponsorTier;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Source-agnostic place or event. Rebuilt on every aggregation cycle and never persisted as such.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class UnifiedCandidate {
    private String id;            // source-prefixed, unique across sources
    private SourceKind source;
    private String name;
    private String address;
    private GeoPoint coordinates; // null until resolved
    @Builder.Default
    private List<String> categoryTags = new ArrayList<>();
    private String category;      // canonical primary category
    private Double rating;        // 0..5
    private Integer ratingCount;
    private Integer priceLevel;   // 0..4, null = unknown
    @Builder.Default
    private List<String> photos = new ArrayList<>();
    @Builder.Default
    private OpenState openState = OpenState.UNKNOWN;
    private EventWindow eventWindow;
    @Builder.Default
    private SponsorTier sponsorTier = SponsorTier.NONE;

    public boolean isTimeBound() {
        return eventWindow != null && eventWindow.start() != null;
    }

    public boolean isSponsored() {
        return sponsorTier != null && sponsorTier.isSponsored();
    }

    public boolean hasCoordinates() {
        return coordinates != null && coordinates.isValid();
    }
}
