package com.venue.scout.recommender.service.source;

import com.venue.scout.recommender.enums.OpenState;
import com.venue.scout.recommender.enums.SourceKind;
import com.venue.scout.recommender.enums.SponsorTier;
import com.venue.scout.recommender.model.candidate.GeoPoint;
import com.venue.scout.recommender.model.candidate.UnifiedCandidate;
import com.venue.scout.recommender.model.documents.SponsoredListing;
import com.venue.scout.recommender.model.payload.SponsoredListingPayload;
import com.venue.scout.recommender.repo.documents.SponsoredListingRepo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.geo.Distance;
import org.springframework.data.geo.Metrics;
import org.springframework.data.geo.Point;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Paid listings stored alongside the recommendation data. Only listings with a running campaign
 * and a sponsor tier are returned.
 */
@Component
@Order(4)
@Slf4j
public class SponsoredListingSourceAdapter implements SourceAdapter {

    static final String ID_PREFIX = "sp-";

    private final SponsoredListingRepo listingRepo;
    private final CategoryMapper categories;
    private final Clock clock;

    @Value("${scout.sources.sponsored.enabled:true}")
    private boolean enabled = true;

    public SponsoredListingSourceAdapter(SponsoredListingRepo listingRepo, CategoryMapper categories, Clock clock) {
        this.listingRepo = listingRepo;
        this.categories = categories;
        this.clock = clock;
    }

    @Override
    public SourceKind kind() {
        return SourceKind.SPONSORED;
    }

    @Override
    public boolean isAvailable() {
        return enabled;
    }

    @Override
    public List<UnifiedCandidate> search(GeoPoint center, int radiusMeters, List<String> interestHints, int limit) {
        Instant now = clock.instant();
        // GeoJSON points are (lng, lat)
        List<SponsoredListing> rows = listingRepo.findByLocationNear(
                new Point(center.lng(), center.lat()),
                new Distance(radiusMeters / 1000.0, Metrics.KILOMETERS),
                PageRequest.of(0, Math.max(1, limit)));

        List<UnifiedCandidate> out = new ArrayList<>();
        for (SponsoredListing l : rows) {
            if (!l.isRunningAt(now) || l.getLocation() == null) continue;
            toCandidate(new SponsoredListingPayload(
                    l.getId(), l.getName(), l.getAddress(),
                    l.getLocation().getY(), l.getLocation().getX(),
                    l.getCategory(), l.getRating(), l.getRatingCount(), l.getPriceLevel(),
                    l.getTier(), l.getCampaignEndsAt(), l.getPhotos()))
                    .ifPresent(out::add);
        }
        log.debug("sponsored.search radius={} -> {}", radiusMeters, out.size());
        return out;
    }

    public Optional<UnifiedCandidate> toCandidate(SponsoredListingPayload p) {
        if (p.listingId() == null || p.name() == null || p.name().isBlank()) return Optional.empty();
        if (p.tier() == null || !p.tier().isSponsored()) return Optional.empty();
        GeoPoint coords = new GeoPoint(p.lat(), p.lng());
        if (!coords.isValid()) return Optional.empty();

        String category = categories.normalize(p.category());
        List<String> tags = new ArrayList<>();
        tags.add(category);
        return Optional.of(UnifiedCandidate.builder()
                .id(ID_PREFIX + p.listingId())
                .source(SourceKind.SPONSORED)
                .name(p.name())
                .address(p.address())
                .coordinates(coords)
                .categoryTags(tags)
                .category(category)
                .rating(p.rating())
                .ratingCount(p.ratingCount())
                .priceLevel(p.priceLevel())
                .photos(p.photos() == null ? new ArrayList<>() : new ArrayList<>(p.photos()))
                .openState(OpenState.UNKNOWN)
                .sponsorTier(p.tier() == null ? SponsorTier.NONE : p.tier())
                .build());
    }
}
