package com.venue.scout.recommender.test.service.source;

import com.venue.scout.recommender.enums.SourceKind;
import com.venue.scout.recommender.enums.SponsorTier;
import com.venue.scout.recommender.model.candidate.UnifiedCandidate;
import com.venue.scout.recommender.model.documents.SponsoredListing;
import com.venue.scout.recommender.repo.documents.SponsoredListingRepo;
import com.venue.scout.recommender.service.source.CategoryMapper;
import com.venue.scout.recommender.service.source.SponsoredListingSourceAdapter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.mongodb.core.geo.GeoJsonPoint;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static com.venue.scout.recommender.test.Candidates.CENTER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SponsoredListingSourceAdapterTest {

    private static final Instant NOW = Instant.parse("2026-10-16T12:00:00Z");

    @Mock
    SponsoredListingRepo listingRepo;

    private static SponsoredListing listing(String id, SponsorTier tier, Instant endsAt) {
        return SponsoredListing.builder()
                .id(id)
                .name("Listing " + id)
                .location(new GeoJsonPoint(-74.0050, 40.7130))
                .category("cafe")
                .rating(4.4)
                .tier(tier)
                .campaignEndsAt(endsAt)
                .build();
    }

    @Test
    void onlyRunningSponsoredListingsBecomeCandidates() {
        when(listingRepo.findByLocationNear(any(), any(), any())).thenReturn(List.of(
                listing("a1", SponsorTier.PREMIUM, NOW.plus(Duration.ofDays(3))),
                listing("a2", SponsorTier.BOOSTED, NOW.minus(Duration.ofHours(1))),
                listing("a3", SponsorTier.NONE, null)));
        SponsoredListingSourceAdapter adapter =
                new SponsoredListingSourceAdapter(listingRepo, new CategoryMapper(), Clock.fixed(NOW, ZoneOffset.UTC));

        List<UnifiedCandidate> out = adapter.search(CENTER, 2000, List.of(), 10);

        assertThat(out).hasSize(1);
        UnifiedCandidate c = out.get(0);
        assertThat(c.getId()).isEqualTo("sp-a1");
        assertThat(c.getSource()).isEqualTo(SourceKind.SPONSORED);
        assertThat(c.getSponsorTier()).isEqualTo(SponsorTier.PREMIUM);
        assertThat(c.getCategory()).isEqualTo("coffee");
        assertThat(c.getCoordinates().lat()).isEqualTo(40.7130);
        assertThat(c.getCoordinates().lng()).isEqualTo(-74.0050);
    }
}
