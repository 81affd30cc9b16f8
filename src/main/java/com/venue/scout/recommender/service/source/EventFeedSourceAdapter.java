package com.venue.scout.recommender.service.source;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.venue.scout.recommender.common.constants.ScoutConsts;
import com.venue.scout.recommender.common.exception.SourceConfigurationException;
import com.venue.scout.recommender.enums.OpenState;
import com.venue.scout.recommender.enums.SourceKind;
import com.venue.scout.recommender.model.candidate.EventWindow;
import com.venue.scout.recommender.model.candidate.GeoPoint;
import com.venue.scout.recommender.model.candidate.UnifiedCandidate;
import com.venue.scout.recommender.model.payload.EventFeedPayload;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import static com.venue.scout.recommender.service.source.JsonFields.firstObject;
import static com.venue.scout.recommender.service.source.JsonFields.optArray;
import static com.venue.scout.recommender.service.source.JsonFields.optDouble;
import static com.venue.scout.recommender.service.source.JsonFields.optObject;
import static com.venue.scout.recommender.service.source.JsonFields.optString;

/**
 * Upcoming events from a Discovery style event feed. Produces time-bound candidates.
 */
@Component
@Order(3)
@Slf4j
public class EventFeedSourceAdapter extends AbstractHttpSourceAdapter {

    static final String ID_PREFIX = "tm-";

    private final CategoryMapper categories;
    private final Clock clock;

    @Value("${scout.sources.events.enabled:true}")
    private boolean enabled;

    @Value("${scout.sources.events.api-key:}")
    private String apiKey;

    @Value("${scout.sources.events.base-url:https://app.ticketmaster.com/discovery/v2/events.json}")
    private String baseUrl;

    @Value("${scout.sources.events.max-days-ahead:30}")
    private int maxDaysAhead = 30;

    @Value("${scout.sources.events.request-timeout-ms:5000}")
    private long requestTimeoutMs;

    public EventFeedSourceAdapter(HttpClient providerHttpClient, CategoryMapper categories, Clock clock) {
        super(providerHttpClient);
        this.categories = categories;
        this.clock = clock;
    }

    @Override
    public SourceKind kind() {
        return SourceKind.EVENT_FEED;
    }

    @Override
    public boolean isAvailable() {
        return enabled && !isBlank(apiKey);
    }

    @Override
    @Retry(name = "eventFeedSource")
    @CircuitBreaker(name = "eventFeedSource")
    public List<UnifiedCandidate> search(GeoPoint center, int radiusMeters, List<String> interestHints, int limit) {
        if (isBlank(apiKey)) throw new SourceConfigurationException("Event feed API key is not configured");

        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        long radiusMiles = Math.max(1, Math.round(radiusMeters / ScoutConsts.Geo.METERS_PER_MILE));
        String url = baseUrl
                + "?apikey=" + URLEncoder.encode(apiKey, StandardCharsets.UTF_8)
                + "&latlong=" + center.lat() + "," + center.lng()
                + "&radius=" + radiusMiles + "&unit=miles"
                + "&size=" + Math.max(1, limit)
                + "&sort=date,asc"
                + "&startDateTime=" + now
                + "&endDateTime=" + now.plus(maxDaysAhead, ChronoUnit.DAYS);
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .header("Accept", "application/json")
                .timeout(Duration.ofMillis(requestTimeoutMs))
                .GET()
                .build();

        List<UnifiedCandidate> out = new ArrayList<>();
        for (EventFeedPayload p : parse(send(request))) {
            toCandidate(p).ifPresent(out::add);
            if (out.size() >= limit) break;
        }
        log.debug("events.search radiusMiles={} -> {}", radiusMiles, out.size());
        return out;
    }

    public List<EventFeedPayload> parse(String body) {
        JsonObject root = JsonParser.parseString(body).getAsJsonObject();
        JsonObject embedded = optObject(root, "_embedded");
        List<EventFeedPayload> out = new ArrayList<>();
        for (JsonElement el : optArray(embedded, "events")) {
            JsonObject e = el.getAsJsonObject();
            JsonObject dates = optObject(e, "dates");
            JsonObject start = optObject(dates, "start");
            JsonObject end = optObject(dates, "end");
            JsonObject venue = firstObject(optObject(e, "_embedded"), "venues");
            JsonObject location = optObject(venue, "location");
            JsonObject classification = firstObject(e, "classifications");
            JsonObject priceRange = firstObject(e, "priceRanges");

            List<String> images = new ArrayList<>();
            optArray(e, "images").forEach(img -> {
                String u = optString(img.getAsJsonObject(), "url");
                if (u != null) images.add(u);
            });

            out.add(new EventFeedPayload(
                    optString(e, "id"),
                    optString(e, "name"),
                    optString(start, "dateTime"),
                    optString(end, "dateTime"),
                    optString(venue, "name"),
                    venueAddress(venue),
                    optString(location, "latitude"),
                    optString(location, "longitude"),
                    optString(optObject(classification, "segment"), "name"),
                    optString(optObject(classification, "genre"), "name"),
                    optDouble(priceRange, "min"),
                    images));
        }
        return out;
    }

    /**
     * Drops events without id, name or parsable start, events already over, events beyond the
     * look-ahead horizon and venues that cannot be located.
     */
    public Optional<UnifiedCandidate> toCandidate(EventFeedPayload p) {
        if (isBlank(p.eventId()) || isBlank(p.name()) || isBlank(p.startDateTime())) return Optional.empty();
        Instant now = clock.instant();
        Instant start;
        Instant end;
        try {
            start = Instant.parse(p.startDateTime());
            end = isBlank(p.endDateTime()) ? null : Instant.parse(p.endDateTime());
        } catch (DateTimeParseException e) {
            log.debug("events: unparsable date on {}: {}", p.eventId(), e.getMessage());
            return Optional.empty();
        }
        if (end != null && !now.isBefore(end)) return Optional.empty();
        if (start.isAfter(now.plus(maxDaysAhead, ChronoUnit.DAYS))) return Optional.empty();

        GeoPoint coords = null;
        if (!isBlank(p.venueLatitude()) && !isBlank(p.venueLongitude())) {
            try {
                coords = new GeoPoint(Double.parseDouble(p.venueLatitude().trim()), Double.parseDouble(p.venueLongitude().trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
            if (!coords.isValid()) return Optional.empty();
        } else if (isBlank(p.venueAddress())) {
            return Optional.empty();
        }

        List<String> tags = new ArrayList<>();
        if (p.segment() != null) tags.add(p.segment().toLowerCase(Locale.ROOT));
        if (p.genre() != null) tags.add(p.genre().toLowerCase(Locale.ROOT));
        return Optional.of(UnifiedCandidate.builder()
                .id(ID_PREFIX + p.eventId())
                .source(SourceKind.EVENT_FEED)
                .name(p.name())
                .address(p.venueName() == null ? p.venueAddress()
                        : p.venueAddress() == null ? p.venueName() : p.venueName() + ", " + p.venueAddress())
                .coordinates(coords)
                .categoryTags(tags)
                .category(categories.fromEventSegment(p.segment(), p.genre()))
                .priceLevel(priceLevel(p.minPrice()))
                .photos(p.imageUrls() == null ? new ArrayList<>() : new ArrayList<>(p.imageUrls()))
                .openState(OpenState.UNKNOWN)
                .eventWindow(new EventWindow(start, end))
                .build());
    }

    static Integer priceLevel(Double minPrice) {
        if (minPrice == null) return null;
        if (minPrice <= 0) return 0;
        if (minPrice < 20) return 1;
        if (minPrice < 50) return 2;
        if (minPrice < 100) return 3;
        return 4;
    }

    private static String venueAddress(JsonObject venue) {
        String line = optString(optObject(venue, "address"), "line1");
        String city = optString(optObject(venue, "city"), "name");
        if (line == null) return city;
        return city == null ? line : line + ", " + city;
    }
}
