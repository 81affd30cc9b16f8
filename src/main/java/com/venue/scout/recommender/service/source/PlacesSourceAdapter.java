package com.venue.scout.recommender.service.source;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.venue.scout.recommender.common.exception.SourceConfigurationException;
import com.venue.scout.recommender.common.exception.SourceUnavailableException;
import com.venue.scout.recommender.enums.OpenState;
import com.venue.scout.recommender.enums.SourceKind;
import com.venue.scout.recommender.model.candidate.GeoPoint;
import com.venue.scout.recommender.model.candidate.UnifiedCandidate;
import com.venue.scout.recommender.model.payload.PlacesPayload;
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
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static com.venue.scout.recommender.service.source.JsonFields.optArray;
import static com.venue.scout.recommender.service.source.JsonFields.optDouble;
import static com.venue.scout.recommender.service.source.JsonFields.optInt;
import static com.venue.scout.recommender.service.source.JsonFields.optObject;
import static com.venue.scout.recommender.service.source.JsonFields.optString;
import static com.venue.scout.recommender.service.source.JsonFields.present;

/**
 * Nearby search against a Places style API, one request per category group.
 */
@Component
@Order(1)
@Slf4j
public class PlacesSourceAdapter extends AbstractHttpSourceAdapter {

    static final String ID_PREFIX = "gp-";
    // fresh loads query the first groups only; infinite scroll asks for more than this and gets all
    private static final int FRESH_LOAD_GROUPS = 3;
    private static final int FRESH_LOAD_LIMIT = 20;

    private final CategoryMapper categories;

    @Value("${scout.sources.places.enabled:true}")
    private boolean enabled;

    @Value("${scout.sources.places.api-key:}")
    private String apiKey;

    @Value("${scout.sources.places.base-url:https://maps.googleapis.com/maps/api/place/nearbysearch/json}")
    private String baseUrl;

    @Value("${scout.sources.places.request-timeout-ms:5000}")
    private long requestTimeoutMs;

    public PlacesSourceAdapter(HttpClient providerHttpClient, CategoryMapper categories) {
        super(providerHttpClient);
        this.categories = categories;
    }

    @Override
    public SourceKind kind() {
        return SourceKind.PLACES;
    }

    @Override
    public boolean isAvailable() {
        return enabled && !isBlank(apiKey);
    }

    @Override
    @Retry(name = "placesSource")
    @CircuitBreaker(name = "placesSource")
    public List<UnifiedCandidate> search(GeoPoint center, int radiusMeters, List<String> interestHints, int limit) {
        if (isBlank(apiKey)) throw new SourceConfigurationException("Places API key is not configured");

        int groups = limit > FRESH_LOAD_LIMIT ? categories.groupCount() : FRESH_LOAD_GROUPS;
        List<String> types = categories.placeTypesFor(interestHints, groups);

        Map<String, UnifiedCandidate> byId = new LinkedHashMap<>();
        for (String type : types) {
            String body = send(buildRequest(center, radiusMeters, type));
            for (PlacesPayload p : parse(body)) {
                toCandidate(p).ifPresent(c -> byId.putIfAbsent(c.getId(), c));
            }
            if (byId.size() >= limit) break;
        }
        List<UnifiedCandidate> out = new ArrayList<>(byId.values());
        log.debug("places.search types={} radius={} -> {}", types, radiusMeters, out.size());
        return out.size() > limit ? out.subList(0, limit) : out;
    }

    private HttpRequest buildRequest(GeoPoint center, int radiusMeters, String type) {
        String url = baseUrl
                + "?location=" + center.lat() + "," + center.lng()
                + "&radius=" + radiusMeters
                + "&type=" + URLEncoder.encode(type, StandardCharsets.UTF_8)
                + "&key=" + URLEncoder.encode(apiKey, StandardCharsets.UTF_8);
        return HttpRequest.newBuilder()
                .uri(URI.create(url))
                .header("Accept", "application/json")
                .timeout(Duration.ofMillis(requestTimeoutMs))
                .GET()
                .build();
    }

    /**
     * Provider status handling: ZERO_RESULTS is an empty page, denied or invalid requests are
     * configuration errors, anything else not OK is a transient failure.
     */
    public List<PlacesPayload> parse(String body) {
        JsonObject root = JsonParser.parseString(body).getAsJsonObject();
        String status = present(root, "status") ? root.get("status").getAsString() : "OK";
        switch (status) {
            case "OK":
                break;
            case "ZERO_RESULTS":
                return List.of();
            case "REQUEST_DENIED":
            case "INVALID_REQUEST":
                throw new SourceConfigurationException("Places request rejected: " + status + errorMessage(root));
            default:
                throw new SourceUnavailableException("Places status " + status + errorMessage(root));
        }

        JsonArray results = optArray(root, "results");
        List<PlacesPayload> out = new ArrayList<>(results.size());
        for (JsonElement el : results) {
            JsonObject r = el.getAsJsonObject();
            Double lat = null;
            Double lng = null;
            JsonObject loc = optObject(optObject(r, "geometry"), "location");
            if (loc != null) {
                lat = optDouble(loc, "lat");
                lng = optDouble(loc, "lng");
            }
            List<String> types = new ArrayList<>();
            optArray(r, "types").forEach(t -> types.add(t.getAsString()));
            List<String> photos = new ArrayList<>();
            optArray(r, "photos").forEach(ph -> {
                String ref = optString(ph.getAsJsonObject(), "photo_reference");
                if (ref != null) photos.add(ref);
            });
            JsonObject hours = optObject(r, "opening_hours");
            Boolean openNow = present(hours, "open_now") ? hours.get("open_now").getAsBoolean() : null;
            out.add(new PlacesPayload(
                    optString(r, "place_id"),
                    optString(r, "name"),
                    optString(r, "vicinity"),
                    lat, lng, types,
                    optDouble(r, "rating"),
                    optInt(r, "user_ratings_total"),
                    optInt(r, "price_level"),
                    photos,
                    openNow));
        }
        return out;
    }

    /**
     * Empty for entries that cannot be placed on a map or named.
     */
    public Optional<UnifiedCandidate> toCandidate(PlacesPayload p) {
        if (isBlank(p.placeId()) || isBlank(p.name())) return Optional.empty();
        GeoPoint coords = (p.lat() != null && p.lng() != null) ? new GeoPoint(p.lat(), p.lng()) : null;
        if ((coords == null || !coords.isValid()) && isBlank(p.vicinity())) return Optional.empty();

        List<String> tags = new ArrayList<>();
        if (p.types() != null) p.types().forEach(t -> tags.add(t.toLowerCase(Locale.ROOT)));
        return Optional.of(UnifiedCandidate.builder()
                .id(ID_PREFIX + p.placeId())
                .source(SourceKind.PLACES)
                .name(p.name())
                .address(p.vicinity())
                .coordinates(coords != null && coords.isValid() ? coords : null)
                .categoryTags(tags)
                .category(categories.fromPlaceTypes(p.types()))
                .rating(p.rating())
                .ratingCount(p.userRatingsTotal())
                .priceLevel(p.priceLevel())
                .photos(p.photoReferences() == null ? new ArrayList<>() : new ArrayList<>(p.photoReferences()))
                .openState(OpenState.of(p.openNow()))
                .build());
    }

    private static String errorMessage(JsonObject root) {
        String msg = optString(root, "error_message");
        return msg == null ? "" : " (" + msg + ")";
    }
}
