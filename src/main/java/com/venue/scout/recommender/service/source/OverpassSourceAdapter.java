package com.venue.scout.recommender.service.source;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.venue.scout.recommender.enums.OpenState;
import com.venue.scout.recommender.enums.SourceKind;
import com.venue.scout.recommender.model.candidate.GeoPoint;
import com.venue.scout.recommender.model.candidate.UnifiedCandidate;
import com.venue.scout.recommender.model.payload.OverpassPayload;
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
import java.util.Map;
import java.util.Optional;

import static com.venue.scout.recommender.service.source.JsonFields.optArray;
import static com.venue.scout.recommender.service.source.JsonFields.optDouble;
import static com.venue.scout.recommender.service.source.JsonFields.optObject;

/**
 * OpenStreetMap points of interest through the Overpass interpreter. Needs no credential.
 */
@Component
@Order(2)
@Slf4j
public class OverpassSourceAdapter extends AbstractHttpSourceAdapter {

    static final String ID_PREFIX = "osm-";

    private final CategoryMapper categories;

    @Value("${scout.sources.overpass.enabled:true}")
    private boolean enabled;

    @Value("${scout.sources.overpass.base-url:https://overpass-api.de/api/interpreter}")
    private String baseUrl;

    @Value("${scout.sources.overpass.request-timeout-ms:8000}")
    private long requestTimeoutMs;

    public OverpassSourceAdapter(HttpClient providerHttpClient, CategoryMapper categories) {
        super(providerHttpClient);
        this.categories = categories;
    }

    @Override
    public SourceKind kind() {
        return SourceKind.OPENSTREETMAP;
    }

    @Override
    public boolean isAvailable() {
        return enabled && !isBlank(baseUrl);
    }

    @Override
    @Retry(name = "overpassSource")
    @CircuitBreaker(name = "overpassSource")
    public List<UnifiedCandidate> search(GeoPoint center, int radiusMeters, List<String> interestHints, int limit) {
        String query = buildQuery(center, radiusMeters, categories.osmFiltersFor(interestHints), limit);
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl))
                .header("Content-Type", "application/x-www-form-urlencoded")
                .timeout(Duration.ofMillis(requestTimeoutMs))
                .POST(HttpRequest.BodyPublishers.ofString("data=" + URLEncoder.encode(query, StandardCharsets.UTF_8)))
                .build();

        List<UnifiedCandidate> out = new ArrayList<>();
        for (OverpassPayload p : parse(send(request))) {
            toCandidate(p).ifPresent(out::add);
            if (out.size() >= limit) break;
        }
        log.debug("overpass.search radius={} -> {}", radiusMeters, out.size());
        return out;
    }

    public String buildQuery(GeoPoint center, int radiusMeters, List<String> filters, int limit) {
        StringBuilder q = new StringBuilder("[out:json][timeout:25];(");
        for (String f : filters) {
            String[] kv = f.split("=", 2);
            q.append("node[\"").append(kv[0]).append("\"=\"").append(kv[1]).append("\"]")
                    .append("(around:").append(radiusMeters).append(',')
                    .append(center.lat()).append(',').append(center.lng()).append(");");
        }
        q.append(");out body ").append(Math.max(1, limit)).append(';');
        return q.toString();
    }

    public List<OverpassPayload> parse(String body) {
        JsonObject root = JsonParser.parseString(body).getAsJsonObject();
        List<OverpassPayload> out = new ArrayList<>();
        for (JsonElement el : optArray(root, "elements")) {
            JsonObject e = el.getAsJsonObject();
            if (!e.has("id")) continue;
            Map<String, String> tags = null;
            JsonObject t = optObject(e, "tags");
            if (t != null) {
                tags = new LinkedHashMap<>();
                for (Map.Entry<String, JsonElement> en : t.entrySet()) {
                    if (en.getValue().isJsonPrimitive()) tags.put(en.getKey(), en.getValue().getAsString());
                }
            }
            out.add(new OverpassPayload(e.get("id").getAsLong(), optDouble(e, "lat"), optDouble(e, "lon"), tags));
        }
        return out;
    }

    /**
     * Nodes without position, tags or a name are not usable.
     */
    public Optional<UnifiedCandidate> toCandidate(OverpassPayload p) {
        if (p.lat() == null || p.lon() == null || p.tags() == null || isBlank(p.tag("name"))) {
            return Optional.empty();
        }
        GeoPoint coords = new GeoPoint(p.lat(), p.lon());
        if (!coords.isValid()) return Optional.empty();

        List<String> tagList = new ArrayList<>();
        for (String key : List.of("amenity", "leisure", "tourism", "cuisine")) {
            String v = p.tag(key);
            if (v != null) tagList.add(v);
        }
        return Optional.of(UnifiedCandidate.builder()
                .id(ID_PREFIX + p.id())
                .source(SourceKind.OPENSTREETMAP)
                .name(p.tag("name"))
                .address(address(p))
                .coordinates(coords)
                .categoryTags(tagList)
                .category(categories.fromOsmTags(p.tags()))
                .priceLevel(inferPriceLevel(p))
                .openState(OpenState.UNKNOWN)
                .build());
    }

    static String address(OverpassPayload p) {
        String street = p.tag("addr:street");
        if (street == null) return null;
        String number = p.tag("addr:housenumber");
        String city = p.tag("addr:city");
        StringBuilder sb = new StringBuilder();
        if (number != null) sb.append(number).append(' ');
        sb.append(street);
        if (city != null) sb.append(", ").append(city);
        return sb.toString();
    }

    /** 0 for free places, 1 for fast food, explicit price tags when numeric, otherwise unknown. */
    static Integer inferPriceLevel(OverpassPayload p) {
        if ("no".equals(p.tag("fee"))) return 0;
        if ("fast_food".equals(p.tag("amenity"))) return 1;
        String explicit = p.tag("price_level");
        if (explicit != null) {
            try {
                int v = Integer.parseInt(explicit.trim());
                return Math.max(0, Math.min(4, v));
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
