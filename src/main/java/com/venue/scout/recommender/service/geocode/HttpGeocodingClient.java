package com.venue.scout.recommender.service.geocode;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.venue.scout.recommender.common.constants.GeocodeProperties;
import com.venue.scout.recommender.common.exception.SourceConfigurationException;
import com.venue.scout.recommender.common.exception.SourceUnavailableException;
import com.venue.scout.recommender.model.candidate.GeoPoint;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

/**
 * Geocoding API client (Google Geocoding response shape).
 */
@Component
@Slf4j
public class HttpGeocodingClient implements GeocodingClient {

    private final HttpClient httpClient;
    private final GeocodeProperties props;

    public HttpGeocodingClient(HttpClient providerHttpClient, GeocodeProperties props) {
        this.httpClient = providerHttpClient;
        this.props = props;
    }

    @Override
    public boolean isAvailable() {
        return props.isEnabled() && props.getApiKey() != null && !props.getApiKey().isBlank();
    }

    @Override
    @Retry(name = "geocoding")
    public Optional<GeoPoint> geocode(String address) {
        if (!isAvailable()) return Optional.empty();
        String url = props.getBaseUrl()
                + "?address=" + URLEncoder.encode(address, StandardCharsets.UTF_8)
                + "&key=" + URLEncoder.encode(props.getApiKey(), StandardCharsets.UTF_8);
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(5))
                .GET()
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                throw new SourceUnavailableException("Geocoding returned HTTP " + response.statusCode());
            }
            return parse(response.body());
        } catch (IOException e) {
            throw new SourceUnavailableException("Geocoding request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceUnavailableException("Geocoding interrupted", e);
        }
    }

    /**
     * ZERO_RESULTS is a miss; denied and invalid requests are configuration errors; quota and other
     * statuses are transient.
     */
    public Optional<GeoPoint> parse(String body) {
        JsonObject root = JsonParser.parseString(body).getAsJsonObject();
        String status = root.has("status") ? root.get("status").getAsString() : "OK";
        switch (status) {
            case "OK":
                break;
            case "ZERO_RESULTS":
                return Optional.empty();
            case "REQUEST_DENIED":
            case "INVALID_REQUEST":
                throw new SourceConfigurationException("Geocoding rejected: " + status);
            default:
                throw new SourceUnavailableException("Geocoding status " + status);
        }
        if (!root.has("results") || root.getAsJsonArray("results").isEmpty()) return Optional.empty();
        JsonObject first = root.getAsJsonArray("results").get(0).getAsJsonObject();
        if (!first.has("geometry")) return Optional.empty();
        JsonObject loc = first.getAsJsonObject("geometry").getAsJsonObject("location");
        if (loc == null || !loc.has("lat") || !loc.has("lng")) return Optional.empty();
        GeoPoint p = new GeoPoint(loc.get("lat").getAsDouble(), loc.get("lng").getAsDouble());
        return p.isValid() ? Optional.of(p) : Optional.empty();
    }
}
