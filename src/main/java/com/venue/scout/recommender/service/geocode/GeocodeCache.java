package com.venue.scout.recommender.service.geocode;

import com.venue.scout.recommender.common.constants.GeocodeProperties;
import com.venue.scout.recommender.common.constants.ScoutConsts;
import com.venue.scout.recommender.core.TtlStateStore;
import com.venue.scout.recommender.model.candidate.GeoPoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * Address to coordinate cache on top of the TTL state store. Keys are normalized addresses.
 */
@Component
@Slf4j
public class GeocodeCache {

    private final TtlStateStore store;
    private final GeocodeProperties props;

    public GeocodeCache(TtlStateStore store, GeocodeProperties props) {
        this.store = store;
        this.props = props;
    }

    public Optional<GeoPoint> get(String address) {
        return store.get(key(address)).flatMap(GeocodeCache::decode);
    }

    public void put(String address, GeoPoint point) {
        store.put(key(address), point.lat() + "," + point.lng(), props.getCacheTtl());
    }

    static String key(String address) {
        return ScoutConsts.Keys.GEOCODE + address.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }

    private static Optional<GeoPoint> decode(String raw) {
        String[] parts = raw.split(",", 2);
        if (parts.length != 2) return Optional.empty();
        try {
            return Optional.of(new GeoPoint(Double.parseDouble(parts[0]), Double.parseDouble(parts[1])));
        } catch (NumberFormatException e) {
            log.debug("geocode.cache: corrupt entry '{}'", raw);
            return Optional.empty();
        }
    }
}
