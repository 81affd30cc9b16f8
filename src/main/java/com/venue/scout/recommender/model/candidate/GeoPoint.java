package com.venue.scout.recommender.model.candidate;

import com.venue.scout.recommender.common.constants.ScoutConsts;

/**
 * WGS84 coordinate pair.
 */
public record GeoPoint(double lat, double lng) {

    public boolean isValid() {
        return !Double.isNaN(lat) && !Double.isNaN(lng)
                && lat >= -90 && lat <= 90 && lng >= -180 && lng <= 180;
    }

    /** Great-circle distance in miles (Haversine). */
    public double milesTo(GeoPoint other) {
        double dLat = Math.toRadians(other.lat - lat);
        double dLng = Math.toRadians(other.lng - lng);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat)) * Math.cos(Math.toRadians(other.lat))
                * Math.sin(dLng / 2) * Math.sin(dLng / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return ScoutConsts.Geo.EARTH_RADIUS_MILES * c;
    }

    /** Key of the grid cell this point falls in, used to share cached pools between nearby requests. */
    public String cellKey() {
        double f = Math.pow(10, ScoutConsts.Geo.CELL_DECIMALS);
        return (Math.round(lat * f) / f) + "," + (Math.round(lng * f) / f);
    }
}
