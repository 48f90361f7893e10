package com.fieldservice.shared.util;

import com.uber.h3core.H3Core;

import java.io.IOException;

/**
 * Geographic helpers shared by services: coordinate validation, great-circle
 * distance in miles, and H3 cell addressing.
 * Resolution 15 ≈ 0.9 m², fine enough to key per-coordinate caches.
 */
public final class GeoUtil {

    public static final int CACHE_KEY_RESOLUTION = 15;
    public static final double EARTH_RADIUS_MILES = 3959.0;

    private static final H3Core h3;

    static {
        try {
            h3 = H3Core.newInstance();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to initialise H3Core", e);
        }
    }

    private GeoUtil() {}

    public static boolean isValidLatitude(double lat) {
        return lat >= -90.0 && lat <= 90.0;
    }

    public static boolean isValidLongitude(double lng) {
        return lng >= -180.0 && lng <= 180.0;
    }

    public static void validateCoordinates(double lat, double lng) {
        if (!isValidLatitude(lat)) {
            throw new IllegalArgumentException("Latitude must be between -90 and 90, got " + lat);
        }
        if (!isValidLongitude(lng)) {
            throw new IllegalArgumentException("Longitude must be between -180 and 180, got " + lng);
        }
    }

    public static String latLngToCell(double lat, double lng, int resolution) {
        return h3.latLngToCellAddress(lat, lng, resolution);
    }

    public static String cacheKeyCell(double lat, double lng) {
        return latLngToCell(lat, lng, CACHE_KEY_RESOLUTION);
    }

    public static double distanceMiles(double lat1, double lng1, double lat2, double lng2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLng = Math.toRadians(lng2 - lng1);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLng / 2) * Math.sin(dLng / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_MILES * c;
    }
}
