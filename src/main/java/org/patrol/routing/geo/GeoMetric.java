package org.patrol.routing.geo;

import lombok.experimental.UtilityClass;

/**
 * Great-circle distance and walking-time conversions.
 *
 * <p>All inputs are geodetic degrees. Distances are kilometres, durations minutes.</p>
 */
@UtilityClass
public final class GeoMetric {
    public static final double EARTH_RADIUS_KM = 6_371.0d;
    public static final double DEFAULT_WALKING_SPEED_KMH = 5.0d;

    private static final double MINUTES_PER_HOUR = 60.0d;

    /**
     * Computes great-circle distance in kilometres using haversine formulation.
     *
     * <p>Identical coordinates yield exactly {@code 0}, including the same meridian
     * written as {@code 180} and {@code -180}; antipodal points yield
     * {@code PI * EARTH_RADIUS_KM}.</p>
     */
    public static double distanceKm(double lat1Deg, double lon1Deg, double lat2Deg, double lon2Deg) {
        double deltaLonDeg = normalizeDeltaLongitudeDegrees(lon2Deg - lon1Deg);
        if (lat1Deg == lat2Deg && deltaLonDeg == 0.0d) {
            return 0.0d;
        }
        double lat1Rad = Math.toRadians(lat1Deg);
        double lat2Rad = Math.toRadians(lat2Deg);
        double deltaLatRad = Math.toRadians(lat2Deg - lat1Deg);
        double deltaLonRad = Math.toRadians(deltaLonDeg);

        double sinHalfLat = Math.sin(deltaLatRad * 0.5d);
        double sinHalfLon = Math.sin(deltaLonRad * 0.5d);

        double a = sinHalfLat * sinHalfLat
                + Math.cos(lat1Rad) * Math.cos(lat2Rad) * sinHalfLon * sinHalfLon;
        double c = 2.0d * Math.asin(Math.sqrt(clamp(a, 0.0d, 1.0d)));
        return EARTH_RADIUS_KM * c;
    }

    /**
     * Computes great-circle distance in kilometres between two positioned values.
     */
    public static double distanceKm(GeoPoint a, GeoPoint b) {
        return distanceKm(a.latitude(), a.longitude(), b.latitude(), b.longitude());
    }

    /**
     * Converts a distance into minutes at the supplied constant speed.
     *
     * @param distanceKm travelled distance in kilometres.
     * @param speedKmh travel speed, must be positive.
     * @return travel duration in minutes.
     */
    public static double travelTimeMinutes(double distanceKm, double speedKmh) {
        if (!(speedKmh > 0.0d) || !Double.isFinite(speedKmh)) {
            throw new IllegalArgumentException("speedKmh must be finite and > 0: " + speedKmh);
        }
        return distanceKm / speedKmh * MINUTES_PER_HOUR;
    }

    /**
     * Converts a distance into minutes at {@link #DEFAULT_WALKING_SPEED_KMH}.
     */
    public static double travelTimeMinutes(double distanceKm) {
        return travelTimeMinutes(distanceKm, DEFAULT_WALKING_SPEED_KMH);
    }

    /**
     * Normalizes delta-longitude into the principal range {@code (-180, 180]}.
     */
    static double normalizeDeltaLongitudeDegrees(double deltaLonDeg) {
        double normalized = ((deltaLonDeg + 540.0d) % 360.0d) - 180.0d;
        if (normalized == -180.0d) {
            return 180.0d;
        }
        return normalized;
    }

    private static double clamp(double value, double min, double max) {
        if (value < min) {
            return min;
        }
        if (value > max) {
            return max;
        }
        return value;
    }
}
