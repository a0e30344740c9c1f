package org.patrol.routing.route;

import lombok.Builder;
import lombok.Value;

/**
 * Daily route limits and walking model.
 *
 * <p>The builder accepts any value; {@link #validate()} is applied once by the
 * optimizer facade before searching.</p>
 */
@Value
@Builder(toBuilder = true)
public class RouteConstraints {
    public static final String REASON_MAX_TIME_NOT_POSITIVE = "CONFIG_MAX_TIME_NOT_POSITIVE";
    public static final String REASON_MAX_STOPS_NOT_POSITIVE = "CONFIG_MAX_STOPS_NOT_POSITIVE";
    public static final String REASON_WALKING_SPEED_NOT_POSITIVE = "CONFIG_WALKING_SPEED_NOT_POSITIVE";
    public static final String REASON_DWELL_NEGATIVE = "CONFIG_DWELL_NEGATIVE";
    public static final String REASON_ENUMERATION_POOL_NOT_POSITIVE = "CONFIG_ENUMERATION_POOL_NOT_POSITIVE";

    public static final double DEFAULT_MAX_TIME_MINUTES = 180.0d;
    public static final int DEFAULT_MAX_STOPS = 8;
    public static final double DEFAULT_DWELL_MINUTES = 5.0d;
    public static final double DEFAULT_WALKING_SPEED_KMH = 5.0d;
    public static final int DEFAULT_MAX_ENUMERATION_POOL_SIZE = 20;

    private static final String PROP_MAX_TIME = "patrol.route.maxTimeMinutes";
    private static final String PROP_MAX_STOPS = "patrol.route.maxStops";
    private static final String PROP_DWELL = "patrol.route.dwellMinutes";
    private static final String PROP_WALKING_SPEED = "patrol.route.walkingSpeedKmh";
    private static final String PROP_MAX_ENUMERATION_POOL = "patrol.route.maxEnumerationPoolSize";

    /** Daily time budget including travel, dwell and the return leg. */
    @Builder.Default
    double maxTimeMinutes = DEFAULT_MAX_TIME_MINUTES;

    /** Maximum number of visited sites per day. */
    @Builder.Default
    int maxStops = DEFAULT_MAX_STOPS;

    /** Fixed time spent at every visited site. */
    @Builder.Default
    double dwellMinutes = DEFAULT_DWELL_MINUTES;

    /** Constant walking speed for every leg. */
    @Builder.Default
    double walkingSpeedKmh = DEFAULT_WALKING_SPEED_KMH;

    /** Largest candidate pool the exhaustive strategy accepts when selected directly. */
    @Builder.Default
    int maxEnumerationPoolSize = DEFAULT_MAX_ENUMERATION_POOL_SIZE;

    /**
     * Loads constraints from system properties, falling back to compiled defaults.
     */
    public static RouteConstraints defaults() {
        return RouteConstraints.builder()
                .maxTimeMinutes(readDouble(PROP_MAX_TIME, DEFAULT_MAX_TIME_MINUTES))
                .maxStops(readInt(PROP_MAX_STOPS, DEFAULT_MAX_STOPS))
                .dwellMinutes(readDouble(PROP_DWELL, DEFAULT_DWELL_MINUTES))
                .walkingSpeedKmh(readDouble(PROP_WALKING_SPEED, DEFAULT_WALKING_SPEED_KMH))
                .maxEnumerationPoolSize(readInt(PROP_MAX_ENUMERATION_POOL, DEFAULT_MAX_ENUMERATION_POOL_SIZE))
                .build();
    }

    /**
     * Rejects non-positive limits.
     *
     * @return this instance for chaining.
     * @throws RouteConfigurationException on the first invalid field.
     */
    public RouteConstraints validate() {
        if (!(maxTimeMinutes > 0.0d) || !Double.isFinite(maxTimeMinutes)) {
            throw new RouteConfigurationException(
                    REASON_MAX_TIME_NOT_POSITIVE,
                    "maxTimeMinutes must be finite and > 0: " + maxTimeMinutes
            );
        }
        if (maxStops <= 0) {
            throw new RouteConfigurationException(REASON_MAX_STOPS_NOT_POSITIVE, "maxStops must be > 0: " + maxStops);
        }
        if (!(walkingSpeedKmh > 0.0d) || !Double.isFinite(walkingSpeedKmh)) {
            throw new RouteConfigurationException(
                    REASON_WALKING_SPEED_NOT_POSITIVE,
                    "walkingSpeedKmh must be finite and > 0: " + walkingSpeedKmh
            );
        }
        if (!(dwellMinutes >= 0.0d) || !Double.isFinite(dwellMinutes)) {
            throw new RouteConfigurationException(REASON_DWELL_NEGATIVE, "dwellMinutes must be finite and >= 0: " + dwellMinutes);
        }
        if (maxEnumerationPoolSize <= 0) {
            throw new RouteConfigurationException(
                    REASON_ENUMERATION_POOL_NOT_POSITIVE,
                    "maxEnumerationPoolSize must be > 0: " + maxEnumerationPoolSize
            );
        }
        return this;
    }

    private static double readDouble(String property, double fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    private static int readInt(String property, int fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }
}
