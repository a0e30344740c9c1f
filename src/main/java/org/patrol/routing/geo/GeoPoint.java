package org.patrol.routing.geo;

/**
 * Anything with a geodetic position in degrees.
 */
public interface GeoPoint {

    double latitude();

    double longitude();
}
