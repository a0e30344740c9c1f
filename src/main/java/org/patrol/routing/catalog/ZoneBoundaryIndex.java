package org.patrol.routing.catalog;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered set of zone boundary boxes used to place free coordinates into a zone.
 *
 * <p>Boxes may share edges; the first declared box containing a point wins.</p>
 */
public final class ZoneBoundaryIndex {
    private final List<ZoneBoundary> boundaries;

    /**
     * @param boundaries zone boxes in declaration order; must be non-empty.
     */
    public ZoneBoundaryIndex(List<ZoneBoundary> boundaries) {
        Objects.requireNonNull(boundaries, "boundaries");
        if (boundaries.isEmpty()) {
            throw new IllegalArgumentException("boundaries must be non-empty");
        }
        for (ZoneBoundary boundary : boundaries) {
            Objects.requireNonNull(boundary, "boundary");
            Objects.requireNonNull(boundary.zone(), "boundary.zone");
            if (boundary.latMin() > boundary.latMax() || boundary.lonMin() > boundary.lonMax()) {
                throw new IllegalArgumentException("inverted bounds for zone " + boundary.zone());
            }
        }
        this.boundaries = List.copyOf(boundaries);
    }

    /**
     * Resolves the zone whose box contains the coordinate.
     */
    public Optional<ZoneId> zoneFor(double latitude, double longitude) {
        for (ZoneBoundary boundary : boundaries) {
            if (boundary.contains(latitude, longitude)) {
                return Optional.of(boundary.zone());
            }
        }
        return Optional.empty();
    }

    /**
     * Zone assigned to coordinates that fall outside every box.
     */
    public ZoneId defaultZone() {
        return boundaries.get(0).zone();
    }

    public List<ZoneBoundary> boundaries() {
        return boundaries;
    }
}
