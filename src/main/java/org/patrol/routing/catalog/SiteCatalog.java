package org.patrol.routing.catalog;

import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Validated, immutable site catalog with its zone index.
 *
 * <p>Contract summary:</p>
 * <ul>
 * <li>Coordinates must be finite and inside the geodetic range.</li>
 * <li>Rewards must be finite and non-negative.</li>
 * <li>Ids are unique; every site carries a zone.</li>
 * <li>Immutable after construction; safe for concurrent readers.</li>
 * </ul>
 */
@Slf4j
public final class SiteCatalog {
    public static final String REASON_SITE_REQUIRED = "CATALOG_SITE_REQUIRED";
    public static final String REASON_NON_FINITE_COORDINATE = "CATALOG_NON_FINITE_COORDINATE";
    public static final String REASON_COORDINATE_OUT_OF_RANGE = "CATALOG_COORDINATE_OUT_OF_RANGE";
    public static final String REASON_NON_FINITE_REWARD = "CATALOG_NON_FINITE_REWARD";
    public static final String REASON_NEGATIVE_REWARD = "CATALOG_NEGATIVE_REWARD";
    public static final String REASON_ZONE_REQUIRED = "CATALOG_ZONE_REQUIRED";
    public static final String REASON_DUPLICATE_SITE_ID = "CATALOG_DUPLICATE_SITE_ID";
    public static final String REASON_START_ID_CONFLICT = "CATALOG_START_ID_CONFLICT";

    /** Lowest id handed to starting points built from raw coordinates. */
    public static final int STARTING_POINT_ID_BASE = 9_000;
    public static final String STARTING_POINT_CATEGORY = "starting_point";

    private final List<Site> sites;
    private final Int2ObjectOpenHashMap<Site> sitesById;
    private final ZoneIndex zoneIndex;
    private final long firstStartingPointId;

    private SiteCatalog(List<Site> sites, Int2ObjectOpenHashMap<Site> sitesById) {
        this.sites = sites;
        this.sitesById = sitesById;
        this.zoneIndex = ZoneIndex.build(sites);
        long maxId = Long.MIN_VALUE;
        for (Site site : sites) {
            maxId = Math.max(maxId, site.id());
        }
        this.firstStartingPointId = Math.max(STARTING_POINT_ID_BASE, maxId + 1L);
    }

    /**
     * Validates and freezes a list of sites.
     *
     * @throws SiteCatalogException on the first malformed record.
     */
    public static SiteCatalog of(Collection<Site> sites) {
        Objects.requireNonNull(sites, "sites");
        Int2ObjectOpenHashMap<Site> byId = new Int2ObjectOpenHashMap<>(sites.size());
        for (Site site : sites) {
            validateSite(site);
            if (byId.containsKey(site.id())) {
                throw new SiteCatalogException(REASON_DUPLICATE_SITE_ID, "duplicate site id " + site.id());
            }
            byId.put(site.id(), site);
        }
        byId.trim();
        return new SiteCatalog(List.copyOf(sites), byId);
    }

    /**
     * Checks one site record against catalog input rules.
     *
     * @throws SiteCatalogException when the record is malformed.
     */
    public static void validateSite(Site site) {
        if (site == null) {
            throw new SiteCatalogException(REASON_SITE_REQUIRED, "site must be non-null");
        }
        if (!Double.isFinite(site.latitude()) || !Double.isFinite(site.longitude())) {
            throw new SiteCatalogException(
                    REASON_NON_FINITE_COORDINATE,
                    "site " + site.id() + " has non-finite coordinates (" + site.latitude() + ", " + site.longitude() + ")"
            );
        }
        if (Math.abs(site.latitude()) > 90.0d || Math.abs(site.longitude()) > 180.0d) {
            throw new SiteCatalogException(
                    REASON_COORDINATE_OUT_OF_RANGE,
                    "site " + site.id() + " coordinates out of range (" + site.latitude() + ", " + site.longitude() + ")"
            );
        }
        if (!Double.isFinite(site.reward())) {
            throw new SiteCatalogException(REASON_NON_FINITE_REWARD, "site " + site.id() + " has non-finite reward");
        }
        if (site.reward() < 0.0d) {
            throw new SiteCatalogException(
                    REASON_NEGATIVE_REWARD,
                    "site " + site.id() + " has negative reward " + site.reward()
            );
        }
        if (site.zone() == null) {
            throw new SiteCatalogException(REASON_ZONE_REQUIRED, "site " + site.id() + " has no zone");
        }
    }

    /**
     * Builds a zero-reward starting point at raw coordinates.
     *
     * <p>Coordinates outside every boundary box fall back to
     * {@link ZoneBoundaryIndex#defaultZone()}. The caller owns {@code id};
     * {@link #startingPointsAt} picks ids that are free in a catalog.</p>
     */
    public static Site startingPointAt(double latitude, double longitude, int id, ZoneBoundaryIndex boundaries) {
        Objects.requireNonNull(boundaries, "boundaries");
        ZoneId zone = boundaries.zoneFor(latitude, longitude).orElse(null);
        if (zone == null) {
            zone = boundaries.defaultZone();
            log.warn("Coordinates ({}, {}) fall outside every zone boundary, assigned {}", latitude, longitude, zone);
        }
        Site site = Site.builder()
                .id(id)
                .latitude(latitude)
                .longitude(longitude)
                .category(STARTING_POINT_CATEGORY)
                .reward(0.0d)
                .zone(zone)
                .build();
        validateSite(site);
        return site;
    }

    /**
     * Checks a starting site before a search: it must be well-formed, and its id may
     * only match a catalog site when it is that very site.
     *
     * @throws SiteCatalogException when the record is malformed or shadows another site.
     */
    public void validateStart(Site start) {
        validateSite(start);
        Site existing = sitesById.get(start.id());
        if (existing != null && !existing.equals(start)) {
            throw new SiteCatalogException(
                    REASON_START_ID_CONFLICT,
                    "starting site id " + start.id() + " belongs to a different catalog site"
            );
        }
    }

    /**
     * Builds starting points for consecutive days from {@code [lat, lon]} pairs.
     *
     * <p>Ids are numbered from {@link #STARTING_POINT_ID_BASE}, or from just above the
     * largest catalog id when that is higher, so they never collide with a catalog site.</p>
     */
    public List<Site> startingPointsAt(List<double[]> coordinates, ZoneBoundaryIndex boundaries) {
        Objects.requireNonNull(coordinates, "coordinates");
        if (firstStartingPointId + coordinates.size() - 1L > Integer.MAX_VALUE) {
            throw new IllegalStateException("no free starting point ids above " + (firstStartingPointId - 1L));
        }
        Site[] points = new Site[coordinates.size()];
        for (int i = 0; i < points.length; i++) {
            double[] pair = Objects.requireNonNull(coordinates.get(i), "coordinate");
            if (pair.length != 2) {
                throw new IllegalArgumentException("coordinate " + i + " must be a [lat, lon] pair");
            }
            points[i] = startingPointAt(pair[0], pair[1], (int) (firstStartingPointId + i), boundaries);
        }
        return List.of(points);
    }

    public List<Site> sites() {
        return sites;
    }

    public int size() {
        return sites.size();
    }

    /**
     * @return site with the given id, or null when absent.
     */
    public Site site(int id) {
        return sitesById.get(id);
    }

    public boolean contains(int id) {
        return sitesById.containsKey(id);
    }

    public ZoneIndex zoneIndex() {
        return zoneIndex;
    }
}
