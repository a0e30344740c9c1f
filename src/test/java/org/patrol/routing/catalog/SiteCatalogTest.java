package org.patrol.routing.catalog;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.patrol.routing.testutil.SiteFixtures.Z1;
import static org.patrol.routing.testutil.SiteFixtures.site;

@DisplayName("SiteCatalog Tests")
class SiteCatalogTest {

    private static final ZoneBoundaryIndex BOUNDARIES = new ZoneBoundaryIndex(List.of(
            ZoneBoundary.builder().zone(ZoneId.of("J1"))
                    .latMin(41.8128).latMax(41.8486).lonMin(12.43652).lonMax(12.48511).build(),
            ZoneBoundary.builder().zone(ZoneId.of("J2"))
                    .latMin(41.8128).latMax(41.8486).lonMin(12.48511).lonMax(12.5337).build()
    ));

    @Test
    @DisplayName("Valid catalog exposes sites by id and a zone index")
    void testValidCatalog() {
        Site a = site(1, 41.9, 12.49, 5.0, Z1);
        Site b = site(2, 41.91, 12.50, 0.0, Z1);
        SiteCatalog catalog = SiteCatalog.of(List.of(a, b));

        assertEquals(2, catalog.size());
        assertSame(a, catalog.site(1));
        assertNull(catalog.site(3));
        assertTrue(catalog.contains(2));
        assertFalse(catalog.contains(3));
        assertEquals(List.of(a, b), catalog.zoneIndex().sitesIn(Z1));
    }

    @Test
    @DisplayName("Validation: non-finite coordinates are rejected")
    void testNonFiniteCoordinates() {
        SiteCatalogException ex = assertThrows(
                SiteCatalogException.class,
                () -> SiteCatalog.of(List.of(site(1, Double.NaN, 12.49, 1.0, Z1)))
        );
        assertEquals(SiteCatalog.REASON_NON_FINITE_COORDINATE, ex.reasonCode());

        ex = assertThrows(
                SiteCatalogException.class,
                () -> SiteCatalog.of(List.of(site(1, 41.9, Double.POSITIVE_INFINITY, 1.0, Z1)))
        );
        assertEquals(SiteCatalog.REASON_NON_FINITE_COORDINATE, ex.reasonCode());
    }

    @Test
    @DisplayName("Validation: coordinates outside the geodetic range are rejected")
    void testCoordinatesOutOfRange() {
        SiteCatalogException ex = assertThrows(
                SiteCatalogException.class,
                () -> SiteCatalog.of(List.of(site(1, 91.0, 12.49, 1.0, Z1)))
        );
        assertEquals(SiteCatalog.REASON_COORDINATE_OUT_OF_RANGE, ex.reasonCode());
    }

    @Test
    @DisplayName("Validation: negative and non-finite rewards are rejected")
    void testBadReward() {
        SiteCatalogException negative = assertThrows(
                SiteCatalogException.class,
                () -> SiteCatalog.of(List.of(site(1, 41.9, 12.49, -0.01, Z1)))
        );
        assertEquals(SiteCatalog.REASON_NEGATIVE_REWARD, negative.reasonCode());
        assertTrue(negative.getMessage().startsWith("[" + SiteCatalog.REASON_NEGATIVE_REWARD + "] "));

        SiteCatalogException nan = assertThrows(
                SiteCatalogException.class,
                () -> SiteCatalog.of(List.of(site(1, 41.9, 12.49, Double.NaN, Z1)))
        );
        assertEquals(SiteCatalog.REASON_NON_FINITE_REWARD, nan.reasonCode());
    }

    @Test
    @DisplayName("Validation: duplicate ids, null sites and missing zones are rejected")
    void testStructuralFailures() {
        SiteCatalogException duplicate = assertThrows(
                SiteCatalogException.class,
                () -> SiteCatalog.of(List.of(site(1, 41.9, 12.49, 1.0, Z1), site(1, 41.8, 12.48, 2.0, Z1)))
        );
        assertEquals(SiteCatalog.REASON_DUPLICATE_SITE_ID, duplicate.reasonCode());

        SiteCatalogException missingZone = assertThrows(
                SiteCatalogException.class,
                () -> SiteCatalog.of(List.of(site(1, 41.9, 12.49, 1.0, null)))
        );
        assertEquals(SiteCatalog.REASON_ZONE_REQUIRED, missingZone.reasonCode());

        SiteCatalogException nullSite = assertThrows(
                SiteCatalogException.class,
                () -> SiteCatalog.validateSite(null)
        );
        assertEquals(SiteCatalog.REASON_SITE_REQUIRED, nullSite.reasonCode());
    }

    @Test
    @DisplayName("Starting point resolves its zone from boundary boxes")
    void testStartingPointZoneResolution() {
        Site start = SiteCatalog.startingPointAt(41.83, 12.50, 9_000, BOUNDARIES);

        assertEquals(ZoneId.of("J2"), start.zone());
        assertEquals(0.0d, start.reward());
        assertEquals(SiteCatalog.STARTING_POINT_CATEGORY, start.category());
    }

    @Test
    @DisplayName("Shared box edge resolves to the first declared zone")
    void testSharedEdgeFirstWins() {
        assertEquals(ZoneId.of("J1"), BOUNDARIES.zoneFor(41.83, 12.48511).orElseThrow());
    }

    @Test
    @DisplayName("Starting point outside every box falls back to the default zone")
    void testStartingPointFallback() {
        Site start = SiteCatalog.startingPointAt(45.0, 9.0, 9_001, BOUNDARIES);

        assertTrue(BOUNDARIES.zoneFor(45.0, 9.0).isEmpty());
        assertEquals(BOUNDARIES.defaultZone(), start.zone());
        assertEquals(ZoneId.of("J1"), start.zone());
    }

    @Test
    @DisplayName("Starting points from coordinate pairs are numbered from the base id")
    void testStartingPointsNumbering() {
        SiteCatalog catalog = SiteCatalog.of(List.of(site(1, 41.83, 12.45, 5.0, ZoneId.of("J1"))));

        List<Site> starts = catalog.startingPointsAt(
                List.of(new double[]{41.82, 12.44}, new double[]{41.84, 12.53}),
                BOUNDARIES
        );

        assertEquals(2, starts.size());
        assertEquals(SiteCatalog.STARTING_POINT_ID_BASE, starts.get(0).id());
        assertEquals(SiteCatalog.STARTING_POINT_ID_BASE + 1, starts.get(1).id());
        assertEquals(ZoneId.of("J1"), starts.get(0).zone());
        assertEquals(ZoneId.of("J2"), starts.get(1).zone());

        assertThrows(IllegalArgumentException.class,
                () -> catalog.startingPointsAt(List.of(new double[]{41.82}), BOUNDARIES));
    }

    @Test
    @DisplayName("Starting point ids skip past catalog ids at or above the base")
    void testStartingPointsAvoidCatalogIds() {
        SiteCatalog catalog = SiteCatalog.of(List.of(
                site(9_000, 41.83, 12.45, 100.0, ZoneId.of("J1")),
                site(9_004, 41.84, 12.46, 1.0, ZoneId.of("J1"))
        ));

        List<Site> starts = catalog.startingPointsAt(
                List.of(new double[]{41.82, 12.44}, new double[]{41.83, 12.45}),
                BOUNDARIES
        );

        assertEquals(9_005, starts.get(0).id());
        assertEquals(9_006, starts.get(1).id());
        starts.forEach(start -> assertFalse(catalog.contains(start.id())));
    }

    @Test
    @DisplayName("Start may be a catalog site itself but not reuse another site's id")
    void testValidateStart() {
        Site rich = site(9_000, 41.83, 12.45, 100.0, ZoneId.of("J1"));
        SiteCatalog catalog = SiteCatalog.of(List.of(rich));

        catalog.validateStart(rich);
        catalog.validateStart(SiteCatalog.startingPointAt(41.83, 12.45, 9_001, BOUNDARIES));

        SiteCatalogException ex = assertThrows(
                SiteCatalogException.class,
                () -> catalog.validateStart(SiteCatalog.startingPointAt(41.83, 12.45, 9_000, BOUNDARIES))
        );
        assertEquals(SiteCatalog.REASON_START_ID_CONFLICT, ex.reasonCode());
    }

    @Test
    @DisplayName("Boundary index rejects empty and inverted boxes")
    void testBoundaryValidation() {
        assertThrows(IllegalArgumentException.class, () -> new ZoneBoundaryIndex(List.of()));
        assertThrows(IllegalArgumentException.class, () -> new ZoneBoundaryIndex(List.of(
                ZoneBoundary.builder().zone(Z1).latMin(2.0).latMax(1.0).lonMin(0.0).lonMax(1.0).build()
        )));
    }

    @Test
    @DisplayName("Blank reason code is rejected deterministically")
    void testBlankReasonCodeRejected() {
        assertThrows(IllegalArgumentException.class, () -> new SiteCatalogException(" ", "details"));
    }
}
