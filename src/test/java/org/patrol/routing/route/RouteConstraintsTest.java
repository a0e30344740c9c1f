package org.patrol.routing.route;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertAll;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("RouteConstraints Tests")
class RouteConstraintsTest {

    @Test
    @DisplayName("Builder defaults match the daily rules")
    void testBuilderDefaults() {
        RouteConstraints constraints = RouteConstraints.builder().build();

        assertAll(
                () -> assertEquals(180.0, constraints.getMaxTimeMinutes()),
                () -> assertEquals(8, constraints.getMaxStops()),
                () -> assertEquals(5.0, constraints.getDwellMinutes()),
                () -> assertEquals(5.0, constraints.getWalkingSpeedKmh()),
                () -> assertEquals(20, constraints.getMaxEnumerationPoolSize())
        );
        assertSame(constraints, constraints.validate());
    }

    @Test
    @DisplayName("System properties override defaults; garbage falls back")
    void testSystemPropertyOverrides() {
        try {
            System.setProperty("patrol.route.maxStops", "5");
            System.setProperty("patrol.route.maxTimeMinutes", "not-a-number");
            System.setProperty("patrol.route.walkingSpeedKmh", " 4.5 ");

            RouteConstraints constraints = RouteConstraints.defaults();
            assertEquals(5, constraints.getMaxStops());
            assertEquals(RouteConstraints.DEFAULT_MAX_TIME_MINUTES, constraints.getMaxTimeMinutes());
            assertEquals(4.5, constraints.getWalkingSpeedKmh());
        } finally {
            System.clearProperty("patrol.route.maxStops");
            System.clearProperty("patrol.route.maxTimeMinutes");
            System.clearProperty("patrol.route.walkingSpeedKmh");
        }
    }

    @Test
    @DisplayName("Validation: non-positive limits are rejected with reason codes")
    void testValidation() {
        assertReason(RouteConstraints.REASON_MAX_TIME_NOT_POSITIVE,
                RouteConstraints.builder().maxTimeMinutes(0.0).build());
        assertReason(RouteConstraints.REASON_MAX_TIME_NOT_POSITIVE,
                RouteConstraints.builder().maxTimeMinutes(Double.NaN).build());
        assertReason(RouteConstraints.REASON_MAX_STOPS_NOT_POSITIVE,
                RouteConstraints.builder().maxStops(0).build());
        assertReason(RouteConstraints.REASON_WALKING_SPEED_NOT_POSITIVE,
                RouteConstraints.builder().walkingSpeedKmh(-1.0).build());
        assertReason(RouteConstraints.REASON_DWELL_NEGATIVE,
                RouteConstraints.builder().dwellMinutes(-0.5).build());
        assertReason(RouteConstraints.REASON_ENUMERATION_POOL_NOT_POSITIVE,
                RouteConstraints.builder().maxEnumerationPoolSize(0).build());
    }

    @Test
    @DisplayName("Exception keeps reason code, prefixed message and cause")
    void testExceptionShape() {
        IllegalStateException cause = new IllegalStateException("boom");
        RouteConfigurationException ex = new RouteConfigurationException("TEST_REASON", "details", cause);

        assertEquals("TEST_REASON", ex.reasonCode());
        assertTrue(ex.getMessage().contains("[TEST_REASON] details"));
        assertSame(cause, ex.getCause());
        assertThrows(IllegalArgumentException.class, () -> new RouteConfigurationException(" ", "details"));
    }

    private static void assertReason(String reasonCode, RouteConstraints constraints) {
        RouteConfigurationException ex = assertThrows(RouteConfigurationException.class, constraints::validate);
        assertEquals(reasonCode, ex.reasonCode());
    }
}
