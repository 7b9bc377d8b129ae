package org.panchanga.core.geo;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GeoLocationTest {

    @Test
    void testValidRanges() {
        assertTrue(GeoLocation.of(12.9716d, 77.5946d, 5.5d).isValid());
        assertTrue(GeoLocation.of(-90.0d, 180.0d, 14.0d).isValid());
        assertTrue(GeoLocation.of(90.0d, -180.0d, -12.0d, "edge").isValid());
    }

    @Test
    void testOutOfRangeOrNonFiniteRejected() {
        assertFalse(GeoLocation.of(91.0d, 0.0d, 0.0d).isValid());
        assertFalse(GeoLocation.of(0.0d, 181.0d, 0.0d).isValid());
        assertFalse(GeoLocation.of(0.0d, 0.0d, 25.0d).isValid());
        assertFalse(GeoLocation.of(0.0d, 0.0d, -12.5d).isValid());
        assertFalse(GeoLocation.of(Double.NaN, 0.0d, 0.0d).isValid());
        assertFalse(GeoLocation.of(0.0d, Double.POSITIVE_INFINITY, 0.0d).isValid());
    }

    @Test
    void testBuilderKeepsName() {
        GeoLocation location = GeoLocation.builder()
                .latitude(69.6492d)
                .longitude(18.9553d)
                .utcOffsetHours(1.0d)
                .name("Tromsø")
                .build();
        assertEquals("Tromsø", location.getName());
        assertNull(GeoLocation.of(0.0d, 0.0d, 0.0d).getName());
    }
}
