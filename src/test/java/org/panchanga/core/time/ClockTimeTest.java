package org.panchanga.core.time;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("ClockTime Tests")
class ClockTimeTest {

    @Test
    @DisplayName("Decimal hours render to the nearest second")
    void testFromDecimalHours() {
        ClockTime time = ClockTime.fromDecimalHours(6.6686d);
        assertEquals(6, time.getHours());
        assertEquals(40, time.getMinutes());
        assertEquals(7, time.getSeconds());
        assertEquals("06:40:07", time.toString());
    }

    @Test
    @DisplayName("Rounding carries instead of producing sixty seconds")
    void testRoundingCarry() {
        // 59.96 seconds short of two hours
        assertEquals("02:00:00", ClockTime.fromDecimalHours(1.99999d).toString());
        assertEquals("00:01:00", ClockTime.fromDecimalHours(59.6d / 3600.0d).toString());
    }

    @Test
    @DisplayName("Hours past midnight keep counting")
    void testHoursPastMidnight() {
        assertEquals("26:10:00", ClockTime.fromDecimalHours(26.0d + 10.0d / 60.0d).toString());
    }

    @Test
    @DisplayName("Negative hours use sign-magnitude rendering")
    void testNegative() {
        ClockTime time = ClockTime.fromDecimalHours(-1.5d);
        assertTrue(time.isNegative());
        assertEquals("-01:30:00", time.toString());
        assertEquals(-5400L, time.toTotalSeconds());
        assertFalse(ClockTime.fromDecimalHours(-0.0000001d).isNegative());
    }

    @Test
    @DisplayName("Round trip agrees within one second")
    void testRoundTrip() {
        for (double hours = -30.0d; hours <= 30.0d; hours += 0.01234d) {
            double back = ClockTime.fromDecimalHours(hours).toDecimalHours();
            assertEquals(hours, back, 1.0d / 3600.0d, "round trip of " + hours);
        }
    }

    @Test
    @DisplayName("Explicit factory validates fields")
    void testOfValidation() {
        assertEquals("07:05:09", ClockTime.of(7, 5, 9).toString());
        assertThrows(IllegalArgumentException.class, () -> ClockTime.of(-1, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> ClockTime.of(1, 60, 0));
        assertThrows(IllegalArgumentException.class, () -> ClockTime.of(1, 0, 60));
        assertThrows(IllegalArgumentException.class, () -> ClockTime.fromDecimalHours(Double.NaN));
    }
}
