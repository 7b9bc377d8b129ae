package org.panchanga.astronomy;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class HorizonEventTest {

    @ParameterizedTest
    @CsvSource({
            "0.0, 00:00:00",
            "6.5, 06:30:00",
            "23.9997, 23:59:59",
            "23.99995, 00:00:00",
            "23.9999999, 00:00:00"
    })
    void testLocalTimeStaysBelowMidnight(double localHours, String expected) {
        HorizonEvent event = new HorizonEvent(2460325.0d, localHours);
        assertEquals(expected, event.localTime().toString());
        assertTrue(event.localTime().getHours() < 24);
    }
}
