package org.panchanga.core.time;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class CivilDateTest {

    @Test
    void testValidity() {
        assertTrue(CivilDate.of(2024, 2, 29).isValid());
        assertFalse(CivilDate.of(2023, 2, 29).isValid());
        assertFalse(CivilDate.of(2024, 13, 32).isValid());
        assertFalse(CivilDate.of(2024, 0, 10).isValid());
        assertTrue(CivilDate.of(-500, 3, 1).isValid());
    }

    @Test
    void testLocalDateBridge() {
        CivilDate date = CivilDate.from(LocalDate.of(2024, 1, 15));
        assertEquals(CivilDate.of(2024, 1, 15), date);
        assertEquals(LocalDate.of(2024, 1, 15), date.toLocalDate());
        assertEquals("2024-01-15", date.toString());
    }
}
