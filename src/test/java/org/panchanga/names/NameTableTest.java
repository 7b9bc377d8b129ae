package org.panchanga.names;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("NameTable Tests")
class NameTableTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    @DisplayName("Bundled table covers every category")
    void testBundledTable() {
        NameTable table = NameTable.defaults();

        assertEquals("Śukla Pratipadā", table.name(NameCategory.TITHI, 1));
        assertEquals("Amāvāsyā", table.name(NameCategory.TITHI, 30));
        assertEquals("Aśvinī", table.name(NameCategory.NAKSHATRA, 1));
        assertEquals("Revatī", table.name(NameCategory.NAKSHATRA, 27));
        assertEquals("Vaidhṛti", table.name(NameCategory.YOGA, 27));
        assertEquals("Caitra", table.name(NameCategory.MASA, 1));
        assertEquals("Bhānuvāra", table.name(NameCategory.VARA, 1));
        assertEquals("Prabhava", table.name(NameCategory.SAMVATSARA, 1));
        assertEquals("Vasanta", table.name(NameCategory.RITU, 1));
        assertEquals(7, table.karanaCycle().size());
        // 12 + 30 + 27 + 27 + 4 + 7 + 60 + 6
        assertEquals(173, table.size());
    }

    @Test
    @DisplayName("Missing entries return null")
    void testMissingEntry() {
        assertNull(NameTable.defaults().name(NameCategory.TITHI, 31));
        assertNull(NameTable.empty().name(NameCategory.TITHI, 1));
        assertTrue(NameTable.empty().karanaCycle().isEmpty());
    }

    @Test
    @DisplayName("Partial JSON tables are accepted")
    void testPartialTable() throws Exception {
        NameTable table = NameTable.fromJson(MAPPER.readTree("{\"vara\": {\"1\": \"Sunday\"}}"));

        assertEquals("Sunday", table.name(NameCategory.VARA, 1));
        assertNull(table.name(NameCategory.VARA, 2));
        assertEquals(1, table.size());
    }

    @Test
    @DisplayName("Malformed layouts are rejected")
    void testMalformedRejected() {
        assertThrows(IllegalArgumentException.class, () -> NameTable.fromJson(MAPPER.readTree("[]")));
        assertThrows(IllegalArgumentException.class,
                () -> NameTable.fromJson(MAPPER.readTree("{\"tithi\": {\"one\": \"x\"}}")));
        assertThrows(IllegalArgumentException.class,
                () -> NameTable.fromJson(MAPPER.readTree("{\"tithi\": {\"1\": \"\"}}")));
        assertThrows(IllegalArgumentException.class,
                () -> NameTable.fromJson(MAPPER.readTree("{\"karanaCycle\": \"Bava\"}")));
    }

    @Test
    @DisplayName("Missing classpath resource is rejected")
    void testMissingResource() {
        assertThrows(IllegalArgumentException.class, () -> NameTable.fromClasspath("no-such-names.json"));
    }

    @Test
    @DisplayName("Test resource overrides bundled names")
    void testClasspathTestResource() {
        NameTable table = NameTable.fromClasspath("test-names.json");

        assertEquals("First", table.name(NameCategory.TITHI, 1));
        assertEquals("Moonday", table.name(NameCategory.VARA, 2));
    }
}
