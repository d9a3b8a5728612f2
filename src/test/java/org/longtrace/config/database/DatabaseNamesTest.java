package org.longtrace.config.database;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DatabaseNamesTest {

    @Test
    void defaultNameIsTheDateAsEightDigits() {
        assertEquals("20240305", DatabaseNames.defaultName(LocalDate.of(2024, 3, 5)));
        String today = DatabaseNames.defaultName();
        assertEquals(8, today.length());
        assertTrue(today.chars().allMatch(Character::isDigit));
    }

    @Test
    void deriveProducesSafeIdentifiers() {
        assertEquals("longtrace", DatabaseNames.derive("longtrace"));
        assertEquals("my_app_traces", DatabaseNames.derive("My-App.Traces"));
        assertEquals("dropdatabase", DatabaseNames.derive("drop\"database;"));
        assertEquals(DatabaseNames.MAX_LENGTH, DatabaseNames.derive("x".repeat(100)).length());
    }

    @Test
    void unusableCandidatesFallBackToTheDate() {
        assertEquals(DatabaseNames.defaultName(), DatabaseNames.derive(null));
        assertEquals(DatabaseNames.defaultName(), DatabaseNames.derive("!!!"));
        assertEquals(DatabaseNames.defaultName(), DatabaseNames.derive("-.-"));
    }

    @Test
    void safetyCheck() {
        assertTrue(DatabaseNames.isSafe("traces_2024"));
        assertFalse(DatabaseNames.isSafe("Traces"));
        assertFalse(DatabaseNames.isSafe("a;b"));
        assertFalse(DatabaseNames.isSafe(""));
    }

    @Test
    void quoteEscapesDoubleQuotes() {
        assertEquals("\"plain\"", DatabaseNames.quote("plain"));
        assertEquals("\"a\"\"b\"", DatabaseNames.quote("a\"b"));
    }
}
