package com.tfigtfs.backend.util;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

class GtfsUtilsTest {

    @Test
    void testParseDate() {
        assertEquals(LocalDate.of(2025, 6, 19), GtfsUtils.parseDate("20250619"));
        assertThrows(IllegalArgumentException.class, () -> GtfsUtils.parseDate("2025-06-19"));
    }

    @Test
    void testParseTimeSeconds_AllowsHoursPastMidnight() {
        assertEquals(8 * 3600 + 5 * 60 + 9, GtfsUtils.parseTimeSeconds("8:05:09"));
        assertEquals(25 * 3600 + 10 * 60, GtfsUtils.parseTimeSeconds("25:10:00"));
    }

    @Test
    void testParseTimeSeconds_Invalid_Throws() {
        assertThrows(IllegalArgumentException.class, () -> GtfsUtils.parseTimeSeconds("12:60:00"));
        assertThrows(IllegalArgumentException.class, () -> GtfsUtils.parseTimeSeconds("12:00"));
        assertThrows(IllegalArgumentException.class, () -> GtfsUtils.parseTimeSeconds("ab:00:00"));
    }

    @Test
    void testToTimestamp() {
        assertEquals(LocalDateTime.of(2025, 6, 20, 0, 30), GtfsUtils.toTimestamp("20250619", "24:30:00"));
        assertNull(GtfsUtils.toTimestamp("", "10:00:00"));
        assertNull(GtfsUtils.toTimestamp("20250619", null));
    }
}
