package com.tfigtfs.backend.util;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

public class GtfsUtils {

    // GTFS dates are written yyyyMMdd
    public static final DateTimeFormatter GTFS_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");

    public static LocalDate parseDate(String value) {
        try {
            return LocalDate.parse(value.trim(), GTFS_DATE);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid GTFS date: " + value, e);
        }
    }

    /**
     * Parses a GTFS time ("H:MM:SS" or "HH:MM:SS") into seconds after midnight.
     * Hours may exceed 23 for trips that run past midnight.
     */
    public static int parseTimeSeconds(String value) {
        String[] parts = value.trim().split(":");
        if (parts.length != 3) {
            throw new IllegalArgumentException("Invalid GTFS time: " + value);
        }
        try {
            int hours = Integer.parseInt(parts[0]);
            int minutes = Integer.parseInt(parts[1]);
            int seconds = Integer.parseInt(parts[2]);
            if (hours < 0 || minutes < 0 || minutes > 59 || seconds < 0 || seconds > 59) {
                throw new IllegalArgumentException("Invalid GTFS time: " + value);
            }
            return hours * 3600 + minutes * 60 + seconds;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid GTFS time: " + value, e);
        }
    }

    /**
     * Combines a service date and a GTFS time; returns null when either is blank.
     */
    public static LocalDateTime toTimestamp(String startDate, String startTime) {
        if (isBlank(startDate) || isBlank(startTime)) {
            return null;
        }
        return parseDate(startDate).atStartOfDay().plusSeconds(parseTimeSeconds(startTime));
    }

    public static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
