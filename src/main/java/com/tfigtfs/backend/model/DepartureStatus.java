package com.tfigtfs.backend.model;

public enum DepartureStatus {
    /** No real-time update for this departure. */
    SCHEDULED,
    /** Timetable adjusted with the real-time delay. */
    REALTIME,
    CANCELLED,
    SKIPPED
}
