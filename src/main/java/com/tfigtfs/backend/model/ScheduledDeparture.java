package com.tfigtfs.backend.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * A timetabled departure of one trip from one stop, resolved to a wall-clock time.
 */
@Value
@Builder
public class ScheduledDeparture {
    String tripId;
    String stopId;
    String routeId;
    String routeShortName;
    String headsign;
    LocalDate serviceDate;
    LocalDateTime scheduledDeparture;
}
