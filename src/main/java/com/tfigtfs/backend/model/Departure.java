package com.tfigtfs.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Departure {
    private String tripId;
    private String route;
    private String headsign;
    private LocalDateTime scheduledDeparture;
    private LocalDateTime expectedDeparture;

    // seconds, positive when running late
    private int delaySeconds;
    private DepartureStatus status;
}
