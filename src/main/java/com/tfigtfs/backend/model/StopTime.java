package com.tfigtfs.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StopTime {
    private String tripId;
    private String stopId;

    // seconds after midnight of the service day, can exceed 24h for trips running past midnight
    private int departureSeconds;

    public Duration departureOffset() {
        return Duration.ofSeconds(departureSeconds);
    }
}
