package com.tfigtfs.backend.model;

import com.google.transit.realtime.GtfsRealtime.TripDescriptor;
import com.google.transit.realtime.GtfsRealtime.TripUpdate.StopTimeUpdate;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * One stop of one trip update from the real-time feed, flattened.
 */
@Value
@Builder
public class TripStopUpdate {
    String entityId;
    String tripId;
    String routeId;
    String vehicleId;
    LocalDateTime start;
    // service day of the trip, times past midnight keep the previous day
    LocalDate startDate;
    TripDescriptor.ScheduleRelationship tripScheduleRelationship;

    // stop specific items
    String stopId;
    StopTimeUpdate.ScheduleRelationship stopScheduleRelationship;
    int arrivalDelay;
    int departureDelay;

    public boolean isTripCancelled() {
        return tripScheduleRelationship == TripDescriptor.ScheduleRelationship.CANCELED;
    }

    public boolean isStopSkipped() {
        return stopScheduleRelationship == StopTimeUpdate.ScheduleRelationship.SKIPPED;
    }
}
