package com.tfigtfs.backend.gtfs;

import com.google.protobuf.InvalidProtocolBufferException;
import com.google.transit.realtime.GtfsRealtime.FeedEntity;
import com.google.transit.realtime.GtfsRealtime.FeedHeader;
import com.google.transit.realtime.GtfsRealtime.FeedMessage;
import com.google.transit.realtime.GtfsRealtime.TripDescriptor;
import com.google.transit.realtime.GtfsRealtime.TripUpdate;
import com.tfigtfs.backend.model.TripStopUpdate;
import com.tfigtfs.backend.util.GtfsUtils;
import lombok.AccessLevel;
import lombok.Getter;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable snapshot of one GTFS-Realtime trip updates feed.
 */
@Getter
public class RealtimeData {

    /** Feed header timestamp, Unix seconds, no timezone offset. */
    private final long timestamp;
    private final FeedHeader.Incrementality incrementality;
    private final String version;
    private final List<TripStopUpdate> updates;

    @Getter(AccessLevel.NONE)
    private final Map<String, List<TripStopUpdate>> updatesByTripAndStop;
    // trip id to the start dates it is cancelled on, a null date matches any day
    @Getter(AccessLevel.NONE)
    private final Map<String, Set<LocalDate>> cancelledTrips;

    public RealtimeData(FeedMessage feed) {
        this.timestamp = feed.getHeader().getTimestamp();
        this.incrementality = feed.getHeader().getIncrementality();
        this.version = feed.getHeader().getGtfsRealtimeVersion();

        List<TripStopUpdate> flattened = new ArrayList<>();
        Map<String, Set<LocalDate>> cancelled = new HashMap<>();
        for (FeedEntity entity : feed.getEntityList()) {
            if (!entity.hasTripUpdate()) {
                continue;
            }
            TripUpdate tripUpdate = entity.getTripUpdate();
            TripDescriptor trip = tripUpdate.getTrip();
            if (trip.getScheduleRelationship() == TripDescriptor.ScheduleRelationship.CANCELED) {
                cancelled.computeIfAbsent(trip.getTripId(), id -> new HashSet<>()).add(startDate(trip));
            }
            // one trip update can contain updates for all the stops along that route
            for (TripUpdate.StopTimeUpdate update : tripUpdate.getStopTimeUpdateList()) {
                flattened.add(flatten(entity.getId(), tripUpdate, update));
            }
        }

        Map<String, List<TripStopUpdate>> index = new HashMap<>();
        for (TripStopUpdate update : flattened) {
            index.computeIfAbsent(key(update.getTripId(), update.getStopId()), k -> new ArrayList<>()).add(update);
        }

        this.updates = Collections.unmodifiableList(flattened);
        this.updatesByTripAndStop = index;
        this.cancelledTrips = cancelled;
    }

    public static RealtimeData parse(byte[] feedBytes) {
        try {
            return new RealtimeData(FeedMessage.parseFrom(feedBytes));
        } catch (InvalidProtocolBufferException e) {
            throw new IllegalArgumentException("Invalid GTFS-Realtime feed: " + e.getMessage(), e);
        }
    }

    public Instant getTimestampInstant() {
        return Instant.ofEpochSecond(timestamp);
    }

    public int size() {
        return updates.size();
    }

    /**
     * Whether the trip running on {@code serviceDate} is cancelled. A cancellation
     * that names no start date applies to every day.
     */
    public boolean isTripCancelled(String tripId, LocalDate serviceDate) {
        Set<LocalDate> dates = cancelledTrips.get(tripId);
        return dates != null && (dates.contains(null) || dates.contains(serviceDate));
    }

    /**
     * The update for a trip at a stop. When the update names the trip's start
     * date it must match {@code serviceDate}.
     */
    public Optional<TripStopUpdate> updateFor(String tripId, String stopId, LocalDate serviceDate) {
        List<TripStopUpdate> candidates = updatesByTripAndStop.getOrDefault(key(tripId, stopId), List.of());
        return candidates.stream()
                .filter(u -> u.getStartDate() == null || u.getStartDate().equals(serviceDate))
                .findFirst();
    }

    private static TripStopUpdate flatten(String entityId, TripUpdate tripUpdate, TripUpdate.StopTimeUpdate update) {
        TripDescriptor trip = tripUpdate.getTrip();
        return TripStopUpdate.builder()
                .entityId(entityId)
                .tripId(trip.getTripId())
                .routeId(trip.getRouteId())
                .vehicleId(tripUpdate.getVehicle().getId())
                .start(GtfsUtils.toTimestamp(trip.getStartDate(), trip.getStartTime()))
                .startDate(startDate(trip))
                .tripScheduleRelationship(trip.getScheduleRelationship())
                .stopId(update.getStopId())
                .stopScheduleRelationship(update.getScheduleRelationship())
                .arrivalDelay(update.getArrival().getDelay())
                .departureDelay(update.getDeparture().getDelay())
                .build();
    }

    private static LocalDate startDate(TripDescriptor trip) {
        return GtfsUtils.isBlank(trip.getStartDate()) ? null : GtfsUtils.parseDate(trip.getStartDate());
    }

    private static String key(String tripId, String stopId) {
        return tripId + '|' + stopId;
    }
}
