package com.tfigtfs.backend.service;

import com.tfigtfs.backend.exception.FeedNotReadyException;
import com.tfigtfs.backend.gtfs.RealtimeData;
import com.tfigtfs.backend.gtfs.StaticAssets;
import com.tfigtfs.backend.model.Departure;
import com.tfigtfs.backend.model.DepartureStatus;
import com.tfigtfs.backend.model.ScheduledDeparture;
import com.tfigtfs.backend.model.StopDepartures;
import com.tfigtfs.backend.model.TripStopUpdate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class DepartureService {

    public static final Duration DEFAULT_WINDOW = Duration.ofMinutes(90);

    private final GtfsFeedService feedService;
    private final Clock clock;

    /**
     * Departures from now, in the feed's own timezone.
     */
    public Map<String, StopDepartures> departures(List<String> stopNumbers, Duration window) {
        StaticAssets assets = requireReady();
        LocalDateTime now = LocalDateTime.now(clock.withZone(assets.getTimezone()));
        return departures(stopNumbers, now, window);
    }

    /**
     * Departures for each known stop number in {@code [now, now + window)}.
     * Values that are not numeric or not a known stop code are left out.
     *
     * @throws FeedNotReadyException until both feeds have been loaded
     */
    public Map<String, StopDepartures> departures(List<String> stopNumbers, LocalDateTime now, Duration window) {
        long startTime = System.currentTimeMillis();
        StaticAssets assets = requireReady();
        RealtimeData realtime = feedService.getRealtimeData().orElse(null);

        Map<String, StopDepartures> result = new LinkedHashMap<>();
        for (String stopNumber : stopNumbers) {
            if (!isNumeric(stopNumber) || result.containsKey(stopNumber)) {
                continue;
            }
            if (!assets.stopNumberIsValid(stopNumber)) {
                log.debug("Ignoring unknown stop number {}", stopNumber);
                continue;
            }

            List<Departure> departures = assets.scheduledDepartures(stopNumber, now, window).stream()
                    .map(scheduled -> applyRealtime(scheduled, realtime))
                    .collect(Collectors.toList());

            result.put(stopNumber, StopDepartures.builder()
                    .stopNumber(stopNumber)
                    .stopName(assets.stopName(stopNumber))
                    .departures(departures)
                    .build());
        }

        log.info("🚏 Departures for {} stops ({} requested) | Took: {}ms", result.size(), stopNumbers.size(),
                System.currentTimeMillis() - startTime);
        return result;
    }

    Departure applyRealtime(ScheduledDeparture scheduled, RealtimeData realtime) {
        Departure.DepartureBuilder departure = Departure.builder()
                .tripId(scheduled.getTripId())
                .route(scheduled.getRouteShortName())
                .headsign(scheduled.getHeadsign())
                .scheduledDeparture(scheduled.getScheduledDeparture())
                .expectedDeparture(scheduled.getScheduledDeparture())
                .status(DepartureStatus.SCHEDULED);
        if (realtime == null) {
            return departure.build();
        }

        LocalDate serviceDate = scheduled.getServiceDate();
        if (realtime.isTripCancelled(scheduled.getTripId(), serviceDate)) {
            return departure.status(DepartureStatus.CANCELLED).build();
        }

        Optional<TripStopUpdate> update = realtime.updateFor(scheduled.getTripId(), scheduled.getStopId(),
                serviceDate);
        if (update.isEmpty()) {
            return departure.build();
        }
        if (update.get().isStopSkipped()) {
            return departure.status(DepartureStatus.SKIPPED).build();
        }

        int delay = delayOf(update.get());
        return departure
                .delaySeconds(delay)
                .expectedDeparture(scheduled.getScheduledDeparture().plusSeconds(delay))
                .status(DepartureStatus.REALTIME)
                .build();
    }

    // the departure delay is preferred, some operators only fill in the arrival
    private static int delayOf(TripStopUpdate update) {
        return update.getDepartureDelay() != 0 ? update.getDepartureDelay() : update.getArrivalDelay();
    }

    private StaticAssets requireReady() {
        if (!feedService.isDataAvailable()) {
            throw new FeedNotReadyException("GTFS feeds are still loading, try again shortly");
        }
        return feedService.requireStaticAssets();
    }

    private static boolean isNumeric(String value) {
        return value != null && !value.isEmpty() && value.chars().allMatch(c -> c >= '0' && c <= '9');
    }
}
