package com.tfigtfs.backend.gtfs;

import com.tfigtfs.backend.calendar.CalendarDateException;
import com.tfigtfs.backend.calendar.CalendarEntry;
import com.tfigtfs.backend.calendar.ServiceCalendarExpander;
import com.tfigtfs.backend.calendar.ServiceDate;
import com.tfigtfs.backend.model.Agency;
import com.tfigtfs.backend.model.Route;
import com.tfigtfs.backend.model.ScheduledDeparture;
import com.tfigtfs.backend.model.Stop;
import com.tfigtfs.backend.model.StopTime;
import com.tfigtfs.backend.model.Trip;
import com.tfigtfs.backend.schedule.OnSchedule;
import com.tfigtfs.backend.schedule.Sleeper;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;

/**
 * Parsed tables of one static GTFS archive plus the expanded service calendar
 * derived from them.
 * <p>
 * The tables never change after construction. The expanded calendar is rebuilt
 * periodically (it depends on "today") and swapped in whole, so readers see
 * either the old or the new calendar, never a mix.
 */
@Slf4j
@Getter
public class StaticAssets {

    private final List<Agency> agencies;
    private final Map<String, Route> routes;
    private final List<CalendarEntry> calendar;
    private final List<CalendarDateException> calendarExceptions;
    private final Map<String, Stop> stopsByCode;
    private final Map<String, Trip> trips;
    private final Map<String, List<StopTime>> stopTimesByStopId;

    // local time is needed to filter the dataset, take the first agency's timezone
    private final ZoneId timezone;

    @Getter(AccessLevel.NONE)
    private volatile ExpandedCalendar expandedCalendar = ExpandedCalendar.EMPTY;
    @Getter(AccessLevel.NONE)
    private OnSchedule calendarRefresh;

    @Builder
    public StaticAssets(List<Agency> agencies, Map<String, Route> routes, List<CalendarEntry> calendar,
            List<CalendarDateException> calendarExceptions, Map<String, Stop> stopsByCode, Map<String, Trip> trips,
            Map<String, List<StopTime>> stopTimesByStopId, ZoneId timezone) {
        this.agencies = agencies != null ? List.copyOf(agencies) : List.of();
        this.routes = routes != null ? Map.copyOf(routes) : Map.of();
        this.calendar = calendar != null ? List.copyOf(calendar) : List.of();
        this.calendarExceptions = calendarExceptions != null ? List.copyOf(calendarExceptions) : List.of();
        this.stopsByCode = stopsByCode != null ? Map.copyOf(stopsByCode) : Map.of();
        this.trips = trips != null ? Map.copyOf(trips) : Map.of();
        this.stopTimesByStopId = stopTimesByStopId != null ? Map.copyOf(stopTimesByStopId) : Map.of();
        this.timezone = timezone != null ? timezone : resolveTimezone(this.agencies);
    }

    private static ZoneId resolveTimezone(List<Agency> agencies) {
        if (agencies.isEmpty() || agencies.get(0).getAgencyTimezone() == null) {
            return ZoneId.systemDefault();
        }
        return ZoneId.of(agencies.get(0).getAgencyTimezone());
    }

    public LocalDate today(Clock clock) {
        return LocalDate.now(clock.withZone(timezone));
    }

    /**
     * Rebuilds the expanded calendar for the window around {@code today} and
     * replaces the previous one.
     */
    public void rebuildExpandedCalendar(LocalDate today, int startOffset, int stopOffset) {
        long startMillis = System.currentTimeMillis();
        Set<ServiceDate> pairs = ServiceCalendarExpander.expand(calendar, calendarExceptions, startOffset,
                stopOffset, today);

        Map<LocalDate, Set<String>> byDate = new HashMap<>();
        for (ServiceDate pair : pairs) {
            byDate.computeIfAbsent(pair.getDate(), d -> new HashSet<>()).add(pair.getServiceId());
        }
        byDate.replaceAll((date, services) -> Collections.unmodifiableSet(services));

        expandedCalendar = new ExpandedCalendar(today, pairs, Collections.unmodifiableMap(byDate));
        log.info("📅 Expanded calendar rebuilt | {} service days from {} to {} | Took: {}ms", pairs.size(),
                today.plusDays(startOffset), today.plusDays(stopOffset), System.currentTimeMillis() - startMillis);
    }

    /**
     * Builds the expanded calendar now, on the caller's thread, and again every
     * {@code every} after that. Restarting replaces the previous refresh task.
     *
     * @param sleeper null to sleep on the schedule's own stop signal
     */
    public synchronized void startCalendarRefresh(int startOffset, int stopOffset, Duration every, Clock clock,
            Sleeper sleeper) {
        stopCalendarRefresh();
        rebuildExpandedCalendar(today(clock), startOffset, stopOffset);
        calendarRefresh = new OnSchedule("expanded-calendar",
                () -> rebuildExpandedCalendar(today(clock), startOffset, stopOffset), every, false, sleeper);
    }

    public synchronized void stopCalendarRefresh() {
        if (calendarRefresh != null) {
            calendarRefresh.stop();
            calendarRefresh = null;
        }
    }

    public Set<ServiceDate> getExpandedCalendar() {
        return expandedCalendar.getPairs();
    }

    public Optional<LocalDate> getCalendarBuiltFor() {
        return Optional.ofNullable(expandedCalendar.getBuiltFor());
    }

    public Set<String> servicesRunningOn(LocalDate date) {
        return expandedCalendar.getServicesByDate().getOrDefault(date, Set.of());
    }

    public boolean serviceRunsOn(String serviceId, LocalDate date) {
        return servicesRunningOn(date).contains(serviceId);
    }

    public boolean stopNumberIsValid(String stopNumber) {
        return stopsByCode.containsKey(stopNumber);
    }

    public Optional<Stop> findStop(String stopNumber) {
        return Optional.ofNullable(stopsByCode.get(stopNumber));
    }

    public String stopName(String stopNumber) {
        return findStop(stopNumber)
                .map(Stop::getStopName)
                .orElseThrow(() -> new NoSuchElementException("Unknown stop number: " + stopNumber));
    }

    public String stopId(String stopNumber) {
        return findStop(stopNumber)
                .map(Stop::getStopId)
                .orElseThrow(() -> new NoSuchElementException("Unknown stop number: " + stopNumber));
    }

    public List<StopTime> stopTimesForStop(String stopNumber) {
        return findStop(stopNumber)
                .map(stop -> stopTimesByStopId.getOrDefault(stop.getStopId(), List.of()))
                .orElse(List.of());
    }

    /**
     * Departures scheduled at a stop in {@code [from, from + window)}, ordered by
     * time, limited to trips whose service runs on the service day.
     * <p>
     * Stop times past 24:00:00 belong to the previous service day, so the day
     * before {@code from} is searched as well.
     */
    public List<ScheduledDeparture> scheduledDepartures(String stopNumber, LocalDateTime from, Duration window) {
        LocalDateTime until = from.plus(window);
        List<ScheduledDeparture> departures = new ArrayList<>();

        for (LocalDate serviceDate = from.toLocalDate().minusDays(1);
                !serviceDate.isAfter(until.toLocalDate()); serviceDate = serviceDate.plusDays(1)) {
            Set<String> services = servicesRunningOn(serviceDate);
            if (services.isEmpty()) {
                continue;
            }
            for (StopTime stopTime : stopTimesForStop(stopNumber)) {
                LocalDateTime scheduled = serviceDate.atStartOfDay().plus(stopTime.departureOffset());
                if (scheduled.isBefore(from) || !scheduled.isBefore(until)) {
                    continue;
                }
                Trip trip = trips.get(stopTime.getTripId());
                if (trip == null || !services.contains(trip.getServiceId())) {
                    continue;
                }
                Route route = routes.get(trip.getRouteId());
                departures.add(ScheduledDeparture.builder()
                        .tripId(trip.getTripId())
                        .stopId(stopTime.getStopId())
                        .routeId(trip.getRouteId())
                        .routeShortName(route != null ? route.getRouteShortName() : null)
                        .headsign(trip.getTripHeadsign())
                        .serviceDate(serviceDate)
                        .scheduledDeparture(scheduled)
                        .build());
            }
        }

        departures.sort(Comparator.comparing(ScheduledDeparture::getScheduledDeparture));
        return departures;
    }

    @Value
    private static class ExpandedCalendar {
        static final ExpandedCalendar EMPTY = new ExpandedCalendar(null, Set.of(), Map.of());

        LocalDate builtFor;
        Set<ServiceDate> pairs;
        Map<LocalDate, Set<String>> servicesByDate;
    }
}
