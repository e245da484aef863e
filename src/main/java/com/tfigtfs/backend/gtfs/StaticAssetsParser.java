package com.tfigtfs.backend.gtfs;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.tfigtfs.backend.calendar.CalendarDateException;
import com.tfigtfs.backend.calendar.CalendarEntry;
import com.tfigtfs.backend.calendar.ExceptionType;
import com.tfigtfs.backend.model.Agency;
import com.tfigtfs.backend.model.Route;
import com.tfigtfs.backend.model.Stop;
import com.tfigtfs.backend.model.StopTime;
import com.tfigtfs.backend.model.Trip;
import com.tfigtfs.backend.util.GtfsUtils;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Reads the flat files of a static GTFS zip archive into {@link StaticAssets}.
 * Every file listed here is mandatory; a missing file or malformed row rejects
 * the whole archive.
 */
@Slf4j
public final class StaticAssetsParser {

    private static final CsvMapper CSV_MAPPER = CsvMapper.builder()
            .enable(CsvParser.Feature.TRIM_SPACES)
            .build();
    private static final CsvSchema HEADER_SCHEMA = CsvSchema.emptySchema().withHeader();

    private StaticAssetsParser() {
    }

    public static StaticAssets parse(byte[] zipBytes) {
        long startMillis = System.currentTimeMillis();
        Map<String, byte[]> files = unzip(zipBytes);

        List<Agency> agencies = loadAgencies(readRows(files, "agency.txt"));
        Map<String, Route> routes = loadRoutes(readRows(files, "routes.txt"));
        List<CalendarEntry> calendar = loadCalendar(readRows(files, "calendar.txt"));
        List<CalendarDateException> exceptions = loadCalendarExceptions(readRows(files, "calendar_dates.txt"));
        Map<String, Stop> stops = loadStops(readRows(files, "stops.txt"));
        Map<String, Trip> trips = loadTrips(readRows(files, "trips.txt"));
        Map<String, List<StopTime>> stopTimes = loadStopTimes(readRows(files, "stop_times.txt"));

        StaticAssets assets = StaticAssets.builder()
                .agencies(agencies)
                .routes(routes)
                .calendar(calendar)
                .calendarExceptions(exceptions)
                .stopsByCode(stops)
                .trips(trips)
                .stopTimesByStopId(stopTimes)
                .build();

        log.info("✅ Parsed static assets | {} routes, {} stops, {} trips, {} calendar rows | Took: {}ms",
                routes.size(), stops.size(), trips.size(), calendar.size(),
                System.currentTimeMillis() - startMillis);
        return assets;
    }

    static Map<String, byte[]> unzip(byte[] zipBytes) {
        Map<String, byte[]> files = new HashMap<>();
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(zipBytes))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                if (!entry.isDirectory()) {
                    String name = entry.getName();
                    int slash = name.lastIndexOf('/');
                    files.put(slash >= 0 ? name.substring(slash + 1) : name, zip.readAllBytes());
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Static assets are not a valid zip archive", e);
        }
        if (files.isEmpty()) {
            throw new IllegalArgumentException("Static assets archive is empty or not a zip archive");
        }
        return files;
    }

    static List<Map<String, String>> readRows(Map<String, byte[]> files, String fileName) {
        byte[] content = files.get(fileName);
        if (content == null) {
            throw new IllegalArgumentException("Static assets archive has no " + fileName);
        }
        try (MappingIterator<Map<String, String>> rows = CSV_MAPPER.readerForMapOf(String.class)
                .with(HEADER_SCHEMA)
                .readValues(stripBom(content))) {
            return rows.readAll();
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read " + fileName, e);
        }
    }

    static List<Agency> loadAgencies(List<Map<String, String>> rows) {
        List<Agency> agencies = new ArrayList<>();
        for (Map<String, String> row : rows) {
            agencies.add(Agency.builder()
                    .agencyId(row.get("agency_id"))
                    .agencyName(row.get("agency_name"))
                    .agencyTimezone(required(row, "agency_timezone", "agency.txt"))
                    .build());
        }
        if (agencies.isEmpty()) {
            throw new IllegalArgumentException("agency.txt has no agencies");
        }
        return agencies;
    }

    static Map<String, Route> loadRoutes(List<Map<String, String>> rows) {
        Map<String, Route> routes = new HashMap<>();
        for (Map<String, String> row : rows) {
            String routeId = required(row, "route_id", "routes.txt");
            routes.put(routeId, Route.builder()
                    .routeId(routeId)
                    .agencyId(row.get("agency_id"))
                    .routeShortName(row.get("route_short_name"))
                    .routeLongName(row.get("route_long_name"))
                    .build());
        }
        return routes;
    }

    static List<CalendarEntry> loadCalendar(List<Map<String, String>> rows) {
        List<CalendarEntry> calendar = new ArrayList<>();
        for (Map<String, String> row : rows) {
            calendar.add(CalendarEntry.builder()
                    .serviceId(required(row, "service_id", "calendar.txt"))
                    .monday(flag(row, "monday"))
                    .tuesday(flag(row, "tuesday"))
                    .wednesday(flag(row, "wednesday"))
                    .thursday(flag(row, "thursday"))
                    .friday(flag(row, "friday"))
                    .saturday(flag(row, "saturday"))
                    .sunday(flag(row, "sunday"))
                    .startDate(GtfsUtils.parseDate(required(row, "start_date", "calendar.txt")))
                    .endDate(GtfsUtils.parseDate(required(row, "end_date", "calendar.txt")))
                    .build());
        }
        return calendar;
    }

    static List<CalendarDateException> loadCalendarExceptions(List<Map<String, String>> rows) {
        List<CalendarDateException> exceptions = new ArrayList<>();
        for (Map<String, String> row : rows) {
            String type = required(row, "exception_type", "calendar_dates.txt");
            int code;
            try {
                code = Integer.parseInt(type);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("calendar_dates.txt: invalid exception_type " + type, e);
            }
            exceptions.add(CalendarDateException.builder()
                    .serviceId(required(row, "service_id", "calendar_dates.txt"))
                    .date(GtfsUtils.parseDate(required(row, "date", "calendar_dates.txt")))
                    .exceptionType(ExceptionType.fromCode(code))
                    .build());
        }
        return exceptions;
    }

    /**
     * Stops indexed by {@code stop_code}; stops without a code cannot be looked
     * up by number and are left out.
     */
    static Map<String, Stop> loadStops(List<Map<String, String>> rows) {
        Map<String, Stop> stops = new HashMap<>();
        for (Map<String, String> row : rows) {
            String stopCode = row.get("stop_code");
            if (GtfsUtils.isBlank(stopCode)) {
                continue;
            }
            stops.put(stopCode, Stop.builder()
                    .stopId(required(row, "stop_id", "stops.txt"))
                    .stopCode(stopCode)
                    .stopName(row.get("stop_name"))
                    .lat(coordinate(row.get("stop_lat")))
                    .lon(coordinate(row.get("stop_lon")))
                    .build());
        }
        return stops;
    }

    static Map<String, Trip> loadTrips(List<Map<String, String>> rows) {
        Map<String, Trip> trips = new HashMap<>();
        for (Map<String, String> row : rows) {
            String tripId = required(row, "trip_id", "trips.txt");
            trips.put(tripId, Trip.builder()
                    .tripId(tripId)
                    .routeId(required(row, "route_id", "trips.txt"))
                    .serviceId(required(row, "service_id", "trips.txt"))
                    .tripHeadsign(row.get("trip_headsign"))
                    .build());
        }
        return trips;
    }

    /**
     * Stop times grouped by stop id. Rows without a departure time (untimed
     * stops) are skipped.
     */
    static Map<String, List<StopTime>> loadStopTimes(List<Map<String, String>> rows) {
        Map<String, List<StopTime>> byStop = new HashMap<>();
        for (Map<String, String> row : rows) {
            String departure = row.get("departure_time");
            if (GtfsUtils.isBlank(departure)) {
                continue;
            }
            String stopId = required(row, "stop_id", "stop_times.txt");
            byStop.computeIfAbsent(stopId, k -> new ArrayList<>()).add(StopTime.builder()
                    .tripId(required(row, "trip_id", "stop_times.txt"))
                    .stopId(stopId)
                    .departureSeconds(GtfsUtils.parseTimeSeconds(departure))
                    .build());
        }
        return byStop;
    }

    private static String required(Map<String, String> row, String column, String fileName) {
        String value = row.get(column);
        if (GtfsUtils.isBlank(value)) {
            throw new IllegalArgumentException(fileName + ": missing " + column + " in row " + row);
        }
        return value;
    }

    private static boolean flag(Map<String, String> row, String column) {
        return "1".equals(required(row, column, "calendar.txt"));
    }

    private static Double coordinate(String value) {
        if (GtfsUtils.isBlank(value)) {
            return null;
        }
        try {
            return Double.valueOf(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static byte[] stripBom(byte[] content) {
        if (content.length >= 3 && (content[0] & 0xFF) == 0xEF && (content[1] & 0xFF) == 0xBB
                && (content[2] & 0xFF) == 0xBF) {
            byte[] stripped = new byte[content.length - 3];
            System.arraycopy(content, 3, stripped, 0, stripped.length);
            return stripped;
        }
        return content;
    }
}
