package com.tfigtfs.backend.calendar;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Expands the weekly schedules of {@code calendar.txt} plus the dated exceptions
 * of {@code calendar_dates.txt} into the concrete (service, date) pairs of a
 * window around today.
 * <p>
 * Additions are applied before removals, so a service both added and removed on
 * the same date ends up removed.
 */
public final class ServiceCalendarExpander {

    public static final int DEFAULT_START_OFFSET = -2;
    public static final int DEFAULT_STOP_OFFSET = 7;

    private ServiceCalendarExpander() {
    }

    /**
     * @param startOffset first day of the window, in days from {@code today} (inclusive)
     * @param stopOffset  last day of the window, in days from {@code today} (inclusive)
     * @return an unmodifiable set, empty when {@code startOffset > stopOffset}
     */
    public static Set<ServiceDate> expand(Collection<CalendarEntry> calendar,
            Collection<CalendarDateException> exceptions, int startOffset, int stopOffset, LocalDate today) {
        LocalDate fromDate = today.plusDays(startOffset);
        LocalDate toDate = today.plusDays(stopOffset);

        Set<ServiceDate> expanded = new LinkedHashSet<>();

        // standard schedule from the weekly flags
        for (LocalDate date = fromDate; !date.isAfter(toDate); date = date.plusDays(1)) {
            for (CalendarEntry entry : calendar) {
                if (entry.isActiveOn(date)) {
                    expanded.add(new ServiceDate(entry.getServiceId(), date));
                }
            }
        }

        for (CalendarDateException exception : exceptions) {
            if (exception.getExceptionType() == ExceptionType.SERVICE_ADDED
                    && inWindow(exception.getDate(), fromDate, toDate)) {
                expanded.add(exception.toServiceDate());
            }
        }

        for (CalendarDateException exception : exceptions) {
            if (exception.getExceptionType() == ExceptionType.SERVICE_REMOVED
                    && inWindow(exception.getDate(), fromDate, toDate)) {
                expanded.remove(exception.toServiceDate());
            }
        }

        return Collections.unmodifiableSet(expanded);
    }

    public static Set<ServiceDate> expand(Collection<CalendarEntry> calendar,
            Collection<CalendarDateException> exceptions, LocalDate today) {
        return expand(calendar, exceptions, DEFAULT_START_OFFSET, DEFAULT_STOP_OFFSET, today);
    }

    private static boolean inWindow(LocalDate date, LocalDate fromDate, LocalDate toDate) {
        return !date.isBefore(fromDate) && !date.isAfter(toDate);
    }
}
