package com.tfigtfs.backend.calendar;

import lombok.Builder;
import lombok.Value;

import java.time.DayOfWeek;
import java.time.LocalDate;

/**
 * One {@code calendar.txt} row: the weekly pattern of a service between two
 * inclusive dates.
 */
@Value
@Builder
public class CalendarEntry {

    String serviceId;
    boolean monday;
    boolean tuesday;
    boolean wednesday;
    boolean thursday;
    boolean friday;
    boolean saturday;
    boolean sunday;
    LocalDate startDate;
    LocalDate endDate;

    public boolean runsOn(DayOfWeek day) {
        switch (day) {
            case MONDAY:
                return monday;
            case TUESDAY:
                return tuesday;
            case WEDNESDAY:
                return wednesday;
            case THURSDAY:
                return thursday;
            case FRIDAY:
                return friday;
            case SATURDAY:
                return saturday;
            default:
                return sunday;
        }
    }

    public boolean isValidOn(LocalDate date) {
        return !date.isBefore(startDate) && !date.isAfter(endDate);
    }

    public boolean isActiveOn(LocalDate date) {
        return isValidOn(date) && runsOn(date.getDayOfWeek());
    }
}
