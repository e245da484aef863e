package com.tfigtfs.backend.calendar;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * One {@code calendar_dates.txt} row: a service added to or removed from a single day.
 */
@Value
@Builder
public class CalendarDateException {

    String serviceId;
    LocalDate date;
    ExceptionType exceptionType;

    public ServiceDate toServiceDate() {
        return new ServiceDate(serviceId, date);
    }
}
