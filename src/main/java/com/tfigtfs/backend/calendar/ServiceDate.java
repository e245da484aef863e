package com.tfigtfs.backend.calendar;

import lombok.Value;

import java.time.LocalDate;

/**
 * "This service runs on this date."
 */
@Value
public class ServiceDate {
    String serviceId;
    LocalDate date;
}
