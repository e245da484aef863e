package com.tfigtfs.backend.calendar;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ServiceCalendarExpanderTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 6, 19); // Thursday

    private static CalendarEntry weekdays(String serviceId, LocalDate start, LocalDate end) {
        return CalendarEntry.builder()
                .serviceId(serviceId)
                .monday(true).tuesday(true).wednesday(true).thursday(true).friday(true)
                .startDate(start)
                .endDate(end)
                .build();
    }

    private static CalendarDateException exception(String serviceId, LocalDate date, ExceptionType type) {
        return CalendarDateException.builder().serviceId(serviceId).date(date).exceptionType(type).build();
    }

    @Test
    void testExpand_WeeklyPatternWithinWindow() {
        CalendarEntry entry = weekdays("S1", TODAY.minusYears(1), TODAY.plusYears(1));

        Set<ServiceDate> expanded = ServiceCalendarExpander.expand(List.of(entry), List.of(), 0, 3, TODAY);

        // Thursday to Sunday, only the weekdays run
        assertEquals(Set.of(new ServiceDate("S1", TODAY), new ServiceDate("S1", TODAY.plusDays(1))), expanded);
    }

    @Test
    void testExpand_RespectsServiceValidity() {
        CalendarEntry entry = weekdays("S1", TODAY.plusDays(1), TODAY.plusDays(1));

        Set<ServiceDate> expanded = ServiceCalendarExpander.expand(List.of(entry), List.of(), TODAY);

        assertEquals(Set.of(new ServiceDate("S1", TODAY.plusDays(1))), expanded);
    }

    @Test
    void testExpand_DefaultWindowIsTwoDaysBackToSevenAhead() {
        CalendarEntry daily = CalendarEntry.builder()
                .serviceId("S1")
                .monday(true).tuesday(true).wednesday(true).thursday(true).friday(true).saturday(true).sunday(true)
                .startDate(TODAY.minusYears(1))
                .endDate(TODAY.plusYears(1))
                .build();

        Set<ServiceDate> expanded = ServiceCalendarExpander.expand(List.of(daily), List.of(), TODAY);

        assertEquals(10, expanded.size());
        assertTrue(expanded.contains(new ServiceDate("S1", TODAY.minusDays(2))));
        assertTrue(expanded.contains(new ServiceDate("S1", TODAY.plusDays(7))));
        assertFalse(expanded.contains(new ServiceDate("S1", TODAY.plusDays(8))));
    }

    @Test
    void testExpand_AddedAndRemovedExceptions() {
        CalendarEntry entry = weekdays("S1", TODAY.minusYears(1), TODAY.plusYears(1));
        LocalDate saturday = TODAY.plusDays(2);

        Set<ServiceDate> expanded = ServiceCalendarExpander.expand(List.of(entry), List.of(
                exception("S1", TODAY, ExceptionType.SERVICE_REMOVED),
                exception("S1", saturday, ExceptionType.SERVICE_ADDED),
                exception("S2", saturday, ExceptionType.SERVICE_ADDED)), 0, 2, TODAY);

        assertEquals(Set.of(
                new ServiceDate("S1", TODAY.plusDays(1)),
                new ServiceDate("S1", saturday),
                new ServiceDate("S2", saturday)), expanded);
    }

    @Test
    void testExpand_AddedAndRemovedSameDay_RemovalWins() {
        Set<ServiceDate> expanded = ServiceCalendarExpander.expand(List.of(), List.of(
                exception("S2", TODAY, ExceptionType.SERVICE_REMOVED),
                exception("S2", TODAY, ExceptionType.SERVICE_ADDED)), 0, 0, TODAY);

        assertTrue(expanded.isEmpty());
    }

    @Test
    void testExpand_ExceptionsOutsideWindowIgnored() {
        Set<ServiceDate> expanded = ServiceCalendarExpander.expand(List.of(), List.of(
                exception("S2", TODAY.plusDays(30), ExceptionType.SERVICE_ADDED)), TODAY);

        assertTrue(expanded.isEmpty());
    }

    @Test
    void testExpand_EmptyWindow() {
        CalendarEntry entry = weekdays("S1", TODAY.minusYears(1), TODAY.plusYears(1));

        assertTrue(ServiceCalendarExpander.expand(List.of(entry), List.of(), 1, 0, TODAY).isEmpty());
    }

    @Test
    void testExceptionType_UnknownCode_Throws() {
        assertEquals(ExceptionType.SERVICE_ADDED, ExceptionType.fromCode(1));
        assertThrows(IllegalArgumentException.class, () -> ExceptionType.fromCode(3));
    }
}
