package com.tfigtfs.backend.download;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

/**
 * When a {@link DownloadAgent} fetches its resource again after a successful update.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class FetchSchedule {

    public enum Kind {
        /** Every {@code period} from {@code anchor}. */
        FIXED_INTERVAL,
        /** Sleep derived from the Cache-Control / Expires headers of the last response. */
        AUTO,
        /** A single fetch, never repeated. */
        MANUAL
    }

    private static final FetchSchedule AUTO = new FetchSchedule(Kind.AUTO, null, null);
    private static final FetchSchedule MANUAL = new FetchSchedule(Kind.MANUAL, null, null);

    private final Kind kind;
    private final LocalDateTime anchor;
    private final Duration period;

    public static FetchSchedule fixed(LocalDateTime anchor, Duration period) {
        if (anchor == null) {
            throw new IllegalArgumentException("A fixed schedule needs an anchor time");
        }
        requirePositive(period);
        return new FetchSchedule(Kind.FIXED_INTERVAL, anchor, period);
    }

    public static FetchSchedule auto() {
        return AUTO;
    }

    public static FetchSchedule manual() {
        return MANUAL;
    }

    public static FetchSchedule everyMinute(Clock clock) {
        return everyNMinutes(clock, 1);
    }

    public static FetchSchedule everyNMinutes(Clock clock, int minutes) {
        return fixed(LocalDateTime.now(clock), Duration.ofMinutes(minutes));
    }

    public static FetchSchedule hourly(Clock clock, Integer atMinute) {
        return everyNHours(clock, 1, atMinute);
    }

    public static FetchSchedule everyNHours(Clock clock, int hours, Integer atMinute) {
        LocalDateTime anchor = LocalDateTime.now(clock);
        if (atMinute != null) {
            anchor = anchor.withMinute(atMinute).truncatedTo(ChronoUnit.MINUTES);
        }
        return fixed(anchor, Duration.ofHours(hours));
    }

    public static FetchSchedule daily(Clock clock, Integer atHour, Integer atMinute) {
        return everyNDays(clock, 1, atHour, atMinute);
    }

    public static FetchSchedule everyNDays(Clock clock, int days, Integer atHour, Integer atMinute) {
        LocalDateTime anchor = LocalDateTime.now(clock);
        if (atHour != null || atMinute != null) {
            anchor = anchor
                    .withHour(atHour != null ? atHour : 0)
                    .withMinute(atMinute != null ? atMinute : 0)
                    .truncatedTo(ChronoUnit.MINUTES);
        }
        return fixed(anchor, Duration.ofDays(days));
    }

    public boolean isFixedInterval() {
        return kind == Kind.FIXED_INTERVAL;
    }

    public boolean isAuto() {
        return kind == Kind.AUTO;
    }

    public boolean isManual() {
        return kind == Kind.MANUAL;
    }

    /**
     * The first {@code anchor + k * period} strictly after {@code now}. Missed
     * cycles collapse into the next one. An anchor still in the future is
     * returned as is.
     */
    public static LocalDateTime nextExecutionTime(LocalDateTime anchor, Duration period, LocalDateTime now) {
        requirePositive(period);
        if (anchor.isAfter(now)) {
            return anchor;
        }
        long elapsed = Duration.between(anchor, now).toMillis();
        long cycles = elapsed / period.toMillis() + 1;
        return anchor.plus(period.multipliedBy(cycles));
    }

    private static void requirePositive(Duration period) {
        if (period == null || period.isNegative() || period.isZero() || period.toMillis() == 0) {
            throw new IllegalArgumentException("Schedule period must be positive: " + period);
        }
    }

    @Override
    public String toString() {
        switch (kind) {
            case FIXED_INTERVAL:
                return "every " + period + " from " + anchor;
            case AUTO:
                return "auto (Cache-Control/Expires)";
            default:
                return "manual";
        }
    }
}
