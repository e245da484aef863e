package com.tfigtfs.backend.download;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives how long to wait before re-fetching a resource from the
 * {@code Cache-Control}, {@code Age}, {@code Last-Modified} and {@code Expires}
 * headers of its last response. HTTP dates are read through {@link HttpHeaders},
 * which accepts the RFC 1123, RFC 850 and asctime forms. All results are whole
 * seconds, never negative; 0 means "could not tell" or "already stale".
 */
@Slf4j
public final class HeaderFreshness {

    private static final Pattern MAX_AGE = Pattern.compile("max-age=([0-9]+)");

    private HeaderFreshness() {
    }

    public static long cacheControlWait(HttpHeaders headers, Clock clock) {
        String cacheControl = headers.getFirst(HttpHeaders.CACHE_CONTROL);
        if (cacheControl == null) {
            return 0;
        }
        cacheControl = cacheControl.toLowerCase(Locale.ROOT);

        if (cacheControl.contains("no-cache")) {
            return 0;
        }

        Matcher matcher = MAX_AGE.matcher(cacheControl);
        if (matcher.find()) {
            long maxAge;
            try {
                maxAge = Long.parseLong(matcher.group(1));
            } catch (NumberFormatException e) {
                log.debug("Unusable max-age directive: {}", cacheControl);
                return 0;
            }

            String age = headers.getFirst(HttpHeaders.AGE);
            if (age != null) {
                try {
                    return clipAtZero(maxAge - Long.parseLong(age.trim()));
                } catch (NumberFormatException e) {
                    log.debug("Unusable Age header: {}", age);
                    return 0;
                }
            }

            long lastModified = headers.getLastModified();
            if (lastModified >= 0) {
                return clipAtZero(secondsUntil(lastModified, maxAge, clock));
            }
        }

        return 0;
    }

    public static long expiresWait(HttpHeaders headers, Clock clock) {
        // -1 when absent, "0" or not a valid HTTP-date
        long expires = headers.getExpires();
        if (expires < 0) {
            return 0;
        }
        return clipAtZero(secondsUntil(expires, 0, clock));
    }

    /**
     * Cache-Control takes precedence over Expires when both are present.
     */
    public static Duration autoWait(HttpHeaders headers, Clock clock, Duration defaultWait) {
        long cacheControl = cacheControlWait(headers, clock);
        long expires = expiresWait(headers, clock);
        log.debug("Cache-Control: {} secs., Expires: {} secs.", cacheControl, expires);

        if (cacheControl > 0) {
            return Duration.ofSeconds(cacheControl);
        }
        if (expires > 0) {
            return Duration.ofSeconds(expires);
        }
        return defaultWait;
    }

    /**
     * Seconds from now until {@code epochMillis + offsetSeconds}; negative if
     * that moment has passed.
     */
    static long secondsUntil(long epochMillis, long offsetSeconds, Clock clock) {
        Instant target = Instant.ofEpochMilli(epochMillis).plusSeconds(offsetSeconds);
        return Duration.between(clock.instant(), target).getSeconds();
    }

    private static long clipAtZero(long seconds) {
        return Math.max(seconds, 0);
    }
}
