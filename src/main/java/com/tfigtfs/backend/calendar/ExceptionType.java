package com.tfigtfs.backend.calendar;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * {@code exception_type} of a {@code calendar_dates.txt} row.
 */
@Getter
@RequiredArgsConstructor
public enum ExceptionType {
    SERVICE_ADDED(1),
    SERVICE_REMOVED(2);

    private final int code;

    public static ExceptionType fromCode(int code) {
        for (ExceptionType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown calendar exception type: " + code);
    }
}
