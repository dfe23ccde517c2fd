package com.fxplatform.common.model;

import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.Instant;

/**
 * Daily trading window, expressed in UTC.
 *
 * <p>A window whose {@code start} is after its {@code end} is empty: the intersection of two
 * non-overlapping windows never opens.
 */
public record TradingHours(LocalTime start, LocalTime end, String timezone) {

    public static final String UTC = "UTC";

    public TradingHours {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Trading hours require both start and end");
        }
        timezone = (timezone == null || timezone.isBlank()) ? UTC : timezone;
    }

    public static TradingHours allDay() {
        return new TradingHours(LocalTime.of(0, 0), LocalTime.of(23, 59), UTC);
    }

    public static TradingHours of(String start, String end) {
        return new TradingHours(LocalTime.parse(start), LocalTime.parse(end), UTC);
    }

    /** Later start, earlier end. */
    public TradingHours intersect(TradingHours other) {
        LocalTime s = start.isAfter(other.start) ? start : other.start;
        LocalTime e = end.isBefore(other.end) ? end : other.end;
        return new TradingHours(s, e, UTC);
    }

    public boolean isOpenAt(LocalTime time) {
        return !time.isBefore(start) && !time.isAfter(end);
    }

    public boolean isOpenAt(Instant instant) {
        return isOpenAt(ZonedDateTime.ofInstant(instant, ZoneOffset.UTC).toLocalTime());
    }
}
