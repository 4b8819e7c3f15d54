package com.infomedia.abacox.cdrexception.component.cdrprocessing;

import lombok.extern.log4j.Log4j2;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

@Log4j2
public class DateTimeUtil {

    public static final DateTimeFormatter RUN_PARAMETER_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private DateTimeUtil() {
    }

    /**
     * CDR/CMR timestamps are seconds since the epoch, always UTC.
     *
     * @return The instant, or null when the value is empty, not numeric or negative.
     */
    public static Instant parseEpochSeconds(String epochSecondsStr) {
        if (epochSecondsStr == null || epochSecondsStr.isEmpty()) return null;
        try {
            long epochSeconds = Long.parseLong(epochSecondsStr);
            return epochSeconds >= 0 ? Instant.ofEpochSecond(epochSeconds) : null;
        } catch (NumberFormatException e) {
            log.debug("Failed to parse epoch seconds: {}", epochSecondsStr);
            return null;
        }
    }

    public static LocalDate toUtcDate(Instant instant) {
        return instant.atOffset(ZoneOffset.UTC).toLocalDate();
    }

    public static LocalDateTime toUtcDateTime(Instant instant) {
        return instant == null ? null : LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    /**
     * Parses a run window bound given as "yyyy-MM-dd HH:mm:ss" in UTC.
     *
     * @throws IllegalArgumentException if the value does not match the format.
     */
    public static Instant parseUtcDateTime(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Date/time value is missing");
        }
        try {
            return LocalDateTime.parse(value.trim(), RUN_PARAMETER_FORMAT).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Incorrectly formatted date/time '" + value + "', expected yyyy-MM-dd HH:mm:ss", e);
        }
    }

    public static String formatUtc(Instant instant) {
        return instant == null ? "" : RUN_PARAMETER_FORMAT.format(toUtcDateTime(instant));
    }
}
