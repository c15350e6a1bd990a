package com.example.paytracker.common;

import com.example.paytracker.exception.BusinessException;

import java.time.LocalTime;
import java.util.regex.Pattern;

/**
 * Parsing for the 24h {@code H:MM} / {@code HH:MM} clock times users type into schedules and timesheets.
 */
public final class ClockTimes {

    private static final Pattern MILITARY_TIME = Pattern.compile("^([0-1]?[0-9]|2[0-3]):[0-5][0-9]$");

    private ClockTimes() {
    }

    /**
     * @return the parsed time, or {@code null} for a blank value
     * @throws BusinessException with code {@code INVALID_TIME} when the value is not a 24h clock time
     */
    public static LocalTime parseOrNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        if (!MILITARY_TIME.matcher(trimmed).matches()) {
            throw new BusinessException("INVALID_TIME", "Time must be HH:MM in 24h format: " + trimmed, trimmed);
        }
        int colon = trimmed.indexOf(':');
        return LocalTime.of(Integer.parseInt(trimmed.substring(0, colon)), Integer.parseInt(trimmed.substring(colon + 1)));
    }

    public static String format(LocalTime time) {
        return time == null ? null : String.format("%02d:%02d", time.getHour(), time.getMinute());
    }
}
