package com.di.samplenova.util;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.temporal.IsoFields;

/**
 * Year, month and day parsed from a partial ISO date ("2020-01-05", "2020-01", "2020", "").
 * Each part is null when absent or not numeric.
 */
public record DateParts(Integer year, Integer month, Integer day) {

    private static final DateParts EMPTY = new DateParts(null, null, null);

    /**
     * Splits the date on '-' into at most three parts. A third part keeps any further dashes
     * and is therefore not numeric ("2020-01-01-x" has no day).
     *
     * @param date the raw date value, may be null
     * @return parsed parts, never null
     */
    public static DateParts parse(String date) {
        if (date == null) {
            return EMPTY;
        }
        String[] parts = date.split("-", 3);
        return new DateParts(
                parsePart(parts, 0),
                parsePart(parts, 1),
                parsePart(parts, 2));
    }

    private static Integer parsePart(String[] parts, int index) {
        if (index >= parts.length) {
            return null;
        }
        String part = parts[index].trim();
        if (part.isEmpty()) {
            return null;
        }
        try {
            return Integer.valueOf(part);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Returns the calendar date when all three parts are present and form a valid date, otherwise null.
     */
    public LocalDate toLocalDate() {
        if (year == null || month == null || day == null) {
            return null;
        }
        try {
            return LocalDate.of(year, month, day);
        } catch (DateTimeException e) {
            return null;
        }
    }

    /**
     * ISO week-based year of the full date, or null when the date is incomplete or invalid.
     */
    public Integer isoWeekYear() {
        LocalDate date = toLocalDate();
        return date == null ? null : date.get(IsoFields.WEEK_BASED_YEAR);
    }

    /**
     * ISO week number of the full date, or null when the date is incomplete or invalid.
     */
    public Integer isoWeek() {
        LocalDate date = toLocalDate();
        return date == null ? null : date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR);
    }
}
