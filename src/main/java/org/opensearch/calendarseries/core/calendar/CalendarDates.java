/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.calendarseries.core.calendar;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.IsoFields;
import java.util.List;
import java.util.Locale;

/**
 * Maps calendar coordinates to the instant that starts them, and back.
 *
 * <p>The instant of a coordinate is the start of its finest unit: {@code [2024, 3]} in a
 * {@code [year, month]} series is {@code 2024-03-01T00:00}, {@code [2026, 1]} in a
 * {@code [year, week]} series is the Monday opening ISO week 1, {@code 2025-12-29T00:00}. Days
 * and hours count from the start of their parent unit whatever that parent is.</p>
 */
public final class CalendarDates {

    public static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("uuuu-MM-dd", Locale.ROOT)
        .withResolverStyle(ResolverStyle.STRICT);
    public static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss", Locale.ROOT)
        .withResolverStyle(ResolverStyle.STRICT);

    private CalendarDates() {
        // Utility class
    }

    /**
     * Instant starting the unit a coordinate addresses.
     *
     * @param dimensions the dimensions, coarse to fine, starting with {@code year}
     * @param values the value of each dimension; already validated against its bound
     * @return the start of the finest unit
     */
    public static LocalDateTime toDateTime(List<DimensionName> dimensions, int[] values) {
        int year = values[0];
        LocalDateTime start = LocalDate.of(year, 1, 1).atStartOfDay();
        for (int i = 1; i < dimensions.size(); i++) {
            int value = values[i];
            switch (dimensions.get(i)) {
                case MONTH -> start = start.withMonth(value);
                case WEEK -> start = isoWeekOneMonday(year).plusWeeks(value - 1L).atStartOfDay();
                case DAY -> start = start.plusDays(value - 1L);
                case HOUR -> start = start.plusHours(value);
                default -> throw new IllegalArgumentException("Dimension [" + dimensions.get(i) + "] must come first");
            }
        }
        return start;
    }

    /**
     * Coordinates of the unit starting at {@code dateTime}. Years are ISO week-based years when the
     * dimensions include {@code week}.
     *
     * @param dateTime the start of a unit
     * @param dimensions the dimensions, coarse to fine, starting with {@code year}
     * @return the value of each dimension
     * @throws IllegalArgumentException if {@code dateTime} does not start a unit of the finest dimension
     */
    public static int[] fromDateTime(LocalDateTime dateTime, List<DimensionName> dimensions) {
        LocalDate date = dateTime.toLocalDate();
        int[] values = new int[dimensions.size()];
        values[0] = dimensions.contains(DimensionName.WEEK) ? date.get(IsoFields.WEEK_BASED_YEAR) : date.getYear();
        for (int i = 1; i < dimensions.size(); i++) {
            DimensionName parent = dimensions.get(i - 1);
            values[i] = switch (dimensions.get(i)) {
                case MONTH -> date.getMonthValue();
                case WEEK -> date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR);
                case DAY -> dayIn(date, parent);
                case HOUR -> parent == DimensionName.DAY
                    ? dateTime.getHour()
                    : (dayIn(date, parent) - 1) * CalendarRules.HOURS_IN_DAY + dateTime.getHour();
                default -> throw new IllegalArgumentException("Dimension [" + dimensions.get(i) + "] must come first");
            };
        }
        if (toDateTime(dimensions, values).equals(dateTime) == false) {
            throw new IllegalArgumentException(
                "[" + dateTime + "] does not start a [" + dimensions.get(dimensions.size() - 1) + "] of " + dimensions
            );
        }
        return values;
    }

    /**
     * Whether instants of these dimensions carry a time of day.
     */
    public static boolean hasTimeOfDay(List<DimensionName> dimensions) {
        return dimensions.contains(DimensionName.HOUR);
    }

    public static String format(LocalDateTime dateTime, boolean withTime) {
        return withTime ? DATE_TIME.format(dateTime) : DATE.format(dateTime);
    }

    /**
     * @throws DateTimeParseException if {@code text} is not a strict ISO-8601 date, or date and time
     */
    public static LocalDateTime parse(String text, boolean withTime) {
        return withTime ? LocalDateTime.parse(text, DATE_TIME) : LocalDate.parse(text, DATE).atStartOfDay();
    }

    private static LocalDate isoWeekOneMonday(int year) {
        // January 4th always falls in ISO week 1
        return LocalDate.of(year, 1, 4).with(DayOfWeek.MONDAY);
    }

    private static int dayIn(LocalDate date, DimensionName parent) {
        return switch (parent) {
            case MONTH -> date.getDayOfMonth();
            case WEEK -> date.getDayOfWeek().getValue();
            case YEAR -> date.getDayOfYear();
            default -> throw new IllegalArgumentException("Day cannot be nested under [" + parent + "]");
        };
    }
}
