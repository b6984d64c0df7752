/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.calendarseries.core.calendar;

/**
 * Variable calendar bounds of the proleptic Gregorian calendar.
 *
 * <p>All methods are pure and allocation free. Years are 1-based ({@code 1..9999}), months are
 * 1-based ({@code 1..12}). Week arithmetic follows ISO-8601: week 1 of a year is the week holding
 * its first Thursday, so a year has 53 weeks when January 1st is a Thursday, or a Wednesday in a
 * leap year.</p>
 */
public final class CalendarRules {

    public static final int MONTHS_IN_YEAR = 12;
    public static final int DAYS_IN_WEEK = 7;
    public static final int HOURS_IN_DAY = 24;
    public static final int HOURS_IN_WEEK = DAYS_IN_WEEK * HOURS_IN_DAY;

    public static final int MIN_DAYS_IN_MONTH = 28;
    public static final int MAX_DAYS_IN_MONTH = 31;
    public static final int MIN_DAYS_IN_YEAR = 365;
    public static final int MAX_DAYS_IN_YEAR = 366;
    public static final int MIN_WEEKS_IN_YEAR = 52;
    public static final int MAX_WEEKS_IN_YEAR = 53;
    public static final int MIN_HOURS_IN_MONTH = MIN_DAYS_IN_MONTH * HOURS_IN_DAY;
    public static final int MAX_HOURS_IN_MONTH = MAX_DAYS_IN_MONTH * HOURS_IN_DAY;
    public static final int MIN_HOURS_IN_YEAR = MIN_DAYS_IN_YEAR * HOURS_IN_DAY;
    public static final int MAX_HOURS_IN_YEAR = MAX_DAYS_IN_YEAR * HOURS_IN_DAY;

    /** Smallest year the calendar arithmetic supports. */
    public static final int MIN_YEAR = 1;
    /** Largest year the calendar arithmetic supports. */
    public static final int MAX_YEAR = 9999;

    private static final int[] DAYS_IN_MONTH = { 31, 28, 31, 30, 31, 30, 31, 31, 30, 31, 30, 31 };
    private static final int[] DAYS_BEFORE_MONTH = { 0, 31, 59, 90, 120, 151, 181, 212, 243, 273, 304, 334 };

    private CalendarRules() {
        // Utility class
    }

    public static boolean isLeapYear(int year) {
        return (year % 4 == 0) && (year % 100 != 0 || year % 400 == 0);
    }

    public static int daysInMonth(int year, int month) {
        checkMonth(month);
        if (month == 2 && isLeapYear(year)) {
            return 29;
        }
        return DAYS_IN_MONTH[month - 1];
    }

    public static int daysInYear(int year) {
        return isLeapYear(year) ? MAX_DAYS_IN_YEAR : MIN_DAYS_IN_YEAR;
    }

    public static int hoursInMonth(int year, int month) {
        return HOURS_IN_DAY * daysInMonth(year, month);
    }

    public static int hoursInYear(int year) {
        return HOURS_IN_DAY * daysInYear(year);
    }

    /**
     * Number of ISO-8601 weeks in the given year, either 52 or 53.
     *
     * @param year the week-based year
     * @return 53 if the year has a week 53, 52 otherwise
     */
    public static int weeksInYear(int year) {
        return (int) weeksBetweenYears(year, year + 1);
    }

    /**
     * Days elapsed from 0001-01-01 up to January 1st of {@code year}.
     *
     * @param year the year
     * @return the number of whole days before the year starts
     */
    public static long daysBeforeYear(int year) {
        long y = year - 1L;
        return 365L * y + Math.floorDiv(y, 4) - Math.floorDiv(y, 100) + Math.floorDiv(y, 400);
    }

    /**
     * Days in the half-open year range {@code [fromYear, toYear)}.
     */
    public static long daysBetweenYears(int fromYear, int toYear) {
        return daysBeforeYear(toYear) - daysBeforeYear(fromYear);
    }

    /**
     * Days of {@code year} that elapse before the first day of {@code month}.
     */
    public static int daysBeforeMonth(int year, int month) {
        checkMonth(month);
        int days = DAYS_BEFORE_MONTH[month - 1];
        if (month > 2 && isLeapYear(year)) {
            days++;
        }
        return days;
    }

    /**
     * ISO weeks in the half-open week-based year range {@code [fromYear, toYear)}.
     */
    public static long weeksBetweenYears(int fromYear, int toYear) {
        return (firstIsoMonday(toYear) - firstIsoMonday(fromYear)) / DAYS_IN_WEEK;
    }

    /**
     * Day of week of January 1st, {@code 0} for Monday through {@code 6} for Sunday.
     */
    public static int dayOfWeekOfJanuaryFirst(int year) {
        // 0001-01-01 was a Monday
        return (int) Math.floorMod(daysBeforeYear(year), DAYS_IN_WEEK);
    }

    // Day number (0001-01-01 based) of the Monday opening ISO week 1
    private static long firstIsoMonday(int year) {
        long januaryFirst = daysBeforeYear(year);
        int dayOfWeek = dayOfWeekOfJanuaryFirst(year);
        return dayOfWeek <= 3 ? januaryFirst - dayOfWeek : januaryFirst + DAYS_IN_WEEK - dayOfWeek;
    }

    private static void checkMonth(int month) {
        if (month < 1 || month > MONTHS_IN_YEAR) {
            throw new IllegalArgumentException("Month must be between 1 and 12, got: " + month);
        }
    }
}
