/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.calendarseries.core.calendar;

import java.util.Locale;

/**
 * Calendar dimensions a series can be addressed by, declared in canonical coarse to fine order.
 *
 * <p>The range of every dimension but {@link #YEAR} depends on its parent, the next coarser
 * dimension selected by the series, and on the already fixed year and parent value. For example
 * {@code day} under {@code month} ranges over {@code 1..days_in_month(year, month)} while
 * {@code day} under {@code year} ranges over {@code 1..days_in_year(year)}. {@link #MONTH} and
 * {@link #WEEK} share the same rank and never appear together in one series.</p>
 */
public enum DimensionName {
    YEAR("year", 0, 1),
    MONTH("month", 1, 1),
    WEEK("week", 1, 1),
    DAY("day", 2, 1),
    HOUR("hour", 3, 0);

    private final String fieldName;
    private final int rank;
    private final int minimum;

    DimensionName(String fieldName, int rank, int minimum) {
        this.fieldName = fieldName;
        this.rank = rank;
        this.minimum = minimum;
    }

    /**
     * Column and display name of this dimension.
     * @return the lower case name
     */
    public String fieldName() {
        return fieldName;
    }

    /**
     * Position in the canonical order; month and week share rank 1.
     * @return the rank
     */
    public int rank() {
        return rank;
    }

    /**
     * Smallest legal value: {@code 0} for hours, {@code 1} for all others.
     * @return the minimum value
     */
    public int minimum() {
        return minimum;
    }

    /**
     * Number of values this dimension takes inside one unit of its parent.
     *
     * @param parent the next coarser dimension of the series
     * @param year the year the value belongs to
     * @param parentValue the value of {@code parent}; only read when the parent is a month
     * @return the count of legal values
     * @throws IllegalArgumentException if {@code parent} cannot contain this dimension
     */
    public int size(DimensionName parent, int year, int parentValue) {
        if (parent == null) {
            throw new IllegalArgumentException("Dimension [" + fieldName + "] requires a parent dimension");
        }
        switch (this) {
            case MONTH:
                requireParent(parent, YEAR);
                return CalendarRules.MONTHS_IN_YEAR;
            case WEEK:
                requireParent(parent, YEAR);
                return CalendarRules.weeksInYear(year);
            case DAY:
                switch (parent) {
                    case MONTH:
                        return CalendarRules.daysInMonth(year, parentValue);
                    case WEEK:
                        return CalendarRules.DAYS_IN_WEEK;
                    case YEAR:
                        return CalendarRules.daysInYear(year);
                    default:
                        throw invalidParent(parent);
                }
            case HOUR:
                switch (parent) {
                    case DAY:
                        return CalendarRules.HOURS_IN_DAY;
                    case WEEK:
                        return CalendarRules.HOURS_IN_WEEK;
                    case MONTH:
                        return CalendarRules.hoursInMonth(year, parentValue);
                    case YEAR:
                        return CalendarRules.hoursInYear(year);
                    default:
                        throw invalidParent(parent);
                }
            default:
                throw new IllegalArgumentException("Dimension [" + fieldName + "] has no parent");
        }
    }

    /**
     * Largest legal value inside one unit of its parent.
     */
    public int maximum(DimensionName parent, int year, int parentValue) {
        return minimum + size(parent, year, parentValue) - 1;
    }

    /**
     * Describes the bound {@link #size} computes, e.g. {@code days_in_month(2023,2)=28}.
     */
    public String describeBound(DimensionName parent, int year, int parentValue) {
        int size = size(parent, year, parentValue);
        String function = switch (this) {
            case MONTH -> "months_in_year";
            case WEEK -> "weeks_in_year(" + year + ")";
            case DAY -> switch (parent) {
                case MONTH -> "days_in_month(" + year + "," + parentValue + ")";
                case WEEK -> "days_in_week";
                default -> "days_in_year(" + year + ")";
            };
            case HOUR -> switch (parent) {
                case DAY -> "hours_in_day";
                case WEEK -> "hours_in_week";
                case MONTH -> "hours_in_month(" + year + "," + parentValue + ")";
                default -> "hours_in_year(" + year + ")";
            };
            default -> throw new IllegalArgumentException("Dimension [" + fieldName + "] has no parent");
        };
        return function + "=" + size;
    }

    /**
     * Resolves a dimension from its field name, ignoring case and surrounding blanks.
     *
     * @param name the field name
     * @return the matching dimension
     * @throws IllegalArgumentException if no dimension has that name
     */
    public static DimensionName fromString(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Dimension name cannot be null");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (DimensionName dimension : values()) {
            if (dimension.fieldName.equals(normalized)) {
                return dimension;
            }
        }
        throw new IllegalArgumentException("Unknown dimension: " + name);
    }

    private void requireParent(DimensionName parent, DimensionName expected) {
        if (parent != expected) {
            throw invalidParent(parent);
        }
    }

    private IllegalArgumentException invalidParent(DimensionName parent) {
        return new IllegalArgumentException("Dimension [" + fieldName + "] cannot be nested under [" + parent + "]");
    }

    @Override
    public String toString() {
        return fieldName;
    }
}
