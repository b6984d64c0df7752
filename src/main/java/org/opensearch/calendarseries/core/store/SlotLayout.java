/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.calendarseries.core.store;

import org.opensearch.calendarseries.core.address.DimensionAddress;
import org.opensearch.calendarseries.core.address.SeriesMetadata;
import org.opensearch.calendarseries.core.calendar.CalendarRules;
import org.opensearch.calendarseries.core.calendar.DimensionName;
import org.opensearch.calendarseries.core.utils.Constants;

/**
 * Maps addresses to slots of the dense value array.
 *
 * <p>Slots are laid out in odometer order, one per finest-grain unit. The slot of an address is
 * the number of finest units elapsed since the first address of the series, computed in constant
 * time from closed-form calendar sums: elapsed units of whole years, then of whole months or
 * weeks, then of days, then the hour offset.</p>
 */
public final class SlotLayout {

    private SlotLayout() {
        // Utility class
    }

    /**
     * Zero-based slot of an address. The address is assumed valid for the series.
     *
     * @param address a valid address
     * @param metadata the series
     * @return the slot index
     */
    public static long position(DimensionAddress address, SeriesMetadata metadata) {
        int year = address.get(DimensionName.YEAR);
        return slotsBetweenYears(metadata, metadata.startYear(), year) + slotsWithinYear(address, year, metadata);
    }

    /**
     * Number of slots covering the whole series range.
     */
    public static long totalSlots(SeriesMetadata metadata) {
        return slotsBetweenYears(metadata, metadata.startYear(), metadata.startYear() + metadata.yearCount());
    }

    /**
     * Byte offset of a slot in the series file.
     */
    public static long byteOffset(long slot, SeriesMetadata metadata) {
        return Constants.Store.HEADER_LENGTH + slot * metadata.valueWidth();
    }

    /**
     * Expected size of a series file, header included.
     */
    public static long fileLength(SeriesMetadata metadata) {
        return byteOffset(totalSlots(metadata), metadata);
    }

    static long slotsBetweenYears(SeriesMetadata metadata, int fromYear, int toYear) {
        boolean weekBased = metadata.contains(DimensionName.WEEK);
        switch (metadata.finest()) {
            case YEAR:
                return toYear - fromYear;
            case MONTH:
                return (long) CalendarRules.MONTHS_IN_YEAR * (toYear - fromYear);
            case WEEK:
                return CalendarRules.weeksBetweenYears(fromYear, toYear);
            case DAY:
                return weekBased
                    ? CalendarRules.DAYS_IN_WEEK * CalendarRules.weeksBetweenYears(fromYear, toYear)
                    : CalendarRules.daysBetweenYears(fromYear, toYear);
            case HOUR:
                return weekBased
                    ? CalendarRules.HOURS_IN_WEEK * CalendarRules.weeksBetweenYears(fromYear, toYear)
                    : CalendarRules.HOURS_IN_DAY * CalendarRules.daysBetweenYears(fromYear, toYear);
            default:
                throw new IllegalStateException("Unknown dimension: " + metadata.finest());
        }
    }

    private static long slotsWithinYear(DimensionAddress address, int year, SeriesMetadata metadata) {
        DimensionName finest = metadata.finest();
        if (finest == DimensionName.YEAR) {
            return 0;
        }
        boolean hasDay = metadata.contains(DimensionName.DAY);
        long days;
        if (metadata.contains(DimensionName.MONTH)) {
            int month = address.get(DimensionName.MONTH);
            if (finest == DimensionName.MONTH) {
                return month - 1;
            }
            days = CalendarRules.daysBeforeMonth(year, month);
        } else if (metadata.contains(DimensionName.WEEK)) {
            long weeks = address.get(DimensionName.WEEK) - 1;
            if (finest == DimensionName.WEEK) {
                return weeks;
            }
            if (!hasDay) {
                return CalendarRules.HOURS_IN_WEEK * weeks + address.get(DimensionName.HOUR);
            }
            days = CalendarRules.DAYS_IN_WEEK * weeks;
        } else {
            days = 0;
        }
        if (hasDay) {
            days += address.get(DimensionName.DAY) - 1;
        }
        if (finest == DimensionName.DAY) {
            return days;
        }
        return CalendarRules.HOURS_IN_DAY * days + address.get(DimensionName.HOUR);
    }
}
