/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.calendarseries.core.address;

import org.opensearch.calendarseries.core.calendar.CalendarRules;
import org.opensearch.calendarseries.core.calendar.DimensionName;
import org.opensearch.calendarseries.core.errors.AddressRangeException;
import org.opensearch.calendarseries.core.utils.Constants;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;

/**
 * Immutable description of a calendar-addressed series: the dimensions it is addressed by, the
 * years it covers, the width of one stored value and an optional unit label such as {@code MWh}.
 *
 * <p>Dimension sets always contain {@code year}, are kept in canonical order and never combine
 * {@code month} with {@code week}. The series covers the years
 * {@code [startYear, startYear + yearCount)}.</p>
 */
public final class SeriesMetadata {

    private final DimensionName[] dimensions;
    private final int startYear;
    private final int yearCount;
    private final int valueWidth;
    private final String unit;

    /**
     * Creates metadata storing 64-bit values.
     *
     * @param dimensions the dimensions, in any order
     * @param startYear first covered year
     * @param yearCount number of covered years
     */
    public SeriesMetadata(List<DimensionName> dimensions, int startYear, int yearCount) {
        this(dimensions, startYear, yearCount, Constants.Store.VALUE_WIDTH);
    }

    /**
     * @param dimensions the dimensions, in any order
     * @param startYear first covered year
     * @param yearCount number of covered years
     * @param valueWidth bytes per stored value
     * @throws IllegalArgumentException if the combination is not a legal series
     */
    public SeriesMetadata(List<DimensionName> dimensions, int startYear, int yearCount, int valueWidth) {
        this(dimensions, startYear, yearCount, valueWidth, "");
    }

    /**
     * @param dimensions the dimensions, in any order
     * @param startYear first covered year
     * @param yearCount number of covered years
     * @param valueWidth bytes per stored value
     * @param unit unit of the stored values, empty when unspecified
     * @throws IllegalArgumentException if the combination is not a legal series
     */
    public SeriesMetadata(List<DimensionName> dimensions, int startYear, int yearCount, int valueWidth, String unit) {
        if (dimensions == null || dimensions.isEmpty()) {
            throw new IllegalArgumentException("Series must have at least one dimension");
        }
        EnumSet<DimensionName> set = EnumSet.noneOf(DimensionName.class);
        for (DimensionName dimension : dimensions) {
            if (dimension == null) {
                throw new IllegalArgumentException("Dimension cannot be null");
            }
            if (!set.add(dimension)) {
                throw new IllegalArgumentException("Duplicate dimension: " + dimension);
            }
        }
        if (!set.contains(DimensionName.YEAR)) {
            throw new IllegalArgumentException("Series dimensions must include [year], got: " + dimensions);
        }
        if (set.contains(DimensionName.MONTH) && set.contains(DimensionName.WEEK)) {
            throw new IllegalArgumentException("Series dimensions cannot combine [month] and [week]");
        }
        if (yearCount < 1) {
            throw new IllegalArgumentException("Year count must be positive, got: " + yearCount);
        }
        if (startYear < CalendarRules.MIN_YEAR || (long) startYear + yearCount - 1 > CalendarRules.MAX_YEAR) {
            throw new IllegalArgumentException(
                "Series years [" + startYear + ", " + ((long) startYear + yearCount - 1) + "] must lie within ["
                    + CalendarRules.MIN_YEAR + ", " + CalendarRules.MAX_YEAR + "]"
            );
        }
        if (valueWidth != Constants.Store.VALUE_WIDTH) {
            throw new IllegalArgumentException("Only " + Constants.Store.VALUE_WIDTH + "-byte values are supported, got: " + valueWidth);
        }
        if (unit == null) {
            throw new IllegalArgumentException("Unit cannot be null, use an empty string for none");
        }
        if (unit.getBytes(StandardCharsets.UTF_8).length > Constants.Store.MAX_UNIT_BYTES) {
            throw new IllegalArgumentException("Unit [" + unit + "] is longer than " + Constants.Store.MAX_UNIT_BYTES + " UTF-8 bytes");
        }
        this.dimensions = set.toArray(new DimensionName[0]);
        this.startYear = startYear;
        this.yearCount = yearCount;
        this.valueWidth = valueWidth;
        this.unit = unit;
    }

    public static SeriesMetadata of(int startYear, int yearCount, DimensionName... dimensions) {
        return new SeriesMetadata(Arrays.asList(dimensions), startYear, yearCount);
    }

    /**
     * Copy of this metadata with another unit.
     */
    public SeriesMetadata withUnit(String unit) {
        return new SeriesMetadata(dimensions(), startYear, yearCount, valueWidth, unit);
    }

    public List<DimensionName> dimensions() {
        return List.of(dimensions);
    }

    public int dimensionCount() {
        return dimensions.length;
    }

    public DimensionName dimensionAt(int index) {
        return dimensions[index];
    }

    public boolean contains(DimensionName dimension) {
        for (DimensionName d : dimensions) {
            if (d == dimension) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return the finest dimension, the one a single slot stands for
     */
    public DimensionName finest() {
        return dimensions[dimensions.length - 1];
    }

    public int startYear() {
        return startYear;
    }

    public int yearCount() {
        return yearCount;
    }

    /**
     * @return the last covered year, inclusive
     */
    public int endYear() {
        return startYear + yearCount - 1;
    }

    public int valueWidth() {
        return valueWidth;
    }

    public String unit() {
        return unit;
    }

    /**
     * Column names of the dimensions, coarse to fine.
     */
    public List<String> fieldNames() {
        List<String> names = new ArrayList<>(dimensions.length);
        for (DimensionName dimension : dimensions) {
            names.add(dimension.fieldName());
        }
        return names;
    }

    /**
     * Number of values the dimension at {@code index} takes, given the coarser values already
     * fixed in {@code values}.
     */
    int sizeAt(int index, int[] values) {
        if (index == 0) {
            return yearCount;
        }
        return dimensions[index].size(dimensions[index - 1], values[0], values[index - 1]);
    }

    /**
     * Smallest legal value of the dimension at {@code index}.
     */
    int minimumAt(int index) {
        return index == 0 ? startYear : dimensions[index].minimum();
    }

    /**
     * Checks that an address carries exactly this series' dimensions and that every value lies
     * in its calendar bound, coarse to fine.
     *
     * @param address the address to check
     * @throws AddressRangeException naming the offending dimension, value and bound
     */
    public void validate(DimensionAddress address) {
        if (address == null) {
            throw new AddressRangeException("Address cannot be null");
        }
        if (!Arrays.equals(dimensions, address.dimensionArray())) {
            throw new AddressRangeException(
                "Address " + address + " has dimensions " + address.dimensions() + ", expected " + dimensions()
            );
        }
        int[] values = address.valueArray();
        int year = values[0];
        if (year < startYear || year > endYear()) {
            throw new AddressRangeException("year " + year + " outside series range [" + startYear + ", " + endYear() + "]");
        }
        for (int i = 1; i < dimensions.length; i++) {
            DimensionName dimension = dimensions[i];
            DimensionName parent = dimensions[i - 1];
            int value = values[i];
            if (value < dimension.minimum()) {
                throw new AddressRangeException(dimension + " " + value + " is below minimum " + dimension.minimum());
            }
            if (value > dimension.maximum(parent, year, values[i - 1])) {
                throw new AddressRangeException(
                    dimension + " " + value + " exceeds " + dimension.describeBound(parent, year, values[i - 1])
                );
            }
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        SeriesMetadata other = (SeriesMetadata) obj;
        return startYear == other.startYear
            && yearCount == other.yearCount
            && valueWidth == other.valueWidth
            && unit.equals(other.unit)
            && Arrays.equals(dimensions, other.dimensions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(dimensions), startYear, yearCount, valueWidth, unit);
    }

    @Override
    public String toString() {
        return "SeriesMetadata{dimensions="
            + dimensions()
            + ", startYear="
            + startYear
            + ", yearCount="
            + yearCount
            + ", valueWidth="
            + valueWidth
            + ", unit="
            + unit
            + "}";
    }
}
