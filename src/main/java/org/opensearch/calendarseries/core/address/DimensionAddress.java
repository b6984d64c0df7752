/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.calendarseries.core.address;

import org.opensearch.calendarseries.core.calendar.DimensionName;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * An immutable calendar coordinate: one integer per selected dimension, kept in canonical coarse
 * to fine order.
 *
 * <p>An address is only structurally valid on construction. Whether its values respect the
 * calendar bounds of a particular series is checked by {@link #validate(SeriesMetadata)}.</p>
 */
public final class DimensionAddress implements Comparable<DimensionAddress> {

    private final DimensionName[] dimensions;
    private final int[] values;

    DimensionAddress(DimensionName[] dimensions, int[] values) {
        this.dimensions = dimensions;
        this.values = values;
    }

    /**
     * Creates an address from a dimension to value mapping. Entry order does not matter.
     *
     * @param values the value of each dimension
     * @return the address
     * @throws IllegalArgumentException if the mapping is empty
     */
    public static DimensionAddress of(Map<DimensionName, Integer> values) {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("Address must have at least one dimension");
        }
        EnumMap<DimensionName, Integer> sorted = new EnumMap<>(values);
        DimensionName[] dimensions = sorted.keySet().toArray(new DimensionName[0]);
        int[] array = new int[dimensions.length];
        for (int i = 0; i < dimensions.length; i++) {
            Integer value = sorted.get(dimensions[i]);
            if (value == null) {
                throw new IllegalArgumentException("Dimension [" + dimensions[i] + "] has no value");
            }
            array[i] = value;
        }
        return new DimensionAddress(dimensions, array);
    }

    /**
     * Creates an address from dimension names, as found in CSV headers, to values.
     */
    public static DimensionAddress fromFieldNames(Map<String, Integer> values) {
        EnumMap<DimensionName, Integer> mapped = new EnumMap<>(DimensionName.class);
        for (Map.Entry<String, Integer> entry : values.entrySet()) {
            mapped.put(DimensionName.fromString(entry.getKey()), entry.getValue());
        }
        return of(mapped);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the dimensions of this address, coarse to fine
     */
    public List<DimensionName> dimensions() {
        return Collections.unmodifiableList(Arrays.asList(dimensions));
    }

    public int size() {
        return dimensions.length;
    }

    public boolean has(DimensionName dimension) {
        return indexOf(dimension) >= 0;
    }

    /**
     * Value of the given dimension.
     *
     * @throws IllegalArgumentException if this address does not carry the dimension
     */
    public int get(DimensionName dimension) {
        int index = indexOf(dimension);
        if (index < 0) {
            throw new IllegalArgumentException("Address " + this + " has no [" + dimension + "] dimension");
        }
        return values[index];
    }

    /**
     * Value at a position in canonical order.
     */
    public int valueAt(int index) {
        return values[index];
    }

    /**
     * Copy of the values in canonical order.
     */
    public int[] values() {
        return values.clone();
    }

    /**
     * @return a copy of this address with one dimension replaced or added
     */
    public DimensionAddress with(DimensionName dimension, int value) {
        Map<DimensionName, Integer> copy = toMap();
        copy.put(dimension, value);
        return of(copy);
    }

    /**
     * Address made of the first {@code length} (coarsest) dimensions of this one.
     */
    public DimensionAddress prefix(int length) {
        if (length < 1 || length > dimensions.length) {
            throw new IllegalArgumentException("Prefix length must be between 1 and " + dimensions.length + ", got: " + length);
        }
        return new DimensionAddress(Arrays.copyOf(dimensions, length), Arrays.copyOf(values, length));
    }

    public Map<DimensionName, Integer> toMap() {
        EnumMap<DimensionName, Integer> map = new EnumMap<>(DimensionName.class);
        for (int i = 0; i < dimensions.length; i++) {
            map.put(dimensions[i], values[i]);
        }
        return map;
    }

    /**
     * Checks this address against the dimensions and calendar bounds of a series.
     *
     * @param metadata the series the address should belong to
     * @throws org.opensearch.calendarseries.core.errors.AddressRangeException if it does not
     */
    public void validate(SeriesMetadata metadata) {
        metadata.validate(this);
    }

    DimensionName[] dimensionArray() {
        return dimensions;
    }

    int[] valueArray() {
        return values;
    }

    private int indexOf(DimensionName dimension) {
        for (int i = 0; i < dimensions.length; i++) {
            if (dimensions[i] == dimension) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Orders addresses of the same dimensions by canonical calendar order.
     *
     * @throws IllegalArgumentException if the addresses use different dimensions
     */
    @Override
    public int compareTo(DimensionAddress other) {
        if (!Arrays.equals(dimensions, other.dimensions)) {
            throw new IllegalArgumentException("Cannot compare " + this + " with " + other + ": dimensions differ");
        }
        return Arrays.compare(values, other.values);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        DimensionAddress other = (DimensionAddress) obj;
        return Arrays.equals(dimensions, other.dimensions) && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(dimensions) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        List<String> parts = new ArrayList<>(dimensions.length);
        for (int i = 0; i < dimensions.length; i++) {
            parts.add(dimensions[i].fieldName() + "=" + values[i]);
        }
        return "{" + String.join(", ", parts) + "}";
    }

    /**
     * Fluent builder, mostly for tests and callers that address one instant by hand.
     */
    public static final class Builder {
        private final EnumMap<DimensionName, Integer> values = new EnumMap<>(DimensionName.class);

        private Builder() {}

        public Builder year(int year) {
            return set(DimensionName.YEAR, year);
        }

        public Builder month(int month) {
            return set(DimensionName.MONTH, month);
        }

        public Builder week(int week) {
            return set(DimensionName.WEEK, week);
        }

        public Builder day(int day) {
            return set(DimensionName.DAY, day);
        }

        public Builder hour(int hour) {
            return set(DimensionName.HOUR, hour);
        }

        public Builder set(DimensionName dimension, int value) {
            values.put(dimension, value);
            return this;
        }

        public DimensionAddress build() {
            return of(values);
        }
    }
}
