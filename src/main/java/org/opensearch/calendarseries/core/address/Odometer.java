/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.calendarseries.core.address;

import org.opensearch.calendarseries.core.calendar.DimensionName;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Enumerates the valid addresses of a series in ascending canonical order.
 *
 * <p>The odometer is a variable-radix counter: each dimension's bound is recomputed from the
 * coarser values currently fixed, so February of a leap year carries after day 29 and a 53-week
 * year carries after week 53. Incrementing past the last covered year ends the enumeration.</p>
 *
 * <p>The odometer holds no state; it can be restarted from any valid address and shared between
 * threads.</p>
 */
public final class Odometer {

    private Odometer() {
        // Utility class
    }

    /**
     * The smallest address of the series: its start year and the minimum of every other dimension.
     *
     * @param metadata the series
     * @return the first address
     */
    public static DimensionAddress first(SeriesMetadata metadata) {
        int count = metadata.dimensionCount();
        DimensionName[] dimensions = new DimensionName[count];
        int[] values = new int[count];
        for (int i = 0; i < count; i++) {
            dimensions[i] = metadata.dimensionAt(i);
            values[i] = metadata.minimumAt(i);
        }
        return new DimensionAddress(dimensions, values);
    }

    /**
     * The address following {@code address}.
     *
     * @param address a valid address of the series
     * @param metadata the series
     * @return the next address, or empty once the series range is exhausted
     * @throws org.opensearch.calendarseries.core.errors.AddressRangeException if {@code address} is not valid
     */
    public static Optional<DimensionAddress> advance(DimensionAddress address, SeriesMetadata metadata) {
        metadata.validate(address);
        return Optional.ofNullable(step(address, metadata));
    }

    /**
     * Number of addresses in the series, walking the actual size of every year and month.
     */
    public static long count(SeriesMetadata metadata) {
        long total = 0;
        int[] values = new int[metadata.dimensionCount()];
        for (int year = metadata.startYear(); year <= metadata.endYear(); year++) {
            values[0] = year;
            total += unitsUnder(0, values, metadata);
        }
        return total;
    }

    /**
     * Lazily enumerates every address of the series from {@link #first}.
     */
    public static Iterable<DimensionAddress> iterate(SeriesMetadata metadata) {
        return () -> new AddressIterator(first(metadata), metadata);
    }

    /**
     * Lazily enumerates the addresses of the series starting at {@code from}, inclusive.
     */
    public static Iterable<DimensionAddress> iterate(DimensionAddress from, SeriesMetadata metadata) {
        metadata.validate(from);
        return () -> new AddressIterator(from, metadata);
    }

    // Unchecked increment with carry; null past the last covered year
    static DimensionAddress step(DimensionAddress address, SeriesMetadata metadata) {
        int[] values = address.values();
        for (int i = values.length - 1; i > 0; i--) {
            int maximum = metadata.minimumAt(i) + metadata.sizeAt(i, values) - 1;
            if (values[i] < maximum) {
                values[i]++;
                return new DimensionAddress(address.dimensionArray(), values);
            }
            values[i] = metadata.minimumAt(i);
        }
        if (values[0] >= metadata.endYear()) {
            return null;
        }
        values[0]++;
        return new DimensionAddress(address.dimensionArray(), values);
    }

    private static long unitsUnder(int index, int[] values, SeriesMetadata metadata) {
        int child = index + 1;
        if (child == values.length) {
            return 1;
        }
        int size = metadata.sizeAt(child, values);
        if (child == values.length - 1) {
            return size;
        }
        long total = 0;
        int minimum = metadata.minimumAt(child);
        for (int value = minimum; value < minimum + size; value++) {
            values[child] = value;
            total += unitsUnder(child, values, metadata);
        }
        return total;
    }

    private static final class AddressIterator implements Iterator<DimensionAddress> {
        private final SeriesMetadata metadata;
        private DimensionAddress next;

        AddressIterator(DimensionAddress start, SeriesMetadata metadata) {
            this.metadata = metadata;
            this.next = start;
        }

        @Override
        public boolean hasNext() {
            return next != null;
        }

        @Override
        public DimensionAddress next() {
            if (next == null) {
                throw new NoSuchElementException("Series range exhausted");
            }
            DimensionAddress current = next;
            next = step(current, metadata);
            return current;
        }
    }
}
