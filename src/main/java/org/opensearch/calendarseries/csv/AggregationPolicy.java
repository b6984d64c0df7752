/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.calendarseries.csv;

import org.opensearch.calendarseries.core.address.SeriesMetadata;
import org.opensearch.calendarseries.core.calendar.DimensionName;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Chooses the dimensions kept when exporting a series to CSV. Dimensions finer than the kept
 * ones are collapsed: every exported row is the sum of the values under one bucket of the kept
 * dimensions.
 *
 * <p>The kept dimensions must be a coarse-first prefix of the series dimensions, so that each
 * bucket is a contiguous run of slots. For {@code [year, month, day, hour]} the legal targets
 * are {@code [year, month, day, hour]}, {@code [year, month, day]}, {@code [year, month]} and
 * {@code [year]}.</p>
 */
public final class AggregationPolicy {

    private enum Kind {
        NONE,
        COLLAPSE_FINEST,
        RETAIN
    }

    private static final AggregationPolicy NONE = new AggregationPolicy(Kind.NONE, Set.of());
    private static final AggregationPolicy COLLAPSE_FINEST = new AggregationPolicy(Kind.COLLAPSE_FINEST, Set.of());

    private final Kind kind;
    private final Set<DimensionName> retained;

    private AggregationPolicy(Kind kind, Set<DimensionName> retained) {
        this.kind = kind;
        this.retained = retained;
    }

    /**
     * Export every address with its exact value.
     */
    public static AggregationPolicy none() {
        return NONE;
    }

    /**
     * Collapse the finest dimension of the series, e.g. hourly values into daily totals.
     */
    public static AggregationPolicy collapseFinest() {
        return COLLAPSE_FINEST;
    }

    /**
     * Keep only the given dimensions.
     *
     * @param dimensions the reduced target dimension set
     * @return the policy
     */
    public static AggregationPolicy retain(DimensionName... dimensions) {
        if (dimensions == null || dimensions.length == 0) {
            throw new IllegalArgumentException("At least one dimension must be retained");
        }
        EnumSet<DimensionName> set = EnumSet.noneOf(DimensionName.class);
        for (DimensionName dimension : dimensions) {
            set.add(Objects.requireNonNull(dimension, "Dimension cannot be null"));
        }
        return new AggregationPolicy(Kind.RETAIN, set);
    }

    /**
     * Number of leading series dimensions kept in the exported rows.
     *
     * @param metadata the exported series
     * @return a length between 1 and the series dimension count
     * @throws IllegalArgumentException if the policy does not fit the series
     */
    public int retainedLength(SeriesMetadata metadata) {
        int count = metadata.dimensionCount();
        switch (kind) {
            case NONE:
                return count;
            case COLLAPSE_FINEST:
                if (count == 1) {
                    throw new IllegalArgumentException("Cannot collapse the only dimension of " + metadata.dimensions());
                }
                return count - 1;
            default:
                List<DimensionName> dimensions = metadata.dimensions();
                int length = retained.size();
                if (length > count || EnumSet.copyOf(dimensions.subList(0, length)).equals(retained) == false) {
                    throw new IllegalArgumentException(
                        "Retained dimensions " + retained + " must be a coarse-first prefix of " + dimensions
                    );
                }
                return length;
        }
    }

    /**
     * @return whether the policy sums values of the given series
     */
    public boolean aggregates(SeriesMetadata metadata) {
        return retainedLength(metadata) < metadata.dimensionCount();
    }

    @Override
    public String toString() {
        return kind == Kind.RETAIN ? "retain" + retained : kind.name().toLowerCase(Locale.ROOT);
    }
}
