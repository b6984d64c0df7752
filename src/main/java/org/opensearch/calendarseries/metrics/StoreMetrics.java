/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.calendarseries.metrics;

import org.opensearch.telemetry.metrics.Counter;
import org.opensearch.telemetry.metrics.MetricsRegistry;

/** Counters describing series file activity. */
public class StoreMetrics {
    /** Series files created. */
    public Counter storesCreated;

    /** Value slots read. */
    public Counter slotsRead;

    /** Value slots written. */
    public Counter slotsWritten;

    /**
     * Create the counters.
     *
     * @param registry the registry creating the counters
     */
    public void initialize(MetricsRegistry registry) {
        storesCreated = registry.createCounter(
            CalendarSeriesMetricsConstants.STORES_CREATED_TOTAL,
            CalendarSeriesMetricsConstants.STORES_CREATED_TOTAL_DESC,
            CalendarSeriesMetricsConstants.UNIT_COUNT
        );
        slotsRead = registry.createCounter(
            CalendarSeriesMetricsConstants.SLOTS_READ_TOTAL,
            CalendarSeriesMetricsConstants.SLOTS_READ_TOTAL_DESC,
            CalendarSeriesMetricsConstants.UNIT_COUNT
        );
        slotsWritten = registry.createCounter(
            CalendarSeriesMetricsConstants.SLOTS_WRITTEN_TOTAL,
            CalendarSeriesMetricsConstants.SLOTS_WRITTEN_TOTAL_DESC,
            CalendarSeriesMetricsConstants.UNIT_COUNT
        );
    }

    /** Drop the counters; recording becomes a no-op. */
    public void cleanup() {
        storesCreated = null;
        slotsRead = null;
        slotsWritten = null;
    }
}
