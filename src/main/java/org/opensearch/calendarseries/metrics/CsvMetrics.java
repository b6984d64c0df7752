/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.calendarseries.metrics;

import org.opensearch.telemetry.metrics.Counter;
import org.opensearch.telemetry.metrics.Histogram;
import org.opensearch.telemetry.metrics.MetricsRegistry;

/** Counters and latency histogram of CSV conversions. */
public class CsvMetrics {
    /** Rows read from CSV and written into a store. */
    public Counter rowsImported;

    /** Rows written to CSV. */
    public Counter rowsExported;

    /** Duration of one conversion, in milliseconds. */
    public Histogram conversionLatency;

    public void initialize(MetricsRegistry registry) {
        rowsImported = registry.createCounter(
            CalendarSeriesMetricsConstants.CSV_ROWS_IMPORTED_TOTAL,
            CalendarSeriesMetricsConstants.CSV_ROWS_IMPORTED_TOTAL_DESC,
            CalendarSeriesMetricsConstants.UNIT_COUNT
        );
        rowsExported = registry.createCounter(
            CalendarSeriesMetricsConstants.CSV_ROWS_EXPORTED_TOTAL,
            CalendarSeriesMetricsConstants.CSV_ROWS_EXPORTED_TOTAL_DESC,
            CalendarSeriesMetricsConstants.UNIT_COUNT
        );
        conversionLatency = registry.createHistogram(
            CalendarSeriesMetricsConstants.CSV_CONVERSION_LATENCY,
            CalendarSeriesMetricsConstants.CSV_CONVERSION_LATENCY_DESC,
            CalendarSeriesMetricsConstants.UNIT_MILLISECONDS
        );
    }

    public void cleanup() {
        rowsImported = null;
        rowsExported = null;
        conversionLatency = null;
    }
}
