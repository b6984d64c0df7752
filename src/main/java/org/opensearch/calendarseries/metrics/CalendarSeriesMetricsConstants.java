/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.calendarseries.metrics;

/**
 * Metric names, descriptions and units of the calendar series store.
 */
public final class CalendarSeriesMetricsConstants {

    private CalendarSeriesMetricsConstants() {
        // Constants class
    }

    public static final String UNIT_COUNT = "1";
    public static final String UNIT_MILLISECONDS = "ms";

    // Store
    public static final String STORES_CREATED_TOTAL = "calendar_series.store.created.total";
    public static final String STORES_CREATED_TOTAL_DESC = "Total number of series files created";

    public static final String SLOTS_READ_TOTAL = "calendar_series.store.slots_read.total";
    public static final String SLOTS_READ_TOTAL_DESC = "Total number of value slots read from series files";

    public static final String SLOTS_WRITTEN_TOTAL = "calendar_series.store.slots_written.total";
    public static final String SLOTS_WRITTEN_TOTAL_DESC = "Total number of value slots written to series files";

    // CSV
    public static final String CSV_ROWS_IMPORTED_TOTAL = "calendar_series.csv.rows_imported.total";
    public static final String CSV_ROWS_IMPORTED_TOTAL_DESC = "Total number of CSV rows written into series files";

    public static final String CSV_ROWS_EXPORTED_TOTAL = "calendar_series.csv.rows_exported.total";
    public static final String CSV_ROWS_EXPORTED_TOTAL_DESC = "Total number of CSV rows exported from series files";

    public static final String CSV_CONVERSION_LATENCY = "calendar_series.csv.conversion.latency";
    public static final String CSV_CONVERSION_LATENCY_DESC = "Latency of one CSV import or export";
}
