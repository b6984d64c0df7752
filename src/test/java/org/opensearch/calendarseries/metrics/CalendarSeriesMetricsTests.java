/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.calendarseries.metrics;

import org.opensearch.calendarseries.core.address.DimensionAddress;
import org.opensearch.calendarseries.core.address.SeriesMetadata;
import org.opensearch.calendarseries.core.store.BinaryStore;
import org.opensearch.calendarseries.core.store.OpenMode;
import org.opensearch.calendarseries.csv.CsvCodec;
import org.opensearch.telemetry.metrics.Counter;
import org.opensearch.telemetry.metrics.Histogram;
import org.opensearch.telemetry.metrics.MetricsRegistry;
import org.opensearch.telemetry.metrics.noop.NoopMetricsRegistry;
import org.opensearch.test.OpenSearchTestCase;

import java.nio.file.Path;

import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.opensearch.calendarseries.core.calendar.DimensionName.MONTH;
import static org.opensearch.calendarseries.core.calendar.DimensionName.YEAR;

public class CalendarSeriesMetricsTests extends OpenSearchTestCase {
    private MetricsRegistry registry;
    private Counter storesCreated;
    private Counter slotsRead;
    private Counter slotsWritten;
    private Counter rowsImported;
    private Counter rowsExported;
    private Histogram conversionLatency;

    @Override
    public void setUp() throws Exception {
        super.setUp();
        CalendarSeriesMetrics.cleanup();
        registry = mock(MetricsRegistry.class);
        storesCreated = stubCounter(
            CalendarSeriesMetricsConstants.STORES_CREATED_TOTAL,
            CalendarSeriesMetricsConstants.STORES_CREATED_TOTAL_DESC
        );
        slotsRead = stubCounter(CalendarSeriesMetricsConstants.SLOTS_READ_TOTAL, CalendarSeriesMetricsConstants.SLOTS_READ_TOTAL_DESC);
        slotsWritten = stubCounter(
            CalendarSeriesMetricsConstants.SLOTS_WRITTEN_TOTAL,
            CalendarSeriesMetricsConstants.SLOTS_WRITTEN_TOTAL_DESC
        );
        rowsImported = stubCounter(
            CalendarSeriesMetricsConstants.CSV_ROWS_IMPORTED_TOTAL,
            CalendarSeriesMetricsConstants.CSV_ROWS_IMPORTED_TOTAL_DESC
        );
        rowsExported = stubCounter(
            CalendarSeriesMetricsConstants.CSV_ROWS_EXPORTED_TOTAL,
            CalendarSeriesMetricsConstants.CSV_ROWS_EXPORTED_TOTAL_DESC
        );
        conversionLatency = mock(Histogram.class);
        when(
            registry.createHistogram(
                eq(CalendarSeriesMetricsConstants.CSV_CONVERSION_LATENCY),
                eq(CalendarSeriesMetricsConstants.CSV_CONVERSION_LATENCY_DESC),
                eq(CalendarSeriesMetricsConstants.UNIT_MILLISECONDS)
            )
        ).thenReturn(conversionLatency);
    }

    @Override
    public void tearDown() throws Exception {
        CalendarSeriesMetrics.cleanup();
        super.tearDown();
    }

    public void testInitialize() {
        assertFalse(CalendarSeriesMetrics.isInitialized());
        CalendarSeriesMetrics.initialize(registry);
        assertTrue(CalendarSeriesMetrics.isInitialized());
        assertSame(registry, CalendarSeriesMetrics.getRegistry());
        assertSame(storesCreated, CalendarSeriesMetrics.STORE.storesCreated);
        assertSame(conversionLatency, CalendarSeriesMetrics.CSV.conversionLatency);
    }

    public void testInitializeTwiceKeepsFirstRegistry() {
        CalendarSeriesMetrics.initialize(registry);
        CalendarSeriesMetrics.initialize(mock(MetricsRegistry.class));
        assertSame(registry, CalendarSeriesMetrics.getRegistry());
    }

    public void testNullRegistryRejected() {
        expectThrows(IllegalArgumentException.class, () -> CalendarSeriesMetrics.initialize(null));
    }

    public void testNoopRegistrySkipped() {
        CalendarSeriesMetrics.initialize(NoopMetricsRegistry.INSTANCE);
        assertFalse(CalendarSeriesMetrics.isInitialized());
    }

    public void testRecordingBeforeInitializationIsNoop() {
        Counter counter = mock(Counter.class);
        Histogram histogram = mock(Histogram.class);
        CalendarSeriesMetrics.incrementCounter(counter, 5);
        CalendarSeriesMetrics.recordHistogram(histogram, 1.0);
        verify(counter, never()).add(anyDouble());
        verify(histogram, never()).record(anyDouble());

        CalendarSeriesMetrics.initialize(registry);
        CalendarSeriesMetrics.incrementCounter(null, 5);
        CalendarSeriesMetrics.recordHistogram(null, 1.0);
    }

    public void testStoreAndCsvOperationsRecordMetrics() throws Exception {
        CalendarSeriesMetrics.initialize(registry);
        Path dir = createTempDir();
        SeriesMetadata metadata = SeriesMetadata.of(2024, 1, YEAR, MONTH);
        CsvCodec codec = new CsvCodec();

        try (BinaryStore store = BinaryStore.open(dir.resolve("a.cseries"), OpenMode.CREATE, metadata)) {
            store.write(DimensionAddress.builder().year(2024).month(3).build(), 1.0, 2.0);
            codec.binToCsv(store, dir.resolve("a.csv"), false);
        }
        try (BinaryStore store = BinaryStore.open(dir.resolve("b.cseries"), OpenMode.CREATE, metadata)) {
            codec.csvToBin(dir.resolve("a.csv"), store);
        }

        verify(storesCreated, times(2)).add(1.0);
        verify(slotsWritten).add(2.0);
        verify(slotsRead).add(12.0);
        verify(slotsWritten, times(12)).add(1.0);
        verify(rowsExported).add(12.0);
        verify(rowsImported).add(12.0);
        verify(conversionLatency, times(2)).record(anyDouble());
    }

    private Counter stubCounter(String name, String description) {
        Counter counter = mock(Counter.class);
        when(registry.createCounter(eq(name), eq(description), eq(CalendarSeriesMetricsConstants.UNIT_COUNT))).thenReturn(counter);
        return counter;
    }
}
