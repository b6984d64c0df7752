/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.calendarseries.metrics;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.telemetry.metrics.Counter;
import org.opensearch.telemetry.metrics.Histogram;
import org.opensearch.telemetry.metrics.MetricsRegistry;

/** Calendar series metrics: counters and histograms initialized once via telemetry. */
public class CalendarSeriesMetrics {
    private static final Logger logger = LogManager.getLogger(CalendarSeriesMetrics.class);
    private static volatile MetricsRegistry registry;

    public static final StoreMetrics STORE = new StoreMetrics();
    public static final CsvMetrics CSV = new CsvMetrics();

    private CalendarSeriesMetrics() {}

    /**
     * Initialize all calendar series metrics. Safe to call once; subsequent calls are ignored.
     */
    public static synchronized void initialize(MetricsRegistry metricsRegistry) {
        if (metricsRegistry == null) {
            throw new IllegalArgumentException("MetricsRegistry cannot be null");
        }
        if (isNoopRegistry(metricsRegistry)) {
            logger.warn("Noop MetricsRegistry provided; skipping calendar series metrics initialization");
            return;
        }
        if (registry != null) {
            logger.warn("CalendarSeriesMetrics already initialized, skipping re-initialization");
            return;
        }

        STORE.initialize(metricsRegistry);
        CSV.initialize(metricsRegistry);

        // Only set registry after successful initialization
        registry = metricsRegistry;
    }

    public static boolean isInitialized() {
        return registry != null;
    }

    public static MetricsRegistry getRegistry() {
        return registry;
    }

    /**
     * Increment a counter by a specific amount; a no-op until metrics are initialized.
     */
    public static void incrementCounter(Counter counter, long value) {
        if (isInitialized() && counter != null) {
            counter.add(value);
        }
    }

    /**
     * Record a histogram value; a no-op until metrics are initialized.
     */
    public static void recordHistogram(Histogram histogram, double value) {
        if (isInitialized() && histogram != null) {
            histogram.record(value);
        }
    }

    private static boolean isNoopRegistry(MetricsRegistry r) {
        String name = r.getClass().getName();
        if (name.toLowerCase(java.util.Locale.ROOT).contains("noop")) {
            return true;
        }
        String desc = r.toString();
        return desc != null && desc.toLowerCase(java.util.Locale.ROOT).contains("noop");
    }

    /** Cleanup all metrics (for tests). */
    public static synchronized void cleanup() {
        registry = null;
        STORE.cleanup();
        CSV.cleanup();
        logger.info("Calendar series metrics cleanup completed");
    }
}
