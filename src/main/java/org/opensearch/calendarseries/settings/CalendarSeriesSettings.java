/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.calendarseries.settings;

import org.opensearch.common.settings.Setting;

import java.util.List;

/**
 * Settings controlling the calendar series store and its CSV codec.
 */
public final class CalendarSeriesSettings {

    /**
     * Whether closing a writable store forces its content to disk.
     */
    public static final Setting<Boolean> STORE_FSYNC_ON_CLOSE = Setting.boolSetting(
        "calendar_series.store.fsync_on_close",
        true,
        Setting.Property.NodeScope
    );

    /**
     * Number of zero slots written per chunk when a new store file is initialised.
     */
    public static final Setting<Integer> STORE_ZERO_FILL_BATCH_SLOTS = Setting.intSetting(
        "calendar_series.store.zero_fill_batch_slots",
        8192,
        1,
        Setting.Property.NodeScope
    );

    /**
     * Whether CSV import rejects rows that do not strictly follow the previous row in calendar
     * order. When disabled, rows are placed by their own address regardless of order.
     */
    public static final Setting<Boolean> CSV_ENFORCE_ROW_ORDER = Setting.boolSetting(
        "calendar_series.csv.enforce_row_order",
        false,
        Setting.Property.NodeScope
    );

    /**
     * Number of slots read from the store per batch while exporting CSV.
     */
    public static final Setting<Integer> CSV_READ_BATCH_SIZE = Setting.intSetting(
        "calendar_series.csv.read_batch_size",
        4096,
        1,
        Setting.Property.NodeScope
    );

    private CalendarSeriesSettings() {
        // Utility class
    }

    /**
     * @return every calendar series setting, for registration
     */
    public static List<Setting<?>> getSettings() {
        return List.of(STORE_FSYNC_ON_CLOSE, STORE_ZERO_FILL_BATCH_SLOTS, CSV_ENFORCE_ROW_ORDER, CSV_READ_BATCH_SIZE);
    }
}
