/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.calendarseries.core.utils;

/**
 * Constants shared by the calendar series store and its CSV codec.
 */
public final class Constants {

    private Constants() {
        // Utility class
    }

    /**
     * Binary file layout constants.
     */
    public static final class Store {
        /** Codec name written in the file header. */
        public static final String CODEC_NAME = "CalendarSeries";
        public static final int VERSION_1 = 1;
        /** Adds the unit string after the value width. */
        public static final int VERSION_UNIT = 2;
        public static final int VERSION_CURRENT = VERSION_UNIT;
        /** Fixed header size in bytes; slots start right after it. */
        public static final int HEADER_LENGTH = 64;
        /** Bytes per stored value: one little-endian IEEE-754 double. */
        public static final int VALUE_WIDTH = Double.BYTES;
        /** Longest unit label, in UTF-8 bytes, that fits in the header. */
        public static final int MAX_UNIT_BYTES = 24;

        private Store() {}
    }

    /**
     * CSV document constants.
     */
    public static final class Csv {
        /** Name of the column holding the stored value. */
        public static final String VALUE_COLUMN = "value";
        /** Single time column of series without hours. */
        public static final String DATE_COLUMN = "date";
        /** Single time column of series with hours. */
        public static final String DATETIME_COLUMN = "datetime";
        public static final char SEPARATOR = ',';
        public static final String LINE_SEPARATOR = "\n";

        private Csv() {}
    }
}
