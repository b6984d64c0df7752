/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.calendarseries.csv;

import org.opensearch.calendarseries.core.utils.Constants;

import java.util.List;
import java.util.Locale;

/**
 * How the time coordinates of a row are laid out in a CSV document.
 */
public enum TimeColumns {
    /** One integer column per dimension, e.g. {@code year,month,day,value}. */
    DIMENSIONS,
    /** A single ISO-8601 {@code date} column, or {@code datetime} when hours are kept. */
    ISO_DATE;

    /**
     * Form used by a header, given its column names.
     */
    public static TimeColumns detect(List<String> header) {
        if (header.isEmpty() == false) {
            String first = header.get(0);
            if (Constants.Csv.DATE_COLUMN.equals(first) || Constants.Csv.DATETIME_COLUMN.equals(first)) {
                return ISO_DATE;
            }
        }
        return DIMENSIONS;
    }

    public static TimeColumns fromString(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Time columns cannot be null");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown time columns [" + name + "], expected dimensions or iso_date", e);
        }
    }

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
