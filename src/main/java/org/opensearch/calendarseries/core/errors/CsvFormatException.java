/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.calendarseries.core.errors;

/**
 * Thrown when a CSV data row is malformed: wrong column count, a non-integer dimension value or a
 * non-numeric value.
 */
public class CsvFormatException extends IllegalArgumentException {

    private final long row;

    public CsvFormatException(long row, String message) {
        super("Row " + row + ": " + message);
        this.row = row;
    }

    public CsvFormatException(long row, String message, Throwable cause) {
        super("Row " + row + ": " + message, cause);
        this.row = row;
    }

    /**
     * @return the 1-based index of the offending data row, the header excluded
     */
    public long getRow() {
        return row;
    }
}
