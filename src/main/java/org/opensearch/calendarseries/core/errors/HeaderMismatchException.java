/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.calendarseries.core.errors;

import java.util.List;

/**
 * Thrown when the header line of a CSV document does not list the columns a series expects.
 */
public class HeaderMismatchException extends IllegalArgumentException {

    private final List<String> expected;
    private final List<String> actual;

    public HeaderMismatchException(List<String> expected, List<String> actual) {
        super("Unexpected CSV header " + actual + ", expected columns " + expected);
        this.expected = List.copyOf(expected);
        this.actual = List.copyOf(actual);
    }

    public HeaderMismatchException(List<String> expected, List<String> actual, Throwable cause) {
        this(expected, actual);
        initCause(cause);
    }

    public List<String> getExpected() {
        return expected;
    }

    public List<String> getActual() {
        return actual;
    }
}
