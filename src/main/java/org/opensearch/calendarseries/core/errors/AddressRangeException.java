/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.calendarseries.core.errors;

/**
 * Thrown when a dimension address does not match a series' dimensions or a value lies outside
 * the calendar bound implied by the coarser values of the same address.
 */
public class AddressRangeException extends IllegalArgumentException {

    public AddressRangeException(String message) {
        super(message);
    }
}
