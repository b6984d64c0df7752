/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.calendarseries.core.errors;

/**
 * Thrown when metadata supplied to open a store conflicts with the metadata persisted in the
 * file header.
 */
public class SchemaMismatchException extends IllegalArgumentException {

    public SchemaMismatchException(String message) {
        super(message);
    }
}
