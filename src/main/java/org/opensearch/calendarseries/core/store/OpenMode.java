/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.calendarseries.core.store;

/**
 * How a {@link BinaryStore} opens its file.
 */
public enum OpenMode {
    /** Open an existing file for reading only. */
    READ(false),
    /** Create a new file, failing if it exists, and open it for reading and writing. */
    CREATE(true),
    /** Open an existing file for reading and writing. */
    READ_WRITE(true);

    private final boolean writable;

    OpenMode(boolean writable) {
        this.writable = writable;
    }

    public boolean isWritable() {
        return writable;
    }
}
