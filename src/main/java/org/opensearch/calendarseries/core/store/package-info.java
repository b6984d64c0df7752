/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

/**
 * Fixed-layout series files: the header codec, slot arithmetic and the {@link org.opensearch.calendarseries.core.store.BinaryStore} handle.
 */
package org.opensearch.calendarseries.core.store;
