/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

/**
 * Typed failures raised while addressing, storing and converting calendar series.
 */
package org.opensearch.calendarseries.core.errors;
