/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

/**
 * Telemetry counters and histograms of the calendar series store.
 */
package org.opensearch.calendarseries.metrics;
