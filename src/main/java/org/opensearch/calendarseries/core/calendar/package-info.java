/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

/**
 * Calendar arithmetic for calendar-addressed series.
 *
 * Key components:
 * - Leap year, month, year and ISO week lengths
 * - Closed-form day and week counts between years
 * - Dimension names with their parent-dependent bounds
 * - ISO-8601 instants starting each address
 */
package org.opensearch.calendarseries.core.calendar;
