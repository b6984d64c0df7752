/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

/**
 * Calendar coordinates of a series: the series descriptor, address validation and the odometer
 * enumerating valid addresses in ascending order.
 */
package org.opensearch.calendarseries.core.address;
