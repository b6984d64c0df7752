/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

/**
 * Utility classes for calendar series storage.
 *
 * This package contains constants used throughout the store and codec.
 */
package org.opensearch.calendarseries.core.utils;
