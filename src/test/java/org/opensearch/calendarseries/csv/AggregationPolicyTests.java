/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.calendarseries.csv;

import org.opensearch.calendarseries.core.address.SeriesMetadata;
import org.opensearch.test.OpenSearchTestCase;

import static org.opensearch.calendarseries.core.calendar.DimensionName.DAY;
import static org.opensearch.calendarseries.core.calendar.DimensionName.HOUR;
import static org.opensearch.calendarseries.core.calendar.DimensionName.MONTH;
import static org.opensearch.calendarseries.core.calendar.DimensionName.WEEK;
import static org.opensearch.calendarseries.core.calendar.DimensionName.YEAR;

public class AggregationPolicyTests extends OpenSearchTestCase {

    private static final SeriesMetadata HOURLY = SeriesMetadata.of(2024, 1, YEAR, MONTH, DAY, HOUR);

    public void testNone() {
        assertEquals(4, AggregationPolicy.none().retainedLength(HOURLY));
        assertFalse(AggregationPolicy.none().aggregates(HOURLY));
    }

    public void testCollapseFinest() {
        assertEquals(3, AggregationPolicy.collapseFinest().retainedLength(HOURLY));
        assertTrue(AggregationPolicy.collapseFinest().aggregates(HOURLY));
        assertEquals(1, AggregationPolicy.collapseFinest().retainedLength(SeriesMetadata.of(2024, 1, YEAR, WEEK)));
        SeriesMetadata yearly = SeriesMetadata.of(2024, 1, YEAR);
        expectThrows(IllegalArgumentException.class, () -> AggregationPolicy.collapseFinest().retainedLength(yearly));
    }

    public void testRetainPrefix() {
        assertEquals(1, AggregationPolicy.retain(YEAR).retainedLength(HOURLY));
        assertEquals(2, AggregationPolicy.retain(MONTH, YEAR).retainedLength(HOURLY));
        assertEquals(4, AggregationPolicy.retain(YEAR, MONTH, DAY, HOUR).retainedLength(HOURLY));
        assertFalse(AggregationPolicy.retain(YEAR, MONTH, DAY, HOUR).aggregates(HOURLY));
    }

    public void testRetainRejectsNonPrefix() {
        expectThrows(IllegalArgumentException.class, () -> AggregationPolicy.retain(YEAR, DAY).retainedLength(HOURLY));
        expectThrows(IllegalArgumentException.class, () -> AggregationPolicy.retain(MONTH).retainedLength(HOURLY));
        expectThrows(IllegalArgumentException.class, () -> AggregationPolicy.retain(YEAR, WEEK).retainedLength(HOURLY));
        expectThrows(
            IllegalArgumentException.class,
            () -> AggregationPolicy.retain(YEAR, MONTH, DAY, HOUR).retainedLength(SeriesMetadata.of(2024, 1, YEAR, MONTH))
        );
        expectThrows(IllegalArgumentException.class, () -> AggregationPolicy.retain());
    }

    public void testToString() {
        assertEquals("none", AggregationPolicy.none().toString());
        assertEquals("collapse_finest", AggregationPolicy.collapseFinest().toString());
        assertEquals("retain[year, month]", AggregationPolicy.retain(MONTH, YEAR).toString());
    }
}
