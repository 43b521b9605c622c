/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tsmatrix.core.index;

import org.opensearch.test.OpenSearchTestCase;
import org.opensearch.tsmatrix.core.exception.IndexOutOfRangeException;
import org.opensearch.tsmatrix.core.exception.TimestampNotFoundException;
import org.opensearch.tsmatrix.core.index.DateTimeIndex.LookupDirection;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;

public class IrregularDateTimeIndexTests extends OpenSearchTestCase {

    private static final ZoneId UTC = ZoneId.of("UTC");
    private static final ZonedDateTime T0 = ZonedDateTime.of(2015, 4, 9, 10, 0, 0, 0, UTC);

    private final IrregularDateTimeIndex index = DateTimeIndex.irregular(List.of(T0, T0.plusMinutes(5), T0.plusMinutes(17), T0.plusHours(2)));

    public void testExactLookup() {
        assertEquals(0, index.offsetOf(T0, true));
        assertEquals(2, index.offsetOf(T0.plusMinutes(17), true));
        assertEquals(T0.plusHours(2), index.timestampAt(3));
        expectThrows(TimestampNotFoundException.class, () -> index.offsetOf(T0.plusMinutes(6), true));
    }

    public void testNonExactLookupReturnsInsertionPoint() {
        assertEquals(0, index.offsetOf(T0.minusDays(1), false));
        assertEquals(2, index.offsetOf(T0.plusMinutes(6), false));
        assertEquals(4, index.offsetOf(T0.plusDays(1), false));
    }

    public void testLookupAcrossZones() {
        ZonedDateTime sameInstant = T0.plusMinutes(5).withZoneSameInstant(ZoneId.of("America/New_York"));
        assertEquals(1, index.offsetOf(sameInstant, true));
    }

    public void testNearestOffset() {
        ZonedDateTime between = T0.plusMinutes(10);
        assertEquals(1, index.nearestOffset(between, LookupDirection.FLOOR));
        assertEquals(2, index.nearestOffset(between, LookupDirection.CEILING));
        assertEquals(1, index.nearestOffset(T0.plusMinutes(5), LookupDirection.CEILING));
        expectThrows(TimestampNotFoundException.class, () -> index.nearestOffset(T0.minusSeconds(1), LookupDirection.FLOOR));
        expectThrows(TimestampNotFoundException.class, () -> index.nearestOffset(T0.plusDays(1), LookupDirection.CEILING));
    }

    public void testSlicing() {
        IrregularDateTimeIndex sub = index.islice(1, 3);
        assertEquals(List.of(T0.plusMinutes(5), T0.plusMinutes(17)), sub.toTimestamps());
        expectThrows(IndexOutOfRangeException.class, () -> index.islice(2, 5));

        DateTimeIndex byTime = index.slice(T0.plusMinutes(1), T0.plusHours(2));
        assertEquals(List.of(T0.plusMinutes(5), T0.plusMinutes(17), T0.plusHours(2)), byTime.toTimestamps());
        assertFalse(byTime.isUniform());
    }

    public void testRejectsUnorderedTimestamps() {
        expectThrows(IllegalArgumentException.class, () -> DateTimeIndex.irregular(List.of(T0, T0)));
        expectThrows(IllegalArgumentException.class, () -> DateTimeIndex.irregular(List.of(T0.plusMinutes(1), T0)));
    }

    public void testAtZone() {
        IrregularDateTimeIndex converted = index.atZone(ZoneId.of("Asia/Tokyo"));
        assertEquals(index.size(), converted.size());
        for (int i = 0; i < index.size(); i++) {
            assertTrue(index.timestampAt(i).isEqual(converted.timestampAt(i)));
        }
    }
}
