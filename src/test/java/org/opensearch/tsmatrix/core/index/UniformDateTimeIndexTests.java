/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tsmatrix.core.index;

import org.opensearch.test.OpenSearchTestCase;
import org.opensearch.tsmatrix.core.exception.IncompatibleFrequencyException;
import org.opensearch.tsmatrix.core.exception.IndexOutOfRangeException;
import org.opensearch.tsmatrix.core.exception.RequiresUniformIndexException;
import org.opensearch.tsmatrix.core.exception.TimestampNotFoundException;
import org.opensearch.tsmatrix.core.index.DateTimeIndex.LookupDirection;
import org.opensearch.tsmatrix.core.time.BusinessDayFrequency;
import org.opensearch.tsmatrix.core.time.CalendarFrequency;
import org.opensearch.tsmatrix.core.time.DurationFrequency;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;

public class UniformDateTimeIndexTests extends OpenSearchTestCase {

    private static final ZoneId UTC = ZoneId.of("UTC");
    private static final ZonedDateTime START = ZonedDateTime.of(2015, 4, 9, 10, 0, 0, 0, UTC);

    private final UniformDateTimeIndex hourly = DateTimeIndex.uniform(START, 24, DurationFrequency.ofHours(1));

    public void testOffsetAndTimestampAreInverse() {
        for (int i = 0; i < 50; i++) {
            int offset = randomIntBetween(0, hourly.size() - 1);
            ZonedDateTime timestamp = hourly.timestampAt(offset);
            assertEquals(offset, hourly.offsetOf(timestamp, true));
            assertEquals(START.plusHours(offset), timestamp);
        }
    }

    public void testNonExactOffsetsOutsideWindow() {
        assertEquals(-2, hourly.offsetOf(START.minusHours(2), false));
        assertEquals(30, hourly.offsetOf(START.plusHours(30), false));
        // floor to the previous grid point
        assertEquals(3, hourly.offsetOf(START.plusMinutes(210), false));
        assertEquals(-1, hourly.offsetOf(START.minusMinutes(1), false));
    }

    public void testExactLookupFailures() {
        expectThrows(TimestampNotFoundException.class, () -> hourly.offsetOf(START.plusMinutes(30), true));
        expectThrows(TimestampNotFoundException.class, () -> hourly.offsetOf(START.minusHours(1), true));
        expectThrows(TimestampNotFoundException.class, () -> hourly.offsetOf(hourly.end(), true));
    }

    public void testTimestampAtOutOfRange() {
        expectThrows(IndexOutOfRangeException.class, () -> hourly.timestampAt(-1));
        expectThrows(IndexOutOfRangeException.class, () -> hourly.timestampAt(24));
        expectThrows(IndexOutOfRangeException.class, () -> DateTimeIndex.uniform(START, 0, DurationFrequency.ofHours(1)).first());
    }

    public void testWindowBoundaries() {
        assertEquals(START, hourly.first());
        assertEquals(START.plusHours(23), hourly.last());
        assertEquals(START.plusHours(24), hourly.end());
        assertTrue(hourly.isOnGrid(START.minusHours(5)));
        assertFalse(hourly.isOnGrid(START.plusSeconds(1)));
    }

    public void testNearestOffset() {
        ZonedDateTime between = START.plusMinutes(90);
        assertEquals(1, hourly.nearestOffset(between, LookupDirection.FLOOR));
        assertEquals(2, hourly.nearestOffset(between, LookupDirection.CEILING));
        assertEquals(3, hourly.nearestOffset(START.plusHours(3), LookupDirection.CEILING));
        assertEquals(0, hourly.nearestOffset(START.minusHours(4), LookupDirection.CEILING));
        assertEquals(23, hourly.nearestOffset(START.plusDays(3), LookupDirection.FLOOR));
        expectThrows(TimestampNotFoundException.class, () -> hourly.nearestOffset(START.minusMinutes(1), LookupDirection.FLOOR));
        expectThrows(TimestampNotFoundException.class, () -> hourly.nearestOffset(hourly.end(), LookupDirection.CEILING));
    }

    public void testInsertionOffset() {
        assertEquals(0, hourly.insertionOffset(START.minusHours(1)));
        assertEquals(1, hourly.insertionOffset(START));
        assertEquals(2, hourly.insertionOffset(START.plusMinutes(90)));
        assertEquals(24, hourly.insertionOffset(START.plusDays(2)));
    }

    public void testIsliceAndSlice() {
        UniformDateTimeIndex sub = hourly.islice(2, 5);
        assertEquals(DateTimeIndex.uniform(START.plusHours(2), 3, DurationFrequency.ofHours(1)), sub);
        assertEquals(0, hourly.islice(4, 4).size());
        expectThrows(IndexOutOfRangeException.class, () -> hourly.islice(5, 4));
        expectThrows(IndexOutOfRangeException.class, () -> hourly.islice(-1, 4));
        expectThrows(IndexOutOfRangeException.class, () -> hourly.islice(0, 25));

        DateTimeIndex byTime = hourly.slice(START.plusMinutes(30), START.plusHours(3));
        assertEquals(List.of(START.plusHours(1), START.plusHours(2), START.plusHours(3)), byTime.toTimestamps());
        assertEquals(hourly, hourly.slice(START.minusDays(1), START.plusDays(1)));
        assertTrue(hourly.slice(START.plusDays(2), START.plusDays(3)).isEmpty());
        assertTrue(hourly.slice(START.plusHours(3), START.plusHours(1)).isEmpty());
    }

    public void testAtZoneKeepsInstants() {
        UniformDateTimeIndex tokyo = hourly.atZone(ZoneId.of("Asia/Tokyo"));
        assertEquals(hourly.size(), tokyo.size());
        assertTrue(tokyo.first().isEqual(hourly.first()));
        assertEquals(ZoneId.of("Asia/Tokyo"), tokyo.first().getZone());
        assertEquals(19, tokyo.first().getHour());
    }

    public void testCalendarIndexAnchoredOnStart() {
        ZonedDateTime monthEnd = ZonedDateTime.of(2015, 1, 31, 0, 0, 0, 0, UTC);
        UniformDateTimeIndex monthly = DateTimeIndex.uniform(monthEnd, 4, CalendarFrequency.months(1));
        assertEquals(
            List.of(monthEnd, monthEnd.withMonth(2).withDayOfMonth(28), monthEnd.withMonth(3), monthEnd.withMonth(4).withDayOfMonth(30)),
            monthly.toTimestamps()
        );
        assertEquals(2, monthly.offsetOf(monthEnd.withMonth(3), true));
    }

    public void testRequireUniformAndCommonFrequency() {
        assertSame(hourly, DateTimeIndex.requireUniform(hourly));
        IrregularDateTimeIndex irregular = DateTimeIndex.irregular(List.of(START, START.plusMinutes(7)));
        expectThrows(RequiresUniformIndexException.class, () -> DateTimeIndex.requireUniform(irregular));

        assertEquals(DurationFrequency.ofHours(1), DateTimeIndex.commonFrequency(List.of(hourly, hourly.islice(3, 7))));
        expectThrows(
            IncompatibleFrequencyException.class,
            () -> DateTimeIndex.commonFrequency(List.of(hourly, DateTimeIndex.uniform(START, 3, DurationFrequency.ofMinutes(30))))
        );
        expectThrows(IncompatibleFrequencyException.class, () -> DateTimeIndex.commonFrequency(List.of(hourly, irregular)));
        expectThrows(IllegalArgumentException.class, () -> DateTimeIndex.commonFrequency(List.of()));
    }

    public void testStartMustBeOnGrid() {
        ZonedDateTime saturday = ZonedDateTime.of(2015, 4, 11, 0, 0, 0, 0, UTC);
        expectThrows(IllegalArgumentException.class, () -> DateTimeIndex.uniform(saturday, 3, new BusinessDayFrequency(1)));

        UniformDateTimeIndex businessDays = DateTimeIndex.uniform(saturday.plusDays(2), 3, new BusinessDayFrequency(1));
        assertEquals(businessDays.start(), businessDays.timestampAt(0));
        assertEquals(businessDays, businessDays.islice(0, businessDays.size()));
        assertEquals(1, businessDays.offsetOf(saturday.plusDays(3), true));
    }

    public void testAtZoneRejectsStartMovedOffGrid() {
        // monday 01:00 UTC is sunday evening in New York
        ZonedDateTime monday = ZonedDateTime.of(2015, 4, 13, 1, 0, 0, 0, UTC);
        UniformDateTimeIndex businessDays = DateTimeIndex.uniform(monday, 5, new BusinessDayFrequency(1));
        expectThrows(IllegalArgumentException.class, () -> businessDays.atZone(ZoneId.of("America/New_York")));
    }

    public void testNonExactOffsetFarOutsideWindow() {
        ZonedDateTime newYear = ZonedDateTime.of(2015, 1, 1, 0, 0, 0, 0, UTC);
        UniformDateTimeIndex daily = DateTimeIndex.uniform(newYear, 10, DurationFrequency.ofHours(24));
        ZonedDateTime distant = newYear.minusYears(300);

        int offset = daily.offsetOf(distant, false);

        assertEquals(-ChronoUnit.DAYS.between(distant, newYear), offset);
        assertEquals(distant, daily.gridTimestamp(offset));
        assertTrue(daily.isOnGrid(distant));
    }

    public void testRejectsNegativeSize() {
        expectThrows(IllegalArgumentException.class, () -> DateTimeIndex.uniform(START, -1, DurationFrequency.ofHours(1)));
    }
}
