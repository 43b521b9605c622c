/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tsmatrix.core.time;

import org.opensearch.common.unit.TimeValue;
import org.opensearch.test.OpenSearchTestCase;
import org.opensearch.tsmatrix.core.exception.IndexOutOfRangeException;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZonedDateTime;

public class FrequenciesTests extends OpenSearchTestCase {

    private static final ZoneId UTC = ZoneId.of("UTC");
    private static final ZoneId NEW_YORK = ZoneId.of("America/New_York");

    // ========== Parsing ==========

    public void testParseCalendarFrequencies() {
        assertEquals(CalendarFrequency.days(1), Frequencies.parse("1d"));
        assertEquals(CalendarFrequency.weeks(2), Frequencies.parse("2w"));
        assertEquals(CalendarFrequency.months(3), Frequencies.parse("3mo"));
        assertEquals(CalendarFrequency.years(1), Frequencies.parse("1y"));
        assertEquals(new BusinessDayFrequency(1), Frequencies.parse("1bd"));
        assertEquals(CalendarFrequency.days(5), Frequencies.parse(" 5D "));
    }

    public void testParseDurationFrequencies() {
        assertEquals(DurationFrequency.ofMinutes(15), Frequencies.parse("15m"));
        assertEquals(DurationFrequency.ofHours(1), Frequencies.parse("1h"));
        assertEquals(DurationFrequency.ofMillis(500), Frequencies.parse("500ms"));
        assertEquals(DurationFrequency.of(TimeValue.timeValueSeconds(30)), Frequencies.parse("30s"));
    }

    public void testStringRepRoundTrips() {
        for (String rep : new String[] { "1d", "2w", "3mo", "1y", "1bd", "15m", "1h", "30s", "500ms" }) {
            Frequency frequency = Frequencies.parse(rep);
            assertEquals("Failed for " + rep, frequency, Frequencies.parse(frequency.getStringRep()));
        }
        assertEquals("2h", DurationFrequency.ofMinutes(120).getStringRep());
    }

    public void testParseRejectsNonPositiveAndEmpty() {
        expectThrows(IllegalArgumentException.class, () -> Frequencies.parse("0d"));
        expectThrows(IllegalArgumentException.class, () -> Frequencies.parse("0bd"));
        expectThrows(IllegalArgumentException.class, () -> Frequencies.parse("0s"));
        expectThrows(IllegalArgumentException.class, () -> Frequencies.parse(""));
        expectThrows(IllegalArgumentException.class, () -> Frequencies.parse(null));
        expectThrows(IllegalArgumentException.class, () -> new DurationFrequency(Duration.ofSeconds(-1)));
    }

    // ========== Duration frequency ==========

    public void testDurationDifferenceFloors() {
        DurationFrequency hourly = DurationFrequency.ofHours(1);
        ZonedDateTime start = ZonedDateTime.of(2015, 4, 9, 10, 0, 0, 0, UTC);

        assertEquals(0, hourly.difference(start, start));
        assertEquals(2, hourly.difference(start, start.plusMinutes(150)));
        assertEquals(-1, hourly.difference(start, start.minusMinutes(1)));
        assertEquals(-2, hourly.difference(start, start.minusMinutes(61)));
        assertEquals(start.plusHours(5), hourly.advance(start, 5));
        assertEquals(start.minusHours(3), hourly.advance(start, -3));
    }

    public void testDurationDifferenceOverCenturies() {
        ZonedDateTime start = ZonedDateTime.of(2015, 1, 1, 0, 0, 0, 0, UTC);
        ZonedDateTime distant = start.minusYears(300).plusMinutes(1);

        // floored towards the earlier grid point
        long days = DurationFrequency.ofHours(24).difference(start, distant);
        assertEquals(-java.time.temporal.ChronoUnit.DAYS.between(distant, start) - 1, days);
        assertEquals(start.plusDays(days), DurationFrequency.ofHours(24).advance(start, days));

        DurationFrequency nanos = new DurationFrequency(Duration.ofNanos(1));
        expectThrows(IndexOutOfRangeException.class, () -> nanos.difference(start, distant));
    }

    public void testDurationFrequencyUsesElapsedTimeAcrossDst() {
        // 2015-03-08 02:00 does not exist in New York
        ZonedDateTime beforeGap = ZonedDateTime.of(2015, 3, 8, 1, 0, 0, 0, NEW_YORK);
        ZonedDateTime next = DurationFrequency.ofHours(1).advance(beforeGap, 1);

        assertEquals(3, next.getHour());
        assertEquals(1, DurationFrequency.ofHours(1).difference(beforeGap, next));
    }

    // ========== Calendar frequency ==========

    public void testDailyFrequencyKeepsWallClockAcrossDst() {
        ZonedDateTime start = ZonedDateTime.of(2015, 3, 7, 9, 30, 0, 0, NEW_YORK);
        CalendarFrequency daily = CalendarFrequency.days(1);

        ZonedDateTime next = daily.advance(start, 1);
        assertEquals(9, next.getHour());
        assertEquals(8, next.getDayOfMonth());
        assertEquals(1, daily.difference(start, next));
        assertEquals(0, daily.difference(start, next.minusMinutes(1)));
    }

    public void testMonthlyFrequencyIsAnchoredOnOrigin() {
        ZonedDateTime start = ZonedDateTime.of(2015, 1, 31, 0, 0, 0, 0, UTC);
        CalendarFrequency monthly = CalendarFrequency.months(1);

        assertEquals(ZonedDateTime.of(2015, 2, 28, 0, 0, 0, 0, UTC), monthly.advance(start, 1));
        assertEquals(ZonedDateTime.of(2015, 3, 31, 0, 0, 0, 0, UTC), monthly.advance(start, 2));
        assertEquals(2, monthly.difference(start, ZonedDateTime.of(2015, 3, 31, 0, 0, 0, 0, UTC)));
        assertEquals(1, monthly.difference(start, ZonedDateTime.of(2015, 3, 30, 0, 0, 0, 0, UTC)));
        assertEquals(-1, monthly.difference(start, ZonedDateTime.of(2015, 1, 30, 0, 0, 0, 0, UTC)));
    }

    public void testCalendarFrequencyRejectsUnsupportedUnit() {
        expectThrows(IllegalArgumentException.class, () -> new CalendarFrequency(1, java.time.temporal.ChronoUnit.HOURS));
    }

    // ========== Business day frequency ==========

    public void testBusinessDaySkipsWeekend() {
        BusinessDayFrequency businessDay = new BusinessDayFrequency(1);
        ZonedDateTime friday = ZonedDateTime.of(2015, 4, 10, 16, 0, 0, 0, UTC);
        assertEquals(DayOfWeek.FRIDAY, friday.getDayOfWeek());

        ZonedDateTime monday = businessDay.advance(friday, 1);
        assertEquals(DayOfWeek.MONDAY, monday.getDayOfWeek());
        assertEquals(13, monday.getDayOfMonth());
        assertEquals(16, monday.getHour());
        assertEquals(1, businessDay.difference(friday, monday));
        assertEquals(friday, businessDay.advance(monday, -1));

        // saturday is not a grid point, it lies between friday and monday
        assertEquals(0, businessDay.difference(friday, friday.plusDays(1)));
    }

    public void testBusinessDayMultiWeekSpan() {
        BusinessDayFrequency businessDay = new BusinessDayFrequency(1);
        ZonedDateTime monday = ZonedDateTime.of(2015, 4, 6, 0, 0, 0, 0, UTC);

        assertEquals(monday.plusWeeks(2), businessDay.advance(monday, 10));
        assertEquals(10, businessDay.difference(monday, monday.plusWeeks(2)));
        assertEquals(-5, businessDay.difference(monday, monday.minusWeeks(1)));
    }

    public void testDifferenceInvertsAdvance() {
        ZonedDateTime start = ZonedDateTime.of(2015, 4, 6, 12, 0, 0, 0, NEW_YORK);
        Frequency[] frequencies = {
            DurationFrequency.ofMinutes(15),
            CalendarFrequency.days(1),
            CalendarFrequency.weeks(1),
            CalendarFrequency.months(1),
            new BusinessDayFrequency(2) };
        for (Frequency frequency : frequencies) {
            for (int i = 0; i < 20; i++) {
                int steps = randomIntBetween(-500, 500);
                ZonedDateTime point = frequency.advance(start, steps);
                assertEquals("Failed for " + frequency + " and " + steps, steps, frequency.difference(start, point));
            }
        }
    }
}
