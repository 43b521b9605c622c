/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tsmatrix.core.time;

import java.time.LocalDate;
import java.time.ZonedDateTime;

/**
 * A frequency of whole business days, Monday through Friday.
 *
 * <p>Business days are numbered consecutively, skipping weekends: Friday is followed by Monday. A
 * timestamp falling on a weekend counts as the following Monday, so a grid should be anchored on a
 * weekday for its origin to be a grid point. Holidays are not modelled. The local time of day of the
 * timestamp is preserved.</p>
 */
public final class BusinessDayFrequency implements Frequency {

    // 1970-01-05 was a Monday
    private static final long FIRST_MONDAY_EPOCH_DAY = 4;
    private static final int BUSINESS_DAYS_PER_WEEK = 5;
    private static final int DAYS_PER_WEEK = 7;

    private final long days;

    /**
     * @param days number of business days per step, must be positive
     */
    public BusinessDayFrequency(long days) {
        if (days <= 0) {
            throw new IllegalArgumentException("Frequency step must be positive, got: " + days);
        }
        this.days = days;
    }

    public long getDays() {
        return days;
    }

    @Override
    public ZonedDateTime advance(ZonedDateTime timestamp, long steps) {
        long ordinal = businessOrdinal(timestamp.toLocalDate()) + Math.multiplyExact(days, steps);
        LocalDate target = fromBusinessOrdinal(ordinal);
        return ZonedDateTime.of(target, timestamp.toLocalTime(), timestamp.getZone());
    }

    @Override
    public long difference(ZonedDateTime start, ZonedDateTime end) {
        long ordinalDelta = businessOrdinal(end.toLocalDate()) - businessOrdinal(start.toLocalDate());
        return StepSearch.floorSteps(this, start, end, Math.floorDiv(ordinalDelta, days));
    }

    @Override
    public String getStringRep() {
        return days + "bd";
    }

    static long businessOrdinal(LocalDate date) {
        long daysSinceMonday = date.toEpochDay() - FIRST_MONDAY_EPOCH_DAY;
        long week = Math.floorDiv(daysSinceMonday, DAYS_PER_WEEK);
        long dayOfWeek = Math.floorMod(daysSinceMonday, DAYS_PER_WEEK);
        // saturday and sunday collapse onto the next monday
        return week * BUSINESS_DAYS_PER_WEEK + Math.min(dayOfWeek, BUSINESS_DAYS_PER_WEEK);
    }

    static LocalDate fromBusinessOrdinal(long ordinal) {
        long week = Math.floorDiv(ordinal, BUSINESS_DAYS_PER_WEEK);
        long dayOfWeek = Math.floorMod(ordinal, BUSINESS_DAYS_PER_WEEK);
        return LocalDate.ofEpochDay(FIRST_MONDAY_EPOCH_DAY + week * DAYS_PER_WEEK + dayOfWeek);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return days == ((BusinessDayFrequency) o).days;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(days);
    }

    @Override
    public String toString() {
        return "BusinessDayFrequency{" + getStringRep() + '}';
    }
}
