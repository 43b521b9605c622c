/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tsmatrix.core.time;

import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * A frequency measured in whole calendar units: days, weeks, months or years.
 *
 * <p>Steps are applied to the local date while keeping the wall clock time, so a daily grid stays at
 * the same local hour across daylight saving transitions. Grid points are always computed from the
 * origin ({@code start + n * step}), never by repeated addition, so a monthly grid anchored on the 31st
 * returns to the 31st in every month that has one.</p>
 */
public final class CalendarFrequency implements Frequency {

    private static final Set<ChronoUnit> SUPPORTED_UNITS = EnumSet.of(ChronoUnit.DAYS, ChronoUnit.WEEKS, ChronoUnit.MONTHS, ChronoUnit.YEARS);

    private final long amount;
    private final ChronoUnit unit;

    /**
     * @param amount number of units per step, must be positive
     * @param unit one of days, weeks, months or years
     */
    public CalendarFrequency(long amount, ChronoUnit unit) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Frequency step must be positive, got: " + amount);
        }
        if (!SUPPORTED_UNITS.contains(unit)) {
            throw new IllegalArgumentException("Unsupported calendar unit [" + unit + "], expected one of " + SUPPORTED_UNITS);
        }
        this.amount = amount;
        this.unit = unit;
    }

    public static CalendarFrequency days(long days) {
        return new CalendarFrequency(days, ChronoUnit.DAYS);
    }

    public static CalendarFrequency weeks(long weeks) {
        return new CalendarFrequency(weeks, ChronoUnit.WEEKS);
    }

    public static CalendarFrequency months(long months) {
        return new CalendarFrequency(months, ChronoUnit.MONTHS);
    }

    public static CalendarFrequency years(long years) {
        return new CalendarFrequency(years, ChronoUnit.YEARS);
    }

    public long getAmount() {
        return amount;
    }

    public ChronoUnit getUnit() {
        return unit;
    }

    @Override
    public ZonedDateTime advance(ZonedDateTime timestamp, long steps) {
        return timestamp.plus(Math.multiplyExact(amount, steps), unit);
    }

    @Override
    public long difference(ZonedDateTime start, ZonedDateTime end) {
        long estimate = Math.floorDiv(unit.between(start, end), amount);
        return StepSearch.floorSteps(this, start, end, estimate);
    }

    @Override
    public String getStringRep() {
        return switch (unit) {
            case DAYS -> amount + "d";
            case WEEKS -> amount + "w";
            case MONTHS -> amount + "mo";
            case YEARS -> amount + "y";
            default -> throw new IllegalStateException("Unexpected unit " + unit);
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CalendarFrequency that = (CalendarFrequency) o;
        return amount == that.amount && unit == that.unit;
    }

    @Override
    public int hashCode() {
        return Objects.hash(amount, unit);
    }

    @Override
    public String toString() {
        return "CalendarFrequency{" + getStringRep() + '}';
    }
}
