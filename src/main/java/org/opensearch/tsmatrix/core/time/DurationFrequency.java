/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tsmatrix.core.time;

import org.opensearch.common.unit.TimeValue;
import org.opensearch.tsmatrix.core.exception.IndexOutOfRangeException;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.concurrent.TimeUnit;

/**
 * A frequency with a fixed elapsed length, e.g. 15 minutes or 1 hour.
 *
 * <p>Arithmetic is performed on the instant time line, so a one hour step across a daylight saving
 * transition always covers exactly 3600 seconds even if the local wall clock jumps.</p>
 */
public final class DurationFrequency implements Frequency {

    private static final TimeUnit[] REP_UNITS = {
        TimeUnit.HOURS,
        TimeUnit.MINUTES,
        TimeUnit.SECONDS,
        TimeUnit.MILLISECONDS,
        TimeUnit.MICROSECONDS };

    private final long stepNanos;

    /**
     * @param step the step length, must be positive
     * @throws IllegalArgumentException if the step is zero or negative
     */
    public DurationFrequency(Duration step) {
        if (step.isZero() || step.isNegative()) {
            throw new IllegalArgumentException("Frequency step must be positive, got: " + step);
        }
        this.stepNanos = step.toNanos();
    }

    /**
     * Create a frequency from an OpenSearch time value such as {@code TimeValue.timeValueMinutes(15)}.
     */
    public static DurationFrequency of(TimeValue timeValue) {
        return new DurationFrequency(Duration.ofNanos(timeValue.nanos()));
    }

    public static DurationFrequency ofMillis(long millis) {
        return new DurationFrequency(Duration.ofMillis(millis));
    }

    public static DurationFrequency ofSeconds(long seconds) {
        return new DurationFrequency(Duration.ofSeconds(seconds));
    }

    public static DurationFrequency ofMinutes(long minutes) {
        return new DurationFrequency(Duration.ofMinutes(minutes));
    }

    public static DurationFrequency ofHours(long hours) {
        return new DurationFrequency(Duration.ofHours(hours));
    }

    public Duration getStep() {
        return Duration.ofNanos(stepNanos);
    }

    @Override
    public ZonedDateTime advance(ZonedDateTime timestamp, long steps) {
        return timestamp.plus(Duration.ofNanos(stepNanos).multipliedBy(steps));
    }

    @Override
    public long difference(ZonedDateTime start, ZonedDateTime end) {
        // divide as Duration, the elapsed nanos overflow a long beyond ~292 years
        Duration elapsed = Duration.between(start, end);
        Duration step = Duration.ofNanos(stepNanos);
        long steps;
        try {
            steps = elapsed.dividedBy(step);
        } catch (ArithmeticException e) {
            throw new IndexOutOfRangeException("[{}] steps of [{}] from [{}] to [{}] do not fit in a long", elapsed, getStringRep(), start, end);
        }
        if (step.multipliedBy(steps).compareTo(elapsed) > 0) {
            steps--;
        }
        return steps;
    }

    @Override
    public String getStringRep() {
        // days are left to CalendarFrequency, so the coarsest unit rendered here is hours
        for (TimeUnit unit : REP_UNITS) {
            long unitNanos = unit.toNanos(1);
            if (stepNanos % unitNanos == 0) {
                return new TimeValue(stepNanos / unitNanos, unit).getStringRep();
            }
        }
        return new TimeValue(stepNanos, TimeUnit.NANOSECONDS).getStringRep();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return stepNanos == ((DurationFrequency) o).stepNanos;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(stepNanos);
    }

    @Override
    public String toString() {
        return "DurationFrequency{" + getStringRep() + '}';
    }
}
