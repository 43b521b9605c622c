/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tsmatrix.core.index;

import org.opensearch.tsmatrix.core.exception.IndexOutOfRangeException;
import org.opensearch.tsmatrix.core.exception.TimestampNotFoundException;
import org.opensearch.tsmatrix.core.time.Frequency;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A {@link DateTimeIndex} whose entries are {@code start + offset * frequency} for {@code 0 <= offset < size}.
 *
 * <h2>Window Semantics:</h2>
 * <p>The index covers the half-open window {@code [start, end())} where {@link #end()} is the first grid point
 * after the last entry. Grid points outside the window are still addressable through
 * {@link #gridTimestamp(long)} and non-exact {@link #offsetOf(ZonedDateTime, boolean)}, which is what
 * aligning two windows of the same frequency relies on.</p>
 *
 * <h3>Usage Examples:</h3>
 * <pre>{@code
 * UniformDateTimeIndex hourly = DateTimeIndex.uniform(start, 24, DurationFrequency.ofHours(1));
 * int offset = hourly.offsetOf(start.plusHours(3), true);          // 3
 * int before = hourly.offsetOf(start.minusHours(2), false);        // -2
 * }</pre>
 */
public final class UniformDateTimeIndex implements DateTimeIndex {

    private final ZonedDateTime start;
    private final int size;
    private final Frequency frequency;

    /**
     * @param start timestamp of offset 0
     * @param size number of entries, must not be negative
     * @param frequency step between consecutive entries
     * @throws IllegalArgumentException if the size is negative or {@code start} is not a point of the frequency grid
     */
    public UniformDateTimeIndex(ZonedDateTime start, int size, Frequency frequency) {
        if (size < 0) {
            throw new IllegalArgumentException("Index size must not be negative, got: " + size);
        }
        this.start = Objects.requireNonNull(start, "start must not be null");
        this.frequency = Objects.requireNonNull(frequency, "frequency must not be null");
        if (!frequency.advance(start, 0).isEqual(start)) {
            throw new IllegalArgumentException("Index start " + start + " is not a point of the [" + frequency.getStringRep() + "] grid");
        }
        this.size = size;
    }

    @Override
    public int size() {
        return size;
    }

    /**
     * @return the timestamp of offset 0, defined even when the index is empty
     */
    public ZonedDateTime start() {
        return start;
    }

    /**
     * @return the first grid point after the last entry (exclusive end of the window)
     */
    public ZonedDateTime end() {
        return gridTimestamp(size);
    }

    public Frequency frequency() {
        return frequency;
    }

    @Override
    public ZonedDateTime timestampAt(int offset) {
        if (offset < 0 || offset >= size) {
            throw new IndexOutOfRangeException("offset [{}] is out of range for index of size [{}]", offset, size);
        }
        return frequency.advance(start, offset);
    }

    /**
     * Timestamp of any grid point of this index, inside the window or not.
     */
    public ZonedDateTime gridTimestamp(long offset) {
        return frequency.advance(start, offset);
    }

    /**
     * Whether the timestamp falls exactly on a grid point of this index, inside the window or not.
     */
    public boolean isOnGrid(ZonedDateTime timestamp) {
        return gridTimestamp(frequency.difference(start, timestamp)).isEqual(timestamp);
    }

    @Override
    public int offsetOf(ZonedDateTime timestamp, boolean exact) {
        long steps = frequency.difference(start, timestamp);
        if (exact && (steps < 0 || steps >= size || !gridTimestamp(steps).isEqual(timestamp))) {
            throw new TimestampNotFoundException("timestamp [{}] is not an entry of index [{}]", timestamp, this);
        }
        return toOffset(steps);
    }

    @Override
    public int nearestOffset(ZonedDateTime timestamp, LookupDirection direction) {
        long floor = frequency.difference(start, timestamp);
        long candidate = switch (direction) {
            case FLOOR -> Math.min(floor, size - 1L);
            case CEILING -> Math.max(gridTimestamp(floor).isEqual(timestamp) ? floor : floor + 1, 0L);
        };
        if (candidate < 0 || candidate >= size) {
            throw new TimestampNotFoundException("no entry {} timestamp [{}] in index [{}]", describe(direction), timestamp, this);
        }
        return (int) candidate;
    }

    @Override
    public int insertionOffset(ZonedDateTime timestamp) {
        long floor = frequency.difference(start, timestamp);
        return (int) Math.max(0L, Math.min(floor + 1, size));
    }

    @Override
    public UniformDateTimeIndex islice(int from, int to) {
        if (from < 0 || to > size || from > to) {
            throw new IndexOutOfRangeException("slice [{}, {}) is out of range for index of size [{}]", from, to, size);
        }
        return new UniformDateTimeIndex(gridTimestamp(from), to - from, frequency);
    }

    /**
     * @throws IllegalArgumentException if the converted start is off the grid, which happens for business
     *         days when the conversion moves the start onto a weekend
     */
    @Override
    public UniformDateTimeIndex atZone(ZoneId zone) {
        return new UniformDateTimeIndex(start.withZoneSameInstant(zone), size, frequency);
    }

    @Override
    public List<ZonedDateTime> toTimestamps() {
        List<ZonedDateTime> timestamps = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            timestamps.add(frequency.advance(start, i));
        }
        return timestamps;
    }

    @Override
    public boolean isUniform() {
        return true;
    }

    private static int toOffset(long steps) {
        if (steps < Integer.MIN_VALUE || steps > Integer.MAX_VALUE) {
            throw new IndexOutOfRangeException("offset [{}] does not fit in an int", steps);
        }
        return (int) steps;
    }

    static String describe(LookupDirection direction) {
        return direction == LookupDirection.FLOOR ? "at or before" : "at or after";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        UniformDateTimeIndex that = (UniformDateTimeIndex) o;
        return size == that.size && start.equals(that.start) && frequency.equals(that.frequency);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, size, frequency);
    }

    @Override
    public String toString() {
        return "UniformDateTimeIndex{" + "start=" + start + ", size=" + size + ", frequency=" + frequency.getStringRep() + '}';
    }
}
