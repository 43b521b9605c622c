/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tsmatrix.core.index;

import org.opensearch.tsmatrix.core.exception.IncompatibleFrequencyException;
import org.opensearch.tsmatrix.core.exception.IndexOutOfRangeException;
import org.opensearch.tsmatrix.core.exception.RequiresUniformIndexException;
import org.opensearch.tsmatrix.core.exception.TimestampNotFoundException;
import org.opensearch.tsmatrix.core.time.Frequency;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Collection;
import java.util.List;

/**
 * An immutable, ordered mapping between integer offsets {@code 0..size-1} and timestamps.
 *
 * <p>Two variants exist:</p>
 * <ul>
 *   <li>{@link UniformDateTimeIndex}: a start timestamp, a size and a {@link Frequency}; offsets map to
 *       timestamps arithmetically and offsets outside the window can still be computed</li>
 *   <li>{@link IrregularDateTimeIndex}: an explicit, strictly ascending list of timestamps; lookups are
 *       binary searches</li>
 * </ul>
 *
 * <h2>Offset lookups:</h2>
 * <p>{@link #offsetOf(ZonedDateTime, boolean)} with {@code exact = true} only succeeds for timestamps that are
 * entries of the index. With {@code exact = false} it returns the offset the timestamp would occupy, which for
 * a uniform index may be negative or {@code >= size()}; this is the basis of all window alignment arithmetic.</p>
 *
 * <p>Implementations are immutable and safe to share between threads.</p>
 */
public interface DateTimeIndex {

    /**
     * Direction of a nearest-entry lookup.
     */
    enum LookupDirection {
        /** Greatest entry at or before the timestamp. */
        FLOOR,
        /** Least entry at or after the timestamp. */
        CEILING
    }

    /**
     * @return number of entries, always {@code >= 0}
     */
    int size();

    default boolean isEmpty() {
        return size() == 0;
    }

    /**
     * @param offset position in the index
     * @return the timestamp at {@code offset}
     * @throws IndexOutOfRangeException unless {@code 0 <= offset < size()}
     */
    ZonedDateTime timestampAt(int offset);

    /**
     * Locate a timestamp.
     *
     * @param timestamp the timestamp to locate
     * @param exact whether the timestamp must be an entry of this index
     * @return the offset of the timestamp; when not exact, the offset it would occupy
     * @throws TimestampNotFoundException if {@code exact} is set and the timestamp is not an entry
     */
    int offsetOf(ZonedDateTime timestamp, boolean exact);

    /**
     * Offset of the nearest entry in the given direction.
     *
     * @throws TimestampNotFoundException if no entry exists in that direction
     */
    int nearestOffset(ZonedDateTime timestamp, LookupDirection direction);

    /**
     * The offset at which the timestamp would be inserted to keep the index ordered, placed after any
     * equal entry. The result is in {@code [0, size()]}.
     */
    int insertionOffset(ZonedDateTime timestamp);

    /**
     * Positional sub-index covering offsets {@code [from, to)}.
     *
     * @throws IndexOutOfRangeException if the range is not within {@code [0, size()]} or is reversed
     */
    DateTimeIndex islice(int from, int to);

    /**
     * Sub-index of the entries between two timestamps, both inclusive.
     */
    default DateTimeIndex slice(ZonedDateTime from, ZonedDateTime to) {
        int start = nearestOffsetOrSize(from);
        int end = insertionOffset(to);
        return islice(start, Math.max(start, end));
    }

    /**
     * The same instants, expressed in another time zone.
     */
    DateTimeIndex atZone(ZoneId zone);

    /**
     * @return all timestamps of this index, in order
     */
    List<ZonedDateTime> toTimestamps();

    /**
     * @return whether this index has a single uniform {@link Frequency}
     */
    boolean isUniform();

    default ZonedDateTime first() {
        if (isEmpty()) {
            throw new IndexOutOfRangeException("first() called on an empty index");
        }
        return timestampAt(0);
    }

    default ZonedDateTime last() {
        if (isEmpty()) {
            throw new IndexOutOfRangeException("last() called on an empty index");
        }
        return timestampAt(size() - 1);
    }

    private int nearestOffsetOrSize(ZonedDateTime from) {
        if (isEmpty() || last().isBefore(from)) {
            return size();
        }
        return nearestOffset(from, LookupDirection.CEILING);
    }

    /**
     * Create a uniform index.
     */
    static UniformDateTimeIndex uniform(ZonedDateTime start, int size, Frequency frequency) {
        return new UniformDateTimeIndex(start, size, frequency);
    }

    /**
     * Create an irregular index from strictly ascending timestamps.
     */
    static IrregularDateTimeIndex irregular(List<ZonedDateTime> timestamps) {
        return new IrregularDateTimeIndex(timestamps);
    }

    /**
     * @return the index as a {@link UniformDateTimeIndex}
     * @throws RequiresUniformIndexException if the index is irregular
     */
    static UniformDateTimeIndex requireUniform(DateTimeIndex index) {
        if (index instanceof UniformDateTimeIndex uniform) {
            return uniform;
        }
        throw new RequiresUniformIndexException("operation requires a uniform index, got [{}]", index.getClass().getSimpleName());
    }

    /**
     * The single frequency shared by all the given indexes.
     *
     * @throws IncompatibleFrequencyException if any index is irregular or the frequencies differ
     * @throws IllegalArgumentException if no index is given
     */
    static Frequency commonFrequency(Collection<? extends DateTimeIndex> indexes) {
        if (indexes.isEmpty()) {
            throw new IllegalArgumentException("At least one index is required");
        }
        Frequency frequency = null;
        for (DateTimeIndex index : indexes) {
            if (!(index instanceof UniformDateTimeIndex uniform)) {
                throw new IncompatibleFrequencyException("irregular index has no frequency");
            }
            if (frequency == null) {
                frequency = uniform.frequency();
            } else if (!frequency.equals(uniform.frequency())) {
                throw new IncompatibleFrequencyException(
                    "indexes must share one frequency, got [{}] and [{}]",
                    frequency.getStringRep(),
                    uniform.frequency().getStringRep()
                );
            }
        }
        return frequency;
    }
}
