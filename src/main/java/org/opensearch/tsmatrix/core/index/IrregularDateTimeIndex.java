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

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.chrono.ChronoZonedDateTime;
import java.util.Arrays;
import java.util.List;

/**
 * A {@link DateTimeIndex} backed by an explicit, strictly ascending list of timestamps.
 *
 * <p>Timestamps are ordered and compared on the instant time line, so entries in different zones compare
 * correctly. Lookups are binary searches. An irregular index has no frequency, so any operation that needs
 * one fails with {@link org.opensearch.tsmatrix.core.exception.IncompatibleFrequencyException} or
 * {@link org.opensearch.tsmatrix.core.exception.RequiresUniformIndexException}.</p>
 */
public final class IrregularDateTimeIndex implements DateTimeIndex {

    private final ZonedDateTime[] timestamps;

    /**
     * @param timestamps strictly ascending timestamps
     * @throws IllegalArgumentException if the timestamps are not strictly ascending
     */
    public IrregularDateTimeIndex(List<ZonedDateTime> timestamps) {
        this(timestamps.toArray(new ZonedDateTime[0]), true);
    }

    private IrregularDateTimeIndex(ZonedDateTime[] timestamps, boolean validate) {
        if (validate) {
            for (int i = 0; i < timestamps.length; i++) {
                if (timestamps[i] == null) {
                    throw new IllegalArgumentException("Timestamp at position " + i + " is null");
                }
                if (i > 0 && !timestamps[i].isAfter(timestamps[i - 1])) {
                    throw new IllegalArgumentException(
                        "Timestamps must be strictly ascending, got " + timestamps[i - 1] + " followed by " + timestamps[i]
                    );
                }
            }
        }
        this.timestamps = timestamps;
    }

    @Override
    public int size() {
        return timestamps.length;
    }

    @Override
    public ZonedDateTime timestampAt(int offset) {
        if (offset < 0 || offset >= timestamps.length) {
            throw new IndexOutOfRangeException("offset [{}] is out of range for index of size [{}]", offset, timestamps.length);
        }
        return timestamps[offset];
    }

    @Override
    public int offsetOf(ZonedDateTime timestamp, boolean exact) {
        int found = search(timestamp);
        if (found >= 0) {
            return found;
        }
        if (exact) {
            throw new TimestampNotFoundException("timestamp [{}] is not an entry of the irregular index", timestamp);
        }
        return -(found + 1);
    }

    @Override
    public int nearestOffset(ZonedDateTime timestamp, LookupDirection direction) {
        int found = search(timestamp);
        if (found >= 0) {
            return found;
        }
        int insertion = -(found + 1);
        int candidate = direction == LookupDirection.FLOOR ? insertion - 1 : insertion;
        if (candidate < 0 || candidate >= timestamps.length) {
            throw new TimestampNotFoundException(
                "no entry {} timestamp [{}] in the irregular index",
                UniformDateTimeIndex.describe(direction),
                timestamp
            );
        }
        return candidate;
    }

    @Override
    public int insertionOffset(ZonedDateTime timestamp) {
        int found = search(timestamp);
        return found >= 0 ? found + 1 : -(found + 1);
    }

    @Override
    public IrregularDateTimeIndex islice(int from, int to) {
        if (from < 0 || to > timestamps.length || from > to) {
            throw new IndexOutOfRangeException("slice [{}, {}) is out of range for index of size [{}]", from, to, timestamps.length);
        }
        return new IrregularDateTimeIndex(Arrays.copyOfRange(timestamps, from, to), false);
    }

    @Override
    public IrregularDateTimeIndex atZone(ZoneId zone) {
        ZonedDateTime[] converted = new ZonedDateTime[timestamps.length];
        for (int i = 0; i < timestamps.length; i++) {
            converted[i] = timestamps[i].withZoneSameInstant(zone);
        }
        return new IrregularDateTimeIndex(converted, false);
    }

    @Override
    public List<ZonedDateTime> toTimestamps() {
        return List.of(timestamps);
    }

    @Override
    public boolean isUniform() {
        return false;
    }

    private int search(ZonedDateTime timestamp) {
        return Arrays.binarySearch(timestamps, timestamp, ChronoZonedDateTime.timeLineOrder());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(timestamps, ((IrregularDateTimeIndex) o).timestamps);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(timestamps);
    }

    @Override
    public String toString() {
        if (timestamps.length == 0) {
            return "IrregularDateTimeIndex{size=0}";
        }
        return "IrregularDateTimeIndex{"
            + "size="
            + timestamps.length
            + ", first="
            + timestamps[0]
            + ", last="
            + timestamps[timestamps.length - 1]
            + '}';
    }
}
