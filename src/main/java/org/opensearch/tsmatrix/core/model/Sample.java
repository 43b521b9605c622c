/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tsmatrix.core.model;

import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Represents a single observation of a scalar series: a timestamp and its value.
 *
 * A value of {@link Double#NaN} is the missing marker, meaning there is no observation at that timestamp.
 */
public final class Sample {

    private final ZonedDateTime timestamp;
    private final double value;

    /**
     * Constructs a new Sample with the specified timestamp and value.
     *
     * @param timestamp the timestamp of the sample
     * @param value the value, or {@link Double#NaN} when missing
     */
    public Sample(ZonedDateTime timestamp, double value) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.value = value;
    }

    /**
     * Create a sample carrying the missing marker.
     */
    public static Sample missing(ZonedDateTime timestamp) {
        return new Sample(timestamp, Double.NaN);
    }

    public ZonedDateTime getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    public boolean isMissing() {
        return Double.isNaN(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Sample that = (Sample) o;
        return timestamp.equals(that.timestamp) && Double.compare(that.value, value) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, value);
    }

    @Override
    public String toString() {
        return "Sample{" + "timestamp=" + timestamp + ", value=" + value + '}';
    }
}
