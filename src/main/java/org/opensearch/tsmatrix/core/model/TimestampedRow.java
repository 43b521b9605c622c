/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tsmatrix.core.model;

import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.Objects;

/**
 * One row of a matrix (an "instant"): a timestamp and the values of every column at that timestamp.
 *
 * @param timestamp the row timestamp
 * @param values one value per column, in column order
 */
public record TimestampedRow(ZonedDateTime timestamp, double[] values) {

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TimestampedRow that = (TimestampedRow) o;
        return Objects.equals(timestamp, that.timestamp) && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hashCode(timestamp) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "TimestampedRow{" + "timestamp=" + timestamp + ", values=" + Arrays.toString(values) + '}';
    }
}
