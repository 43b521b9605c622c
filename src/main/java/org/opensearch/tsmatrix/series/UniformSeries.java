/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tsmatrix.series;

import org.opensearch.tsmatrix.core.exception.LengthMismatchException;
import org.opensearch.tsmatrix.core.index.UniformDateTimeIndex;

import java.util.Arrays;
import java.util.Objects;

/**
 * A dense vector together with the uniform index it is laid out on, as produced by resampling or by a
 * multi-index union.
 *
 * @param index the index, {@code index.size() == values.length}
 * @param values the dense values, {@link Double#NaN} where missing
 */
public record UniformSeries(UniformDateTimeIndex index, double[] values) {

    public UniformSeries {
        Objects.requireNonNull(index, "index must not be null");
        Objects.requireNonNull(values, "values must not be null");
        if (index.size() != values.length) {
            throw new LengthMismatchException("series has [{}] values but its index has [{}] entries", values.length, index.size());
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        UniformSeries that = (UniformSeries) o;
        return index.equals(that.index) && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return 31 * index.hashCode() + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "UniformSeries{" + "index=" + index + ", values=" + Arrays.toString(values) + '}';
    }
}
