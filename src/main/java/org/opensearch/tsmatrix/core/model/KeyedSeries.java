/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tsmatrix.core.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * One column of a matrix: its key and a copy of its values, in index order.
 *
 * @param key the column key
 * @param values the column values, {@link Double#NaN} where missing
 * @param <K> the key type
 */
public record KeyedSeries<K>(K key, double[] values) {

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        KeyedSeries<?> that = (KeyedSeries<?>) o;
        return Objects.equals(key, that.key) && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hashCode(key) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "KeyedSeries{" + "key=" + key + ", values=" + Arrays.toString(values) + '}';
    }
}
