/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tsmatrix.matrix;

import org.opensearch.common.collect.Tuple;

import java.util.function.BiFunction;

/**
 * Key functions for lag expansion. Each maps an original column key and a lag order to the key of the
 * generated column, and is injective over distinct (key, order) pairs.
 */
public final class LagKeys {

    private LagKeys() {}

    /**
     * {@code ("a", 2) -> "lag2(a)"}; order 0 keeps the original key.
     */
    public static BiFunction<String, Integer, String> laggedStringKey() {
        return (key, lagOrder) -> lagOrder > 0 ? "lag" + lagOrder + "(" + key + ")" : key;
    }

    /**
     * {@code (k, 2) -> (k, 2)}.
     */
    public static <K> BiFunction<K, Integer, Tuple<K, Integer>> laggedPairKey() {
        return Tuple::new;
    }
}
