/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tsmatrix.matrix;

/**
 * Per-column lag request for {@link TimeSeriesMatrix#lags(java.util.Map, java.util.function.BiFunction)}.
 *
 * @param keepOriginal whether the order 0 (unlagged) column is kept
 * @param maxLag highest lag order to generate for the column, must not be negative
 */
public record LagSpec(boolean keepOriginal, int maxLag) {

    public LagSpec {
        if (maxLag < 0) {
            throw new IllegalArgumentException("maxLag must not be negative, got: " + maxLag);
        }
    }
}
