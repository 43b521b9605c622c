/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tsmatrix.core.exception;

/**
 * Raised when an offset, lag order or slice bound falls outside the valid range of an index or matrix.
 */
public class IndexOutOfRangeException extends TimeSeriesMatrixException {

    public IndexOutOfRangeException(String msg, Object... args) {
        super(msg, args);
    }
}
