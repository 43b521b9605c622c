/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tsmatrix.core.exception;

/**
 * Raised when an exact timestamp lookup finds no matching entry in an index.
 */
public class TimestampNotFoundException extends TimeSeriesMatrixException {

    public TimestampNotFoundException(String msg, Object... args) {
        super(msg, args);
    }
}
