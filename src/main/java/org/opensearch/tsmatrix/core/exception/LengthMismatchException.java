/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tsmatrix.core.exception;

/**
 * Raised when supplied data does not have the length or width implied by its index or keys.
 */
public class LengthMismatchException extends TimeSeriesMatrixException {

    public LengthMismatchException(String msg, Object... args) {
        super(msg, args);
    }
}
