/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tsmatrix.core.exception;

/**
 * Raised when an operation needs indexes sharing one uniform frequency and they do not.
 */
public class IncompatibleFrequencyException extends TimeSeriesMatrixException {

    public IncompatibleFrequencyException(String msg, Object... args) {
        super(msg, args);
    }
}
