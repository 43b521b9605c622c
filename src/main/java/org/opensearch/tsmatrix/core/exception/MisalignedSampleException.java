/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tsmatrix.core.exception;

/**
 * Raised when a resampled input sample is out of order or does not fall on the target frequency grid.
 */
public class MisalignedSampleException extends TimeSeriesMatrixException {

    public MisalignedSampleException(String msg, Object... args) {
        super(msg, args);
    }
}
