/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tsmatrix.core.exception;

/**
 * Raised when an operation that is only defined over a uniform index receives an irregular one.
 */
public class RequiresUniformIndexException extends TimeSeriesMatrixException {

    public RequiresUniformIndexException(String msg, Object... args) {
        super(msg, args);
    }
}
