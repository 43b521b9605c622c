/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tsmatrix.core.exception;

import org.opensearch.OpenSearchException;
import org.opensearch.core.rest.RestStatus;

/**
 * Base class of all errors raised by the index, alignment and matrix operations.
 *
 * <p>Every failure is local and synchronous and signals a violated caller contract, never a transient
 * condition, so there is no retry semantics attached. Messages use the {@code {}} placeholder format of
 * {@link OpenSearchException}.</p>
 */
public abstract class TimeSeriesMatrixException extends OpenSearchException {

    protected TimeSeriesMatrixException(String msg, Object... args) {
        super(msg, args);
    }

    @Override
    public RestStatus status() {
        return RestStatus.BAD_REQUEST;
    }
}
