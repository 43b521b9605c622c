/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tsmatrix.core.time;

import java.time.ZonedDateTime;

/**
 * A fixed calendar step used to generate a uniform grid of timestamps.
 *
 * <p>Implementations must be immutable and implement value equality, since two uniform indexes are
 * only considered compatible when their frequencies are {@link Object#equals(Object) equal}.</p>
 *
 * <h2>Grid arithmetic:</h2>
 * <ul>
 *   <li>{@link #advance(ZonedDateTime, long)} moves a timestamp by any whole number of steps, forward or backward</li>
 *   <li>{@link #difference(ZonedDateTime, ZonedDateTime)} is its floored inverse: the greatest {@code n} such that
 *       {@code advance(start, n)} is not after {@code end}</li>
 * </ul>
 *
 * <p>For every grid point {@code advance(start, n)} the identity {@code difference(start, advance(start, n)) == n}
 * holds, which is what exact offset lookups in a uniform index rely on.</p>
 */
public interface Frequency {

    /**
     * Move a timestamp by the given number of steps.
     *
     * @param timestamp the timestamp to move
     * @param steps number of steps, may be zero or negative
     * @return the moved timestamp, in the zone of {@code timestamp}
     */
    ZonedDateTime advance(ZonedDateTime timestamp, long steps);

    /**
     * Number of whole steps from {@code start} to {@code end}, rounded towards negative infinity.
     *
     * @param start grid origin
     * @param end timestamp to measure
     * @return the floored step count, negative when {@code end} is before {@code start}
     */
    long difference(ZonedDateTime start, ZonedDateTime end);

    /**
     * Compact string form accepted by {@link Frequencies#parse(String)}.
     */
    String getStringRep();
}
