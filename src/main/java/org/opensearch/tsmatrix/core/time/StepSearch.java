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
 * Corrects an estimated step count for calendar frequencies whose step length varies (month ends,
 * weekends, DST days), so that the result is exactly the floored difference.
 */
final class StepSearch {

    private StepSearch() {}

    static long floorSteps(Frequency frequency, ZonedDateTime start, ZonedDateTime end, long estimate) {
        long steps = estimate;
        while (frequency.advance(start, steps).isAfter(end)) {
            steps--;
        }
        while (!frequency.advance(start, steps + 1).isAfter(end)) {
            steps++;
        }
        return steps;
    }
}
