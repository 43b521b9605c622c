/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tsmatrix.series;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.common.collect.Tuple;
import org.opensearch.tsmatrix.core.exception.IncompatibleFrequencyException;
import org.opensearch.tsmatrix.core.exception.LengthMismatchException;
import org.opensearch.tsmatrix.core.exception.TimestampNotFoundException;
import org.opensearch.tsmatrix.core.index.DateTimeIndex;
import org.opensearch.tsmatrix.core.index.UniformDateTimeIndex;
import org.opensearch.tsmatrix.core.time.Frequency;

import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Window alignment and coalescing of univariate dense vectors.
 *
 * <h2>Operations:</h2>
 * <ul>
 *   <li><strong>slice:</strong> re-lay a vector from its source index onto a target window of the same frequency,
 *       padding positions outside the source with the missing marker</li>
 *   <li><strong>union:</strong> coalesce several vectors position by position, the first non-missing value wins</li>
 *   <li><strong>multi-index union:</strong> align vectors on different windows onto the window spanning all of
 *       them, then coalesce</li>
 * </ul>
 *
 * <p>All methods allocate their result and never modify their inputs.</p>
 */
public final class SeriesAlignment {

    private static final Logger logger = LogManager.getLogger(SeriesAlignment.class);

    private SeriesAlignment() {}

    /**
     * Slice a vector laid out on {@code sourceIndex} so that it conforms to {@code targetIndex}.
     *
     * <p>Output position {@code i} holds the source value at the timestamp of target position {@code i}, or
     * {@link Double#NaN} when that timestamp is outside the source window.</p>
     *
     * @param sourceIndex index of {@code vec}
     * @param targetIndex window to produce, same frequency and grid as the source
     * @param vec values on the source index
     * @return a new vector of {@code targetIndex.size()} values
     * @throws IncompatibleFrequencyException if the indexes do not share one frequency or their grids do not line up
     * @throws LengthMismatchException if {@code vec} does not match the source index size
     */
    public static double[] slice(DateTimeIndex sourceIndex, DateTimeIndex targetIndex, double[] vec) {
        if (vec.length != sourceIndex.size()) {
            throw new LengthMismatchException("vector has [{}] values but its index has [{}] entries", vec.length, sourceIndex.size());
        }
        DateTimeIndex.commonFrequency(List.of(sourceIndex, targetIndex));
        UniformDateTimeIndex source = (UniformDateTimeIndex) sourceIndex;
        UniformDateTimeIndex target = (UniformDateTimeIndex) targetIndex;

        int startLoc = gridOffset(source, target.start());
        int endLoc = gridOffset(source, target.end());
        if ((long) endLoc - startLoc != target.size()) {
            throw new IncompatibleFrequencyException("grid of index [{}] does not line up with grid of [{}]", target, source);
        }

        if (startLoc >= 0 && endLoc <= source.size()) {
            return Arrays.copyOfRange(vec, startLoc, endLoc);
        }
        double[] result = new double[target.size()];
        Arrays.fill(result, Double.NaN);
        int safeStartLoc = Math.max(startLoc, 0);
        int safeEndLoc = Math.min(endLoc, source.size());
        if (safeStartLoc < safeEndLoc) {
            // source offset safeStartLoc is target offset (safeStartLoc - startLoc)
            System.arraycopy(vec, safeStartLoc, result, safeStartLoc - startLoc, safeEndLoc - safeStartLoc);
        }
        return result;
    }

    /**
     * Coalesce vectors that share one index.
     *
     * @param series vectors of equal length, in priority order
     * @return a new vector whose position {@code i} is the first non-missing value at {@code i}, or {@link Double#NaN}
     * @throws LengthMismatchException if the vectors differ in length
     * @throws IllegalArgumentException if no vector is given
     */
    public static double[] union(List<double[]> series) {
        if (series.isEmpty()) {
            throw new IllegalArgumentException("union requires at least one series");
        }
        int length = series.get(0).length;
        for (double[] vec : series) {
            if (vec.length != length) {
                throw new LengthMismatchException("union requires series of equal length, got [{}] and [{}]", length, vec.length);
            }
        }
        double[] unioned = new double[length];
        for (int i = 0; i < length; i++) {
            double value = Double.NaN;
            for (int j = 0; j < series.size() && Double.isNaN(value); j++) {
                value = series.get(j)[i];
            }
            unioned[i] = value;
        }
        return unioned;
    }

    /**
     * Varargs form of {@link #union(List)}.
     */
    public static double[] union(double[]... series) {
        return union(Arrays.asList(series));
    }

    /**
     * Coalesce vectors laid out on different windows of one frequency.
     *
     * <p>The result window runs from the earliest start to the latest end among the given indexes. Each vector is
     * {@link #slice sliced} onto it, then the vectors are {@link #union(List) coalesced} in the given order.</p>
     *
     * @param indexes one uniform index per vector
     * @param series the vectors, in priority order
     * @return the spanning index and the coalesced values
     * @throws IncompatibleFrequencyException if any index is irregular, the frequencies differ or the grids do not line up
     * @throws LengthMismatchException if a vector does not match its index
     */
    public static UniformSeries union(List<? extends DateTimeIndex> indexes, List<double[]> series) {
        if (indexes.size() != series.size()) {
            throw new IllegalArgumentException("Expected one index per series, got " + indexes.size() + " indexes and " + series.size() + " series");
        }
        Frequency frequency = DateTimeIndex.commonFrequency(indexes);
        UniformDateTimeIndex reference = (UniformDateTimeIndex) indexes.get(0);

        long minOffset = Long.MAX_VALUE;
        long maxOffset = Long.MIN_VALUE;
        for (DateTimeIndex index : indexes) {
            if (index.isEmpty()) {
                continue;
            }
            int startOffset = gridOffset(reference, index.first());
            minOffset = Math.min(minOffset, startOffset);
            maxOffset = Math.max(maxOffset, (long) startOffset + index.size());
        }
        UniformDateTimeIndex target = minOffset == Long.MAX_VALUE
            ? DateTimeIndex.uniform(reference.start(), 0, frequency)
            : DateTimeIndex.uniform(reference.gridTimestamp(minOffset), Math.toIntExact(maxOffset - minOffset), frequency);
        logger.debug("Union of {} series spans {}", series.size(), target);

        List<double[]> aligned = new ArrayList<>(series.size());
        for (int i = 0; i < series.size(); i++) {
            aligned.add(slice(indexes.get(i), target, series.get(i)));
        }
        return new UniformSeries(target, aligned.isEmpty() ? new double[0] : union(aligned));
    }

    /**
     * Timestamps of the smallest and the largest value of a vector. Missing values are ignored; ties resolve to the
     * earliest timestamp.
     *
     * @param index index of {@code vec}
     * @param vec the values
     * @return a tuple of (timestamp of minimum, timestamp of maximum)
     * @throws TimestampNotFoundException if the vector holds no non-missing value
     */
    public static Tuple<ZonedDateTime, ZonedDateTime> minMaxTimestamps(DateTimeIndex index, double[] vec) {
        if (vec.length != index.size()) {
            throw new LengthMismatchException("vector has [{}] values but its index has [{}] entries", vec.length, index.size());
        }
        int minLoc = -1;
        int maxLoc = -1;
        for (int i = 0; i < vec.length; i++) {
            if (Double.isNaN(vec[i])) {
                continue;
            }
            if (minLoc < 0 || vec[i] < vec[minLoc]) {
                minLoc = i;
            }
            if (maxLoc < 0 || vec[i] > vec[maxLoc]) {
                maxLoc = i;
            }
        }
        if (minLoc < 0) {
            throw new TimestampNotFoundException("series of [{}] values has no non-missing value", vec.length);
        }
        return Tuple.tuple(index.timestampAt(minLoc), index.timestampAt(maxLoc));
    }

    private static int gridOffset(UniformDateTimeIndex source, ZonedDateTime timestamp) {
        int offset = source.offsetOf(timestamp, false);
        if (!source.gridTimestamp(offset).isEqual(timestamp)) {
            throw new IncompatibleFrequencyException("timestamp [{}] is not on the grid of index [{}]", timestamp, source);
        }
        return offset;
    }
}
