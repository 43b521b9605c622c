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
import org.opensearch.tsmatrix.core.exception.LengthMismatchException;
import org.opensearch.tsmatrix.core.exception.MisalignedSampleException;
import org.opensearch.tsmatrix.core.index.DateTimeIndex;
import org.opensearch.tsmatrix.core.index.UniformDateTimeIndex;
import org.opensearch.tsmatrix.core.model.Sample;
import org.opensearch.tsmatrix.core.time.Frequency;
import org.opensearch.tsmatrix.settings.MatrixConfig;

import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Converts a time-ordered stream of samples that may have gaps into a stream with one sample per grid point
 * of a uniform frequency, placing {@link Double#NaN} wherever the input has no sample.
 *
 * <h2>Stream Semantics:</h2>
 * <ul>
 *   <li>The grid starts at the timestamp of the first input sample</li>
 *   <li>A grid point equal to the next pending input sample emits that sample's value and consumes it</li>
 *   <li>A grid point before the next pending input sample emits the missing marker</li>
 *   <li>The stream ends with the last input sample; no trailing missing values are produced</li>
 * </ul>
 *
 * <h2>Alignment:</h2>
 * <p>Input samples must be strictly ascending and lie on the grid. With
 * {@link MatrixConfig#validateAlignment()} set (the default) a violating sample raises
 * {@link MisalignedSampleException}; otherwise it is skipped.</p>
 *
 * <h2>Example Usage:</h2>
 * <pre>{@code
 * UniformResampler resampler = new UniformResampler();
 * // samples at 10:00, 10:00 + 3h
 * UniformSeries series = resampler.samplesToTimeSeries(samples.iterator(), DurationFrequency.ofHours(1));
 * // series.values() -> [v0, NaN, NaN, v3]
 * }</pre>
 *
 * <p>Iterators returned by this class are lazy, consume their input at most once and are not thread-safe.</p>
 */
public class UniformResampler {

    private static final Logger logger = LogManager.getLogger(UniformResampler.class);

    private static final int INITIAL_CAPACITY = 100;

    private final boolean validateAlignment;

    /**
     * Create a resampler using {@link MatrixConfig#defaultConfig()}.
     */
    public UniformResampler() {
        this(MatrixConfig.defaultConfig());
    }

    public UniformResampler(MatrixConfig config) {
        this.validateAlignment = config.validateAlignment();
    }

    /**
     * Lazily resample the input onto a uniform grid.
     *
     * @param samples ascending samples lying on the frequency grid
     * @param frequency the grid frequency
     * @return an iterator with one sample per grid point, from the first input sample to the last
     */
    public Iterator<Sample> iterateWithUniformFrequency(Iterator<Sample> samples, Frequency frequency) {
        return new UniformIterator(Objects.requireNonNull(samples), Objects.requireNonNull(frequency), validateAlignment);
    }

    /**
     * Resample the input into a dense vector, discovering the index from the data.
     *
     * @param samples ascending samples lying on the frequency grid
     * @param frequency the grid frequency
     * @return the index starting at the first sample together with the dense values
     * @throws LengthMismatchException if there are no samples
     */
    public UniformSeries samplesToTimeSeries(Iterator<Sample> samples, Frequency frequency) {
        Iterator<Sample> uniform = iterateWithUniformFrequency(samples, frequency);
        if (!uniform.hasNext()) {
            throw new LengthMismatchException("cannot build a series from an empty sample stream");
        }
        Sample first = uniform.next();
        double[] values = new double[INITIAL_CAPACITY];
        values[0] = first.getValue();
        int size = 1;
        while (uniform.hasNext()) {
            if (size == values.length) {
                values = Arrays.copyOf(values, values.length * 2);
            }
            values[size++] = uniform.next().getValue();
        }
        logger.debug("Resampled stream starting at {} into {} points at frequency {}", first.getTimestamp(), size, frequency.getStringRep());
        UniformDateTimeIndex index = DateTimeIndex.uniform(first.getTimestamp(), size, frequency);
        return new UniformSeries(index, Arrays.copyOf(values, size));
    }

    /**
     * Resample the input into a dense vector laid out on a given index.
     *
     * <p>The resampled stream must start at the index start. Points past the end of the index are not
     * consumed.</p>
     *
     * @param samples ascending samples lying on the grid of {@code index}
     * @param index the target index
     * @return a vector of exactly {@code index.size()} values
     * @throws MisalignedSampleException if the first sample is not at the start of the index
     * @throws LengthMismatchException if the resampled stream is shorter than the index
     */
    public double[] samplesToTimeSeries(Iterator<Sample> samples, UniformDateTimeIndex index) {
        double[] values = new double[index.size()];
        if (values.length == 0) {
            return values;
        }
        Iterator<Sample> uniform = iterateWithUniformFrequency(samples, index.frequency());
        for (int i = 0; i < values.length; i++) {
            if (!uniform.hasNext()) {
                throw new LengthMismatchException("sample stream resampled to [{}] points but the index has [{}] entries", i, values.length);
            }
            Sample sample = uniform.next();
            if (i == 0 && !sample.getTimestamp().isEqual(index.start())) {
                throw new MisalignedSampleException("first sample at [{}] does not match index start [{}]", sample.getTimestamp(), index.start());
            }
            values[i] = sample.getValue();
        }
        return values;
    }

    /**
     * State machine behind {@link #iterateWithUniformFrequency(Iterator, Frequency)}. Grid points are computed
     * from the origin rather than by repeated addition so calendar frequencies do not drift.
     */
    private static final class UniformIterator implements Iterator<Sample> {
        private final Iterator<Sample> samples;
        private final Frequency frequency;
        private final boolean validateAlignment;

        private ZonedDateTime origin;
        private long gridStep;
        private Sample pending;
        private ZonedDateTime lastInputTimestamp;

        UniformIterator(Iterator<Sample> samples, Frequency frequency, boolean validateAlignment) {
            this.samples = samples;
            this.frequency = frequency;
            this.validateAlignment = validateAlignment;
        }

        @Override
        public boolean hasNext() {
            if (pending == null) {
                pending = pullNextAligned();
            }
            return pending != null;
        }

        @Override
        public Sample next() {
            if (!hasNext()) {
                throw new NoSuchElementException("resampled stream is exhausted");
            }
            ZonedDateTime gridTimestamp = frequency.advance(origin, gridStep++);
            if (gridTimestamp.isEqual(pending.getTimestamp())) {
                Sample emitted = new Sample(gridTimestamp, pending.getValue());
                pending = null;
                return emitted;
            }
            return Sample.missing(gridTimestamp);
        }

        private Sample pullNextAligned() {
            while (samples.hasNext()) {
                Sample candidate = samples.next();
                ZonedDateTime timestamp = candidate.getTimestamp();
                String violation = alignmentViolation(timestamp);
                if (violation == null) {
                    if (origin == null) {
                        origin = timestamp;
                    }
                    lastInputTimestamp = timestamp;
                    return candidate;
                }
                if (validateAlignment) {
                    throw new MisalignedSampleException("sample at [{}] {}", timestamp, violation);
                }
                logger.debug("Skipping sample at {}: {}", timestamp, violation);
            }
            return null;
        }

        private String alignmentViolation(ZonedDateTime timestamp) {
            if (origin == null) {
                // the origin must itself be a grid point, e.g. not a weekend for business days
                if (!frequency.advance(timestamp, 0).isEqual(timestamp)) {
                    return "is not a point of the [" + frequency.getStringRep() + "] grid";
                }
                return null;
            }
            if (!timestamp.isAfter(lastInputTimestamp)) {
                return "is not after the previous sample at [" + lastInputTimestamp + "]";
            }
            long steps = frequency.difference(origin, timestamp);
            if (!frequency.advance(origin, steps).isEqual(timestamp)) {
                return "does not fall on the [" + frequency.getStringRep() + "] grid starting at [" + origin + "]";
            }
            return null;
        }
    }
}
