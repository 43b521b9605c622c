/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tsmatrix.matrix;

import org.opensearch.common.collect.Tuple;
import org.opensearch.tsmatrix.core.exception.IndexOutOfRangeException;
import org.opensearch.tsmatrix.core.exception.LengthMismatchException;
import org.opensearch.tsmatrix.core.exception.RequiresUniformIndexException;
import org.opensearch.tsmatrix.core.index.DateTimeIndex;
import org.opensearch.tsmatrix.core.index.IrregularDateTimeIndex;
import org.opensearch.tsmatrix.core.index.UniformDateTimeIndex;
import org.opensearch.tsmatrix.core.model.KeyedSeries;
import org.opensearch.tsmatrix.core.model.TimestampedRow;
import org.opensearch.tsmatrix.settings.MatrixConfig;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.chrono.ChronoZonedDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * A set of univariate series keyed by {@code K}, all laid out on one {@link DateTimeIndex}.
 *
 * <p>Values are stored in a single column-major {@code double[]} of {@code rows x columns}, where rows follow the
 * index and columns follow the keys. {@link Double#NaN} marks a missing observation and propagates through the
 * arithmetic operations.</p>
 *
 * <h2>Key Features:</h2>
 * <ul>
 *   <li><strong>Lag expansion:</strong> derive columns holding earlier values of each column</li>
 *   <li><strong>Differencing:</strong> differences, quotients and periodic returns over a lag</li>
 *   <li><strong>Slicing:</strong> positional or timestamp row ranges with the matching sub-index</li>
 *   <li><strong>Per-column transforms:</strong> map each column to a new column or to a single value</li>
 * </ul>
 *
 * <h2>Immutability:</h2>
 * <p>A matrix is never modified after construction. Every operation returns a new matrix backed by a freshly
 * allocated buffer, and accessors return copies, so matrices can be shared between threads freely.</p>
 *
 * <h3>Usage Examples:</h3>
 * <pre>{@code
 * // time  a  b
 * // 4pm   1  6
 * // ...
 * // 8pm   5  10
 * TimeSeriesMatrix<String> matrix = TimeSeriesMatrix.fromVectors(List.of(a, b), hourlyIndex, List.of("a", "b"));
 *
 * // time  a  lag1(a)  lag2(a)  b   lag1(b)  lag2(b)
 * // 6pm   3  2        1        8   7        6
 * // 7pm   4  3        2        9   8        7
 * // 8pm   5  4        3        10  9        8
 * TimeSeriesMatrix<String> lagged = matrix.lags(2, true, LagKeys.laggedStringKey());
 * }</pre>
 *
 * @param <K> the column key type; keys need not be unique
 */
public class TimeSeriesMatrix<K> {

    private final DateTimeIndex index;
    private final double[] data;
    private final List<K> keys;
    private final int rows;

    /**
     * @param index the row index
     * @param data column-major values, {@code index.size() * keys.size()} long; the array is copied
     * @param keys one key per column
     * @throws LengthMismatchException if the data length does not match the index and keys
     */
    public TimeSeriesMatrix(DateTimeIndex index, double[] data, List<K> keys) {
        this(index, data.clone(), List.copyOf(keys), true);
    }

    /**
     * Takes ownership of {@code data} without copying.
     */
    private TimeSeriesMatrix(DateTimeIndex index, double[] data, List<K> keys, boolean validate) {
        this.index = Objects.requireNonNull(index, "index must not be null");
        this.data = data;
        this.keys = keys;
        this.rows = index.size();
        if (validate && (long) rows * keys.size() != data.length) {
            throw new LengthMismatchException(
                "expected [{}] values for [{}] rows and [{}] columns, got [{}]",
                (long) rows * keys.size(),
                rows,
                keys.size(),
                data.length
            );
        }
    }

    // ========== Construction ==========

    /**
     * Build a matrix from rows observed at arbitrary timestamps.
     *
     * <p>Rows are ordered by instant and converted to {@code zone}. When several rows share one instant the row
     * that comes last in the input wins.</p>
     *
     * @param samples (timestamp, row) pairs, each row holding one value per key
     * @param keys the column keys
     * @param zone zone of the resulting index
     * @return a matrix over an {@link IrregularDateTimeIndex}
     * @throws LengthMismatchException if a row does not have exactly {@code keys.size()} values
     */
    public static <K> TimeSeriesMatrix<K> fromIrregularSamples(List<Tuple<ZonedDateTime, double[]>> samples, List<K> keys, ZoneId zone) {
        int columns = keys.size();
        for (Tuple<ZonedDateTime, double[]> sample : samples) {
            if (sample.v2().length != columns) {
                throw new LengthMismatchException("sample at [{}] has [{}] values, expected [{}]", sample.v1(), sample.v2().length, columns);
            }
        }
        List<Tuple<ZonedDateTime, double[]>> sorted = new ArrayList<>(samples);
        Comparator<ChronoZonedDateTime<?>> timeLine = ChronoZonedDateTime.timeLineOrder();
        sorted.sort((left, right) -> timeLine.compare(left.v1(), right.v1()));

        List<ZonedDateTime> timestamps = new ArrayList<>(sorted.size());
        List<double[]> distinctRows = new ArrayList<>(sorted.size());
        for (Tuple<ZonedDateTime, double[]> sample : sorted) {
            int last = timestamps.size() - 1;
            if (last >= 0 && timestamps.get(last).isEqual(sample.v1())) {
                distinctRows.set(last, sample.v2());
            } else {
                timestamps.add(sample.v1().withZoneSameInstant(zone));
                distinctRows.add(sample.v2());
            }
        }
        return new TimeSeriesMatrix<>(DateTimeIndex.irregular(timestamps), toColumnMajor(distinctRows, columns), List.copyOf(keys), false);
    }

    /**
     * Like {@link #fromIrregularSamples(List, List, ZoneId)} using the zone of {@link MatrixConfig#defaultConfig()}.
     */
    public static <K> TimeSeriesMatrix<K> fromIrregularSamples(List<Tuple<ZonedDateTime, double[]>> samples, List<K> keys) {
        return fromIrregularSamples(samples, keys, MatrixConfig.defaultConfig().defaultZone());
    }

    /**
     * Build a matrix from rows that are already one per index entry.
     *
     * @param samples one row per index entry, each holding one value per key
     * @param index the uniform index the rows are laid out on
     * @param keys the column keys
     * @throws LengthMismatchException if the row count differs from the index size or a row has the wrong width
     */
    public static <K> TimeSeriesMatrix<K> fromUniformSamples(List<double[]> samples, UniformDateTimeIndex index, List<K> keys) {
        if (samples.size() != index.size()) {
            throw new LengthMismatchException("got [{}] samples for an index of [{}] entries", samples.size(), index.size());
        }
        int columns = keys.size();
        for (int i = 0; i < samples.size(); i++) {
            if (samples.get(i).length != columns) {
                throw new LengthMismatchException("sample [{}] has [{}] values, expected [{}]", i, samples.get(i).length, columns);
            }
        }
        return new TimeSeriesMatrix<>(index, toColumnMajor(samples, columns), List.copyOf(keys), false);
    }

    /**
     * Build a matrix from column vectors.
     *
     * @param vectors one vector per key, each {@code index.size()} long
     * @param index the row index
     * @param keys the column keys
     * @throws LengthMismatchException if a vector length differs from the index size or the vector count from the key count
     */
    public static <K> TimeSeriesMatrix<K> fromVectors(Iterable<double[]> vectors, DateTimeIndex index, List<K> keys) {
        int rows = index.size();
        double[] data = new double[Math.multiplyExact(rows, keys.size())];
        int column = 0;
        for (double[] vector : vectors) {
            if (vector.length != rows) {
                throw new LengthMismatchException("vector [{}] has [{}] values but the index has [{}] entries", column, vector.length, rows);
            }
            if (column >= keys.size()) {
                throw new LengthMismatchException("got more vectors than the [{}] keys", keys.size());
            }
            System.arraycopy(vector, 0, data, column * rows, rows);
            column++;
        }
        if (column != keys.size()) {
            throw new LengthMismatchException("got [{}] vectors for [{}] keys", column, keys.size());
        }
        return new TimeSeriesMatrix<>(index, data, List.copyOf(keys), false);
    }

    private static double[] toColumnMajor(List<double[]> rowValues, int columns) {
        int rowCount = rowValues.size();
        double[] data = new double[Math.multiplyExact(rowCount, columns)];
        for (int r = 0; r < rowCount; r++) {
            double[] row = rowValues.get(r);
            for (int c = 0; c < columns; c++) {
                data[c * rowCount + r] = row[c];
            }
        }
        return data;
    }

    // ========== Accessors ==========

    public DateTimeIndex index() {
        return index;
    }

    /**
     * @return the column keys, unmodifiable
     */
    public List<K> keys() {
        return keys;
    }

    public int rowCount() {
        return rows;
    }

    public int columnCount() {
        return keys.size();
    }

    /**
     * @throws IndexOutOfRangeException if the row or column is out of range
     */
    public double get(int row, int column) {
        checkRow(row);
        checkColumn(column);
        return data[column * rows + row];
    }

    /**
     * @return a copy of the values of the column at the given position
     */
    public double[] column(int column) {
        checkColumn(column);
        return Arrays.copyOfRange(data, column * rows, (column + 1) * rows);
    }

    /**
     * @return a copy of the values of the first column with the given key
     * @throws IllegalArgumentException if no column has the key
     */
    public double[] columnByKey(K key) {
        int column = keys.indexOf(key);
        if (column < 0) {
            throw new IllegalArgumentException("No column with key [" + key + "]");
        }
        return column(column);
    }

    /**
     * @return a copy of all values in column-major order
     */
    public double[] dataAsArray() {
        return data.clone();
    }

    /**
     * @return the first column and its key
     * @throws IndexOutOfRangeException if the matrix has no columns
     */
    public KeyedSeries<K> head() {
        if (keys.isEmpty()) {
            throw new IndexOutOfRangeException("head() called on a matrix without columns");
        }
        return new KeyedSeries<>(keys.get(0), column(0));
    }

    // ========== Lag expansion ==========

    /**
     * Lag every column by each order up to {@code maxLag}.
     *
     * <p>For key {@code k} and order {@code l} the generated column holds, at output row {@code r}, the input value at
     * row {@code r + maxLag - l}. The first {@code maxLag} rows are dropped so all generated columns share one index.
     * Columns are ordered by original key, then by ascending order, order 0 first when {@code includeOriginals}
     * is set.</p>
     *
     * @param maxLag highest lag order, in {@code [0, rowCount()]}
     * @param includeOriginals whether the unlagged column is kept as order 0
     * @param laggedKey maps (key, order) to the generated key; must be injective or keys collide
     * @return the lagged matrix
     * @throws RequiresUniformIndexException if the index is irregular
     * @throws IndexOutOfRangeException if {@code maxLag} is out of range
     */
    public <U> TimeSeriesMatrix<U> lags(int maxLag, boolean includeOriginals, BiFunction<K, Integer, U> laggedKey) {
        DateTimeIndex.requireUniform(index);
        checkLag(maxLag);
        List<LagSpec> specs = Collections.nCopies(keys.size(), new LagSpec(includeOriginals, maxLag));
        return laggedMatrix(specs, maxLag, laggedKey);
    }

    /**
     * Same as {@link #lags(int, boolean, BiFunction)} with {@link LagKeys#laggedPairKey()}.
     */
    public TimeSeriesMatrix<Tuple<K, Integer>> lags(int maxLag, boolean includeOriginals) {
        return lags(maxLag, includeOriginals, LagKeys.laggedPairKey());
    }

    /**
     * Lag the columns named in {@code lagsPerColumn}, each by its own depth.
     *
     * <p>Columns whose key is not in the map are dropped. The output window shrinks by the largest depth requested
     * so every generated column lines up on one index.</p>
     *
     * @param lagsPerColumn per-key lag request
     * @param laggedKey maps (key, order) to the generated key
     * @return the lagged matrix
     * @throws IllegalArgumentException if the map names a key that is not a column, or one shared by several columns
     * @throws RequiresUniformIndexException if the index is irregular
     */
    public <U> TimeSeriesMatrix<U> lags(Map<K, LagSpec> lagsPerColumn, BiFunction<K, Integer, U> laggedKey) {
        for (K key : lagsPerColumn.keySet()) {
            int first = keys.indexOf(key);
            if (first < 0) {
                throw new IllegalArgumentException("No column with key [" + key + "] to lag");
            }
            if (first != keys.lastIndexOf(key)) {
                // lagged keys of the two columns would collide
                throw new IllegalArgumentException("Key [" + key + "] names more than one column, cannot lag it by key");
            }
        }
        int maxLag = 0;
        List<LagSpec> specs = new ArrayList<>(keys.size());
        for (K key : keys) {
            LagSpec spec = lagsPerColumn.get(key);
            specs.add(spec);
            if (spec != null) {
                maxLag = Math.max(maxLag, spec.maxLag());
            }
        }
        return laggedMatrix(specs, maxLag, laggedKey);
    }

    /**
     * Same as {@link #lags(Map, BiFunction)} with {@link LagKeys#laggedPairKey()}.
     */
    public TimeSeriesMatrix<Tuple<K, Integer>> lags(Map<K, LagSpec> lagsPerColumn) {
        return lags(lagsPerColumn, LagKeys.laggedPairKey());
    }

    /**
     * @param specs one entry per column, null drops the column
     * @param windowLag number of leading rows dropped from the output
     */
    private <U> TimeSeriesMatrix<U> laggedMatrix(List<LagSpec> specs, int windowLag, BiFunction<K, Integer, U> laggedKey) {
        UniformDateTimeIndex uniform = DateTimeIndex.requireUniform(index);
        checkLag(windowLag);
        int outRows = rows - windowLag;

        int outColumns = 0;
        for (LagSpec spec : specs) {
            if (spec != null) {
                outColumns += spec.maxLag() + (spec.keepOriginal() ? 1 : 0);
            }
        }
        double[] out = new double[Math.multiplyExact(outRows, outColumns)];
        List<U> outKeys = new ArrayList<>(outColumns);
        int outColumn = 0;
        for (int c = 0; c < specs.size(); c++) {
            LagSpec spec = specs.get(c);
            if (spec == null) {
                continue;
            }
            for (int lag = spec.keepOriginal() ? 0 : 1; lag <= spec.maxLag(); lag++) {
                System.arraycopy(data, c * rows + windowLag - lag, out, outColumn * outRows, outRows);
                outKeys.add(laggedKey.apply(keys.get(c), lag));
                outColumn++;
            }
        }
        return new TimeSeriesMatrix<>(uniform.islice(windowLag, rows), out, Collections.unmodifiableList(outKeys), false);
    }

    // ========== Differencing ==========

    /**
     * Difference every column with order 1. The first timestamp is dropped.
     */
    public TimeSeriesMatrix<K> differences() {
        return differences(1);
    }

    /**
     * Difference every column: output row {@code r} is {@code x[r + lag] - x[r]}. The first {@code lag} timestamps
     * are dropped.
     *
     * @throws IndexOutOfRangeException if {@code lag} is not in {@code [0, rowCount()]}
     */
    public TimeSeriesMatrix<K> differences(int lag) {
        return windowed(lag, (later, earlier) -> later - earlier);
    }

    /**
     * Quotient every column with order 1. The first timestamp is dropped.
     */
    public TimeSeriesMatrix<K> quotients() {
        return quotients(1);
    }

    /**
     * Quotient every column: output row {@code r} is {@code x[r + lag] / x[r]}. The first {@code lag} timestamps
     * are dropped.
     *
     * @throws IndexOutOfRangeException if {@code lag} is not in {@code [0, rowCount()]}
     */
    public TimeSeriesMatrix<K> quotients(int lag) {
        return windowed(lag, (later, earlier) -> later / earlier);
    }

    /**
     * Periodic (not continuously compounded) returns of every column: {@code x[r + 1] / x[r] - 1}.
     */
    public TimeSeriesMatrix<K> price2ret() {
        return windowed(1, (later, earlier) -> later / earlier - 1);
    }

    private interface PairOperator {
        double apply(double later, double earlier);
    }

    private TimeSeriesMatrix<K> windowed(int lag, PairOperator operator) {
        checkLag(lag);
        int outRows = rows - lag;
        int columns = keys.size();
        double[] out = new double[outRows * columns];
        for (int c = 0; c < columns; c++) {
            int base = c * rows;
            int outBase = c * outRows;
            for (int r = 0; r < outRows; r++) {
                out[outBase + r] = operator.apply(data[base + r + lag], data[base + r]);
            }
        }
        return new TimeSeriesMatrix<>(index.islice(lag, rows), out, keys, false);
    }

    // ========== Slicing ==========

    /**
     * Rows {@code [start, end)} with the matching sub-index.
     *
     * @throws IndexOutOfRangeException if the range is not within {@code [0, rowCount()]} or is reversed
     */
    public TimeSeriesMatrix<K> slice(int start, int end) {
        if (start < 0 || end > rows || start > end) {
            throw new IndexOutOfRangeException("slice [{}, {}) is out of range for [{}] rows", start, end, rows);
        }
        return sliceRows(index.islice(start, end), start);
    }

    /**
     * Rows whose timestamps lie between {@code from} and {@code to}, both inclusive.
     */
    public TimeSeriesMatrix<K> slice(ZonedDateTime from, ZonedDateTime to) {
        DateTimeIndex sliced = index.slice(from, to);
        int start = sliced.isEmpty() ? 0 : index.offsetOf(sliced.first(), true);
        return sliceRows(sliced, start);
    }

    private TimeSeriesMatrix<K> sliceRows(DateTimeIndex sliced, int start) {
        int outRows = sliced.size();
        int columns = keys.size();
        double[] out = new double[outRows * columns];
        for (int c = 0; c < columns; c++) {
            System.arraycopy(data, c * rows + start, out, c * outRows, outRows);
        }
        return new TimeSeriesMatrix<>(sliced, out, keys, false);
    }

    // ========== Per-column transforms ==========

    /**
     * Apply a transformation to each column that preserves the index.
     *
     * @param f receives a copy of the column values and returns the new values, same length
     */
    public TimeSeriesMatrix<K> mapSeries(UnaryOperator<double[]> f) {
        return mapSeries(f, index);
    }

    /**
     * Apply a transformation to each column whose results are laid out on {@code newIndex}.
     *
     * @throws LengthMismatchException if a transformed column does not have {@code newIndex.size()} values
     */
    public TimeSeriesMatrix<K> mapSeries(UnaryOperator<double[]> f, DateTimeIndex newIndex) {
        return mapColumns((key, values) -> f.apply(values), newIndex);
    }

    /**
     * Apply a transformation to each column that preserves the index, passing the column key along.
     */
    public TimeSeriesMatrix<K> mapSeriesWithKey(BiFunction<K, double[], double[]> f) {
        return mapColumns(f, index);
    }

    private TimeSeriesMatrix<K> mapColumns(BiFunction<K, double[], double[]> f, DateTimeIndex newIndex) {
        int outRows = newIndex.size();
        int columns = keys.size();
        double[] out = new double[Math.multiplyExact(outRows, columns)];
        for (int c = 0; c < columns; c++) {
            double[] mapped = f.apply(keys.get(c), column(c));
            if (mapped.length != outRows) {
                throw new LengthMismatchException("column [{}] mapped to [{}] values, expected [{}]", keys.get(c), mapped.length, outRows);
            }
            System.arraycopy(mapped, 0, out, c * outRows, outRows);
        }
        return new TimeSeriesMatrix<>(newIndex, out, keys, false);
    }

    /**
     * Reduce each column to a single value.
     *
     * @return one (key, value) pair per column, in column order
     */
    public <U> List<Tuple<K, U>> mapValues(Function<double[], U> f) {
        List<Tuple<K, U>> values = new ArrayList<>(keys.size());
        for (int c = 0; c < keys.size(); c++) {
            values.add(Tuple.tuple(keys.get(c), f.apply(column(c))));
        }
        return values;
    }

    /**
     * Add one column at the end.
     *
     * @throws LengthMismatchException if {@code values} does not have {@code rowCount()} entries
     */
    public TimeSeriesMatrix<K> appendColumn(K key, double[] values) {
        if (values.length != rows) {
            throw new LengthMismatchException("column has [{}] values but the index has [{}] entries", values.length, rows);
        }
        double[] out = Arrays.copyOf(data, data.length + rows);
        System.arraycopy(values, 0, out, data.length, rows);
        List<K> outKeys = new ArrayList<>(keys);
        outKeys.add(key);
        return new TimeSeriesMatrix<>(index, out, Collections.unmodifiableList(outKeys), false);
    }

    // ========== Iteration ==========

    /**
     * @return a restartable view over (key, column) pairs in column order
     */
    public Iterable<KeyedSeries<K>> series() {
        return () -> new PositionIterator<>(keys.size(), c -> new KeyedSeries<>(keys.get(c), column(c)));
    }

    /**
     * @return a restartable view over (timestamp, row) pairs in index order
     */
    public Iterable<TimestampedRow> instants() {
        return () -> new PositionIterator<>(rows, this::row);
    }

    /**
     * @return every row with its timestamp, in index order
     */
    public List<TimestampedRow> toInstants() {
        List<TimestampedRow> instants = new ArrayList<>(rows);
        for (TimestampedRow row : instants()) {
            instants.add(row);
        }
        return instants;
    }

    private TimestampedRow row(int r) {
        int columns = keys.size();
        double[] values = new double[columns];
        for (int c = 0; c < columns; c++) {
            values[c] = data[c * rows + r];
        }
        return new TimestampedRow(index.timestampAt(r), values);
    }

    /**
     * Read-only iterator over positions {@code 0..size-1}; {@link Iterator#remove()} is unsupported.
     */
    private static final class PositionIterator<T> implements Iterator<T> {
        private final int size;
        private final Function<Integer, T> producer;
        private int position;

        PositionIterator(int size, Function<Integer, T> producer) {
            this.size = size;
            this.producer = producer;
        }

        @Override
        public boolean hasNext() {
            return position < size;
        }

        @Override
        public T next() {
            if (position >= size) {
                throw new NoSuchElementException();
            }
            return producer.apply(position++);
        }
    }

    private void checkRow(int row) {
        if (row < 0 || row >= rows) {
            throw new IndexOutOfRangeException("row [{}] is out of range for [{}] rows", row, rows);
        }
    }

    private void checkColumn(int column) {
        if (column < 0 || column >= keys.size()) {
            throw new IndexOutOfRangeException("column [{}] is out of range for [{}] columns", column, keys.size());
        }
    }

    private void checkLag(int lag) {
        if (lag < 0 || lag > rows) {
            throw new IndexOutOfRangeException("lag [{}] is out of range for [{}] rows", lag, rows);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TimeSeriesMatrix<?> that = (TimeSeriesMatrix<?>) o;
        return index.equals(that.index) && keys.equals(that.keys) && Arrays.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, keys, Arrays.hashCode(data));
    }

    @Override
    public String toString() {
        return "TimeSeriesMatrix{" + "index=" + index + ", keys=" + keys + ", rows=" + rows + '}';
    }
}
