/*
 * Copyright 2024 Inscope Metrics
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.arpnetworking.seismicqc.aggregation;

import com.arpnetworking.seismicqc.models.BinGrid;
import com.arpnetworking.seismicqc.models.MetricSample;
import com.arpnetworking.seismicqc.statistics.Reducer;
import com.arpnetworking.seismicqc.statistics.ReducerFactory;
import com.arpnetworking.seismicqc.utility.ParallelExecutor;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.google.common.collect.ImmutableList;

import java.util.Arrays;

/**
 * Folds a {@link MetricsMap} into a regular grid of square cells. Cells start
 * at the smallest coordinate of each axis; a sample belongs to the cell whose
 * start {@code s} satisfies {@code v - s >= 0 && v - s < binSize} on both
 * axes. Cells without samples hold {@code NaN}. Grid columns are computed in
 * parallel.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class MetricGridBuilder {

    /**
     * Public constructor. Grids built without an explicit cell size or
     * reducer use {@code 500} and {@code mean}.
     *
     * @param executor The worker pool.
     * @param reducerFactory Resolves reducer names.
     */
    public MetricGridBuilder(final ParallelExecutor executor, final ReducerFactory reducerFactory) {
        this(executor, reducerFactory, DEFAULT_BIN_SIZE, DEFAULT_REDUCER);
    }

    /**
     * Public constructor.
     *
     * @param executor The worker pool.
     * @param reducerFactory Resolves reducer names.
     * @param defaultBinSize The cell size used when none is given.
     * @param defaultReducer The name of the reducer used when none is given.
     */
    public MetricGridBuilder(
            final ParallelExecutor executor,
            final ReducerFactory reducerFactory,
            final double defaultBinSize,
            final String defaultReducer) {
        checkBinSize(defaultBinSize);
        _executor = executor;
        _reducerFactory = reducerFactory;
        _defaultBinSize = defaultBinSize;
        _defaultReducer = reducerFactory.getReducer(defaultReducer);
    }

    /**
     * Build a grid with the default cell size and reducer.
     *
     * @param map The samples.
     * @return The grid.
     */
    public BinGrid build(final MetricsMap map) {
        return build(map, _defaultBinSize, _defaultReducer);
    }

    /**
     * Build a grid with the default reducer.
     *
     * @param map The samples.
     * @param binSize The cell size.
     * @return The grid.
     */
    public BinGrid build(final MetricsMap map, final double binSize) {
        return build(map, binSize, _defaultReducer);
    }

    /**
     * Build a grid with a named reducer.
     *
     * @param map The samples.
     * @param binSize The cell size.
     * @param reducerName The name or alias of the reducer.
     * @return The grid.
     */
    public BinGrid build(final MetricsMap map, final double binSize, final String reducerName) {
        return build(map, binSize, _reducerFactory.getReducer(reducerName));
    }

    /**
     * Build a grid.
     *
     * @param map The samples.
     * @param binSize The cell size.
     * @param reducer Reduces the values of one cell.
     * @return The grid.
     */
    public BinGrid build(final MetricsMap map, final double binSize, final Reducer reducer) {
        checkBinSize(binSize);
        if (map.isEmpty()) {
            throw new IllegalArgumentException("Cannot build a grid from an empty metrics map");
        }
        final ImmutableList<MetricSample> samples = map.getSamples();
        final double[] xs = new double[samples.size()];
        final double[] ys = new double[samples.size()];
        final double[] values = new double[samples.size()];
        for (int i = 0; i < xs.length; ++i) {
            final MetricSample sample = samples.get(i);
            xs[i] = sample.getX();
            ys[i] = sample.getY();
            values[i] = sample.getValue();
        }
        final double xMin = Arrays.stream(xs).min().getAsDouble();
        final double xMax = Arrays.stream(xs).max().getAsDouble();
        final double yMin = Arrays.stream(ys).min().getAsDouble();
        final double yMax = Arrays.stream(ys).max().getAsDouble();
        final int columns = cellCount(xMin, xMax, binSize);
        final int rows = cellCount(yMin, yMax, binSize);

        LOGGER.debug()
                .setMessage("Building metric grid")
                .addData("samples", samples.size())
                .addData("rows", rows)
                .addData("columns", columns)
                .addData("binSize", binSize)
                .addData("reducer", reducer.getName())
                .log();

        final double[][] grid = new double[rows][columns];
        _executor.forEachIndex(columns, column -> {
            final double xStart = xMin + column * binSize;
            final int[] inColumn = new int[xs.length];
            int inColumnCount = 0;
            for (int i = 0; i < xs.length; ++i) {
                if (contains(xStart, binSize, xs[i])) {
                    inColumn[inColumnCount++] = i;
                }
            }
            final double[] cell = new double[inColumnCount];
            for (int row = 0; row < rows; ++row) {
                final double yStart = yMin + row * binSize;
                int count = 0;
                for (int k = 0; k < inColumnCount; ++k) {
                    final int index = inColumn[k];
                    if (contains(yStart, binSize, ys[index])) {
                        cell[count++] = values[index];
                    }
                }
                grid[row][column] = count == 0
                        ? Double.NaN
                        : reducer.reduce(Arrays.copyOf(cell, count));
            }
        });

        return new BinGrid.Builder()
                .setValues(grid)
                .setBinSize(binSize)
                .setXMin(xMin)
                .setXMax(xMax)
                .setYMin(yMin)
                .setYMax(yMax)
                .build();
    }

    public double getDefaultBinSize() {
        return _defaultBinSize;
    }

    public Reducer getDefaultReducer() {
        return _defaultReducer;
    }

    private static void checkBinSize(final double binSize) {
        if (!(binSize > 0) || Double.isInfinite(binSize)) {
            throw new IllegalArgumentException(String.format("Bin size must be positive and finite; binSize=%s", binSize));
        }
    }

    private static boolean contains(final double start, final double binSize, final double value) {
        return value - start >= 0 && value - start < binSize;
    }

    private static int cellCount(final double min, final double max, final double binSize) {
        return (int) Math.ceil((max + binSize - min) / binSize);
    }

    private final ParallelExecutor _executor;
    private final ReducerFactory _reducerFactory;
    private final double _defaultBinSize;
    private final Reducer _defaultReducer;

    private static final double DEFAULT_BIN_SIZE = 500.0;
    private static final String DEFAULT_REDUCER = "mean";
    private static final Logger LOGGER = LoggerFactory.getLogger(MetricGridBuilder.class);
}
