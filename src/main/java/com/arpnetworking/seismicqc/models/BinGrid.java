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
package com.arpnetworking.seismicqc.models;

import com.arpnetworking.commons.builder.OvalBuilder;
import com.arpnetworking.seismicqc.utility.NanMath;
import com.google.common.base.MoreObjects;
import net.sf.oval.constraint.NotNull;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

/**
 * Regular two-dimensional aggregate grid indexed {@code [row][column]} where
 * rows follow the y axis and columns the x axis. Cells without samples hold
 * {@code NaN}. Row {@code j} covers {@code [originY + j * binSize,
 * originY + (j + 1) * binSize)} and column {@code i} likewise on x.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class BinGrid {

    public int getRowCount() {
        return _values.length;
    }

    public int getColumnCount() {
        return _values.length == 0 ? 0 : _values[0].length;
    }

    /**
     * Value of a cell.
     *
     * @param row The row (y bin) index.
     * @param column The column (x bin) index.
     * @return The aggregate, or {@code NaN} for a cell without samples.
     */
    public double getValue(final int row, final int column) {
        return _values[row][column];
    }

    /**
     * Whether a cell received no samples.
     *
     * @param row The row (y bin) index.
     * @param column The column (x bin) index.
     * @return True if and only if the cell holds the no-samples sentinel.
     */
    public boolean isEmpty(final int row, final int column) {
        return Double.isNaN(_values[row][column]);
    }

    /**
     * Copy of the cell values.
     *
     * @return The values indexed {@code [row][column]}.
     */
    public double[][] getValues() {
        final double[][] copy = new double[_values.length][];
        for (int row = 0; row < _values.length; ++row) {
            copy[row] = _values[row].clone();
        }
        return copy;
    }

    public double getBinSize() {
        return _binSize;
    }

    public double getXMin() {
        return _xMin;
    }

    public double getXMax() {
        return _xMax;
    }

    public double getYMin() {
        return _yMin;
    }

    public double getYMax() {
        return _yMax;
    }

    /**
     * Colour scale limits for rendering: the 5th and 95th percentiles of the
     * non-empty cells, with the lower limit at most {@code -1e-6} and the upper
     * at least {@code 1e-6} so that zero always lies inside the range.
     *
     * @return The {@link DisplayRange}.
     */
    public DisplayRange getDisplayRange() {
        final double[] present = NanMath.dropNan(flatten());
        if (present.length == 0) {
            return new DisplayRange(-DISPLAY_EPSILON, DISPLAY_EPSILON);
        }
        final Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        percentile.setData(present);
        return new DisplayRange(
                Math.min(percentile.evaluate(LOWER_DISPLAY_PERCENTILE), -DISPLAY_EPSILON),
                Math.max(percentile.evaluate(UPPER_DISPLAY_PERCENTILE), DISPLAY_EPSILON));
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", Integer.toHexString(System.identityHashCode(this)))
                .add("Rows", getRowCount())
                .add("Columns", getColumnCount())
                .add("BinSize", _binSize)
                .add("XMin", _xMin)
                .add("XMax", _xMax)
                .add("YMin", _yMin)
                .add("YMax", _yMax)
                .toString();
    }

    private double[] flatten() {
        final double[] flat = new double[getRowCount() * getColumnCount()];
        int index = 0;
        for (final double[] row : _values) {
            System.arraycopy(row, 0, flat, index, row.length);
            index += row.length;
        }
        return flat;
    }

    private BinGrid(final Builder builder) {
        _values = builder._values;
        _binSize = builder._binSize;
        _xMin = builder._xMin;
        _xMax = builder._xMax;
        _yMin = builder._yMin;
        _yMax = builder._yMax;
    }

    private final double[][] _values;
    private final double _binSize;
    private final double _xMin;
    private final double _xMax;
    private final double _yMin;
    private final double _yMax;

    private static final double DISPLAY_EPSILON = 1e-6;
    private static final double LOWER_DISPLAY_PERCENTILE = 5.0;
    private static final double UPPER_DISPLAY_PERCENTILE = 95.0;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link BinGrid}.
     */
    public static final class Builder extends OvalBuilder<BinGrid> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(BinGrid::new);
        }

        /**
         * Set the cell values indexed {@code [row][column]}. Required. Cannot
         * be null. The array is not copied.
         *
         * @param value The cell values.
         * @return This {@link Builder} instance.
         */
        public Builder setValues(final double[][] value) {
            _values = value;
            return this;
        }

        /**
         * Set the bin size. Required. Cannot be null.
         *
         * @param value The bin size.
         * @return This {@link Builder} instance.
         */
        public Builder setBinSize(final Double value) {
            _binSize = value;
            return this;
        }

        /**
         * Set the smallest sample x coordinate. Required. Cannot be null.
         *
         * @param value The minimum x.
         * @return This {@link Builder} instance.
         */
        public Builder setXMin(final Double value) {
            _xMin = value;
            return this;
        }

        /**
         * Set the largest sample x coordinate. Required. Cannot be null.
         *
         * @param value The maximum x.
         * @return This {@link Builder} instance.
         */
        public Builder setXMax(final Double value) {
            _xMax = value;
            return this;
        }

        /**
         * Set the smallest sample y coordinate. Required. Cannot be null.
         *
         * @param value The minimum y.
         * @return This {@link Builder} instance.
         */
        public Builder setYMin(final Double value) {
            _yMin = value;
            return this;
        }

        /**
         * Set the largest sample y coordinate. Required. Cannot be null.
         *
         * @param value The maximum y.
         * @return This {@link Builder} instance.
         */
        public Builder setYMax(final Double value) {
            _yMax = value;
            return this;
        }

        @NotNull
        private double[][] _values;
        @NotNull
        private Double _binSize;
        @NotNull
        private Double _xMin;
        @NotNull
        private Double _xMax;
        @NotNull
        private Double _yMin;
        @NotNull
        private Double _yMax;
    }
}
