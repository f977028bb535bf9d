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

import com.arpnetworking.logback.annotations.LogValue;
import com.arpnetworking.steno.LogValueMapFactory;
import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

import java.util.List;

/**
 * Append-only matrix of offset bin vectors, one row per processed gather in
 * processing order. A cell value of zero means no trace fell into the bin.
 * Appending is not thread safe; rows are copied on the way in and out.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class OffsetBinMatrix {

    /**
     * Public constructor.
     *
     * @param binCount The length of every row.
     */
    public OffsetBinMatrix(final int binCount) {
        Preconditions.checkArgument(binCount > 0, "Bin count must be positive; binCount=%s", binCount);
        _binCount = binCount;
    }

    /**
     * Create a matrix from existing rows.
     *
     * @param rows The rows; all of the same, non-zero length.
     * @return A new {@link OffsetBinMatrix}.
     */
    public static OffsetBinMatrix of(final double[]... rows) {
        Preconditions.checkArgument(rows.length > 0, "At least one row is required");
        final OffsetBinMatrix matrix = new OffsetBinMatrix(rows[0].length);
        for (final double[] row : rows) {
            matrix.append(row);
        }
        return matrix;
    }

    /**
     * Append a row.
     *
     * @param row The offset bin vector of one gather.
     */
    public void append(final double[] row) {
        Preconditions.checkArgument(
                row.length == _binCount,
                "Row length does not match bin count; length=%s, binCount=%s",
                row.length,
                _binCount);
        _rows.add(row.clone());
    }

    public int getBinCount() {
        return _binCount;
    }

    public int getRowCount() {
        return _rows.size();
    }

    /**
     * Copy of one row.
     *
     * @param index The row index in processing order.
     * @return The offset bin vector.
     */
    public double[] getRow(final int index) {
        return _rows.get(index).clone();
    }

    /**
     * The values of one bin across all rows.
     *
     * @param bin The bin index.
     * @return The bin values in row order.
     */
    public double[] getColumn(final int bin) {
        Preconditions.checkElementIndex(bin, _binCount, "bin");
        final double[] column = new double[_rows.size()];
        for (int row = 0; row < column.length; ++row) {
            column[row] = _rows.get(row)[bin];
        }
        return column;
    }

    /**
     * Copy of the matrix indexed {@code [row][bin]}.
     *
     * @return The rows.
     */
    public double[][] toArray() {
        final double[][] array = new double[_rows.size()][];
        for (int row = 0; row < array.length; ++row) {
            array[row] = _rows.get(row).clone();
        }
        return array;
    }

    /**
     * Generate a Steno log compatible representation.
     *
     * @return Steno log compatible representation.
     */
    @LogValue
    public Object toLogValue() {
        return LogValueMapFactory.builder(this)
                .put("binCount", _binCount)
                .put("rowCount", _rows.size())
                .build();
    }

    @Override
    public String toString() {
        return toLogValue().toString();
    }

    private final int _binCount;
    private final List<double[]> _rows = Lists.newArrayList();
}
