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

import com.arpnetworking.logback.annotations.LogValue;
import com.arpnetworking.seismicqc.models.BinSpecification;
import com.arpnetworking.seismicqc.models.OffsetBinMatrix;
import com.arpnetworking.seismicqc.models.SeriesPoint;
import com.arpnetworking.steno.LogValueMapFactory;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import java.util.List;
import java.util.Map;

/**
 * Long form table of several offset bin matrices for side by side comparison.
 * Every non-zero cell becomes one {@code (value, offset, name)} point; bins
 * whose cells sum to zero are skipped. Offsets come from the
 * {@link BinSpecification} the matrices were binned with.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class SeriesComparison {

    /**
     * Public constructor.
     *
     * @param binSpecification The bins the matrices were built with.
     * @param alignMean Whether to shift every series to the global mean.
     */
    public SeriesComparison(final BinSpecification binSpecification, final boolean alignMean) {
        _binSpecification = binSpecification;
        _alignMean = alignMean;
    }

    /**
     * Build the table for unnamed series; series are named by their position.
     *
     * @param series The matrices.
     * @return The points, series by series, bin by bin, row by row.
     */
    public ImmutableList<SeriesPoint> build(final List<OffsetBinMatrix> series) {
        final Map<String, OffsetBinMatrix> named = Maps.newLinkedHashMap();
        for (int i = 0; i < series.size(); ++i) {
            named.put(String.valueOf(i), series.get(i));
        }
        return build(named);
    }

    /**
     * Build the table for named series.
     *
     * @param series The matrices by name, in iteration order.
     * @return The points, series by series, bin by bin, row by row.
     */
    public ImmutableList<SeriesPoint> build(final Map<String, OffsetBinMatrix> series) {
        final Map<String, List<SeriesPoint>> pointsByName = Maps.newLinkedHashMap();
        double total = 0.0;
        int count = 0;
        for (final Map.Entry<String, OffsetBinMatrix> entry : series.entrySet()) {
            final List<SeriesPoint> points = Lists.newArrayList();
            final OffsetBinMatrix matrix = entry.getValue();
            for (int bin = 0; bin < matrix.getBinCount(); ++bin) {
                final double[] column = matrix.getColumn(bin);
                double sum = 0.0;
                for (final double value : column) {
                    sum += value;
                }
                if (sum == 0.0) {
                    continue;
                }
                final double offset = _binSpecification.getBinOffset(bin);
                for (final double value : column) {
                    if (value != 0.0) {
                        points.add(new SeriesPoint(value, offset, entry.getKey()));
                        total += value;
                        ++count;
                    }
                }
            }
            pointsByName.put(entry.getKey(), points);
        }

        final ImmutableList.Builder<SeriesPoint> table = ImmutableList.builder();
        final double globalMean = count == 0 ? 0.0 : total / count;
        for (final List<SeriesPoint> points : pointsByName.values()) {
            if (!_alignMean || points.isEmpty()) {
                table.addAll(points);
                continue;
            }
            double seriesTotal = 0.0;
            for (final SeriesPoint point : points) {
                seriesTotal += point.getValue();
            }
            final double shift = globalMean - seriesTotal / points.size();
            for (final SeriesPoint point : points) {
                table.add(point.shift(shift));
            }
        }
        final ImmutableList<SeriesPoint> result = table.build();
        LOGGER.debug()
                .setMessage("Built series comparison")
                .addData("series", series.size())
                .addData("points", result.size())
                .addData("alignMean", _alignMean)
                .log();
        return result;
    }

    /**
     * Generate a Steno log compatible representation.
     *
     * @return Steno log compatible representation.
     */
    @LogValue
    public Object toLogValue() {
        return LogValueMapFactory.builder(this)
                .put("binSpecification", _binSpecification)
                .put("alignMean", _alignMean)
                .build();
    }

    @Override
    public String toString() {
        return toLogValue().toString();
    }

    private final BinSpecification _binSpecification;
    private final boolean _alignMean;

    private static final Logger LOGGER = LoggerFactory.getLogger(SeriesComparison.class);
}
