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
import com.arpnetworking.seismicqc.models.MetricSample;
import com.arpnetworking.steno.LogValueMapFactory;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;

import java.util.List;
import java.util.Set;

/**
 * Ordered collection of per-gather metric samples at map coordinates.
 * {@link #build(double[][], double[])} keeps only the first sample at each
 * coordinate; {@link #merge(MetricsMap)} concatenates without deduplication.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class MetricsMap {

    /**
     * Create a map from coordinates and values, keeping the first value at
     * each coordinate.
     *
     * @param coordinates The {@code (x, y)} pairs.
     * @param values The value at each coordinate.
     * @return A new {@link MetricsMap}.
     */
    public static MetricsMap build(final double[][] coordinates, final double[] values) {
        if (coordinates.length != values.length) {
            throw new IllegalArgumentException(String.format(
                    "Coordinate and value counts do not match; coordinates=%d, values=%d",
                    coordinates.length,
                    values.length));
        }
        final Set<List<Double>> seen = Sets.newHashSetWithExpectedSize(coordinates.length);
        final ImmutableList.Builder<MetricSample> samples = ImmutableList.builder();
        for (int i = 0; i < coordinates.length; ++i) {
            final double[] coordinate = coordinates[i];
            if (coordinate.length != 2) {
                throw new IllegalArgumentException(String.format(
                        "Coordinate must have two components; index=%d, length=%d",
                        i,
                        coordinate.length));
            }
            if (seen.add(ImmutableList.of(normalize(coordinate[0]), normalize(coordinate[1])))) {
                samples.add(new MetricSample(coordinate[0], coordinate[1], values[i]));
            }
        }
        return new MetricsMap(samples.build());
    }

    /**
     * Create a map from separate coordinate arrays.
     *
     * @param x The x coordinates.
     * @param y The y coordinates.
     * @param values The value at each coordinate.
     * @return A new {@link MetricsMap}.
     */
    public static MetricsMap build(final double[] x, final double[] y, final double[] values) {
        if (x.length != y.length) {
            throw new IllegalArgumentException(String.format(
                    "Coordinate counts do not match; x=%d, y=%d",
                    x.length,
                    y.length));
        }
        final double[][] coordinates = new double[x.length][];
        for (int i = 0; i < x.length; ++i) {
            coordinates[i] = new double[] {x[i], y[i]};
        }
        return build(coordinates, values);
    }

    /**
     * Concatenate the samples of another map after these. Duplicate
     * coordinates across the two maps are kept.
     *
     * @param other The map to append.
     * @return A new {@link MetricsMap}.
     */
    public MetricsMap merge(final MetricsMap other) {
        return new MetricsMap(ImmutableList.<MetricSample>builder()
                .addAll(_samples)
                .addAll(other._samples)
                .build());
    }

    public ImmutableList<MetricSample> getSamples() {
        return _samples;
    }

    public int size() {
        return _samples.size();
    }

    public boolean isEmpty() {
        return _samples.isEmpty();
    }

    /**
     * Generate a Steno log compatible representation.
     *
     * @return Steno log compatible representation.
     */
    @LogValue
    public Object toLogValue() {
        return LogValueMapFactory.builder(this)
                .put("samples", _samples.size())
                .build();
    }

    @Override
    public String toString() {
        return toLogValue().toString();
    }

    // -0.0 and 0.0 are the same coordinate
    private static double normalize(final double value) {
        return value == 0.0 ? 0.0 : value;
    }

    private MetricsMap(final ImmutableList<MetricSample> samples) {
        _samples = samples;
    }

    private final ImmutableList<MetricSample> _samples;
}
