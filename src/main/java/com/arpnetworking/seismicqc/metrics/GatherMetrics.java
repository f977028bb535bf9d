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
package com.arpnetworking.seismicqc.metrics;

import com.arpnetworking.seismicqc.models.GatherRecord;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * The built-in {@link GatherMetric} instances and lookup by name.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class GatherMetrics {

    /**
     * Get a metric by name.
     *
     * @param name The name of the metric.
     * @return The {@link GatherMetric}.
     */
    public static GatherMetric getMetric(final String name) {
        final GatherMetric metric = METRICS_BY_NAME.get(name);
        if (metric == null) {
            throw new IllegalArgumentException(String.format("Invalid gather metric name; name=%s", name));
        }
        return metric;
    }

    /**
     * Largest per-column range of the semblance.
     */
    public static final GatherMetric MINMAX_SPREAD = new SimpleGatherMetric(
            "minmax_spread",
            ImmutableList.of("minmax_spread"),
            gather -> new double[] {
                SemblanceMetrics.minmaxSpread(require(gather, "semblance", GatherRecord::getSemblance)),
            });

    /**
     * Largest per-row standard deviation of the semblance.
     */
    public static final GatherMetric STD_SPREAD = new SimpleGatherMetric(
            "std_spread",
            ImmutableList.of("std_spread"),
            gather -> new double[] {
                SemblanceMetrics.stdSpread(require(gather, "semblance", GatherRecord::getSemblance)),
            });

    /**
     * Mean apparent velocity of the picks.
     */
    public static final GatherMetric VELOCITY = new SimpleGatherMetric(
            "velocity",
            ImmutableList.of("velocity"),
            gather -> new double[] {
                PickingMetrics.velocity(
                        require(gather, "pickingTimes", GatherRecord::getPickingTimes),
                        require(gather, "offsets", GatherRecord::getOffsets)),
            });

    /**
     * Robust linear moveout residual and elevation effect.
     */
    public static final GatherMetric LINEAR_DIFF = new SimpleGatherMetric(
            "linear_diff",
            ImmutableList.of("linear_diff_residual", "linear_diff_elevation"),
            gather -> PickingMetrics.linearDiff(
                    require(gather, "pickingTimes", GatherRecord::getPickingTimes),
                    require(gather, "offsets", GatherRecord::getOffsets),
                    require(gather, "receiverX", GatherRecord::getReceiverX),
                    require(gather, "receiverY", GatherRecord::getReceiverY),
                    require(gather, "receiverElevation", GatherRecord::getReceiverElevation),
                    require(gather, "sourceX", GatherRecord::getSourceX),
                    require(gather, "sourceY", GatherRecord::getSourceY),
                    require(gather, "sourceElevation", GatherRecord::getSourceElevation)));

    private static <T> T require(
            final GatherRecord gather,
            final String field,
            final Function<GatherRecord, Optional<T>> accessor) {
        return accessor.apply(gather).orElseThrow(() -> new IllegalArgumentException(String.format(
                "Gather is missing a required field; id=%d, field=%s",
                gather.getId(),
                field)));
    }

    private GatherMetrics() {}

    private static final ImmutableMap<String, GatherMetric> METRICS_BY_NAME;

    static {
        final Map<String, GatherMetric> metricsByName = Maps.newLinkedHashMap();
        for (final GatherMetric metric : ImmutableList.of(MINMAX_SPREAD, STD_SPREAD, VELOCITY, LINEAR_DIFF)) {
            metricsByName.put(metric.getName(), metric);
        }
        METRICS_BY_NAME = ImmutableMap.copyOf(metricsByName);
    }

    private static final class SimpleGatherMetric implements GatherMetric {

        SimpleGatherMetric(
                final String name,
                final ImmutableList<String> outputNames,
                final Function<GatherRecord, double[]> function) {
            _name = name;
            _outputNames = outputNames;
            _function = function;
        }

        @Override
        public String getName() {
            return _name;
        }

        @Override
        public ImmutableList<String> getOutputNames() {
            return _outputNames;
        }

        @Override
        public double[] compute(final GatherRecord gather) {
            return _function.apply(gather);
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(this)
                    .add("name", _name)
                    .add("outputNames", _outputNames)
                    .toString();
        }

        private final String _name;
        private final ImmutableList<String> _outputNames;
        private final Function<GatherRecord, double[]> _function;
    }
}
